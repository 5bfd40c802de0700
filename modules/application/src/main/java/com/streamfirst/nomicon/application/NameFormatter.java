package com.streamfirst.nomicon.application;

import com.streamfirst.nomicon.domain.NamingStyle;
import com.streamfirst.nomicon.domain.UnsupportedStyleException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Joins name components under a naming style. Each component is first split into maximal runs
 * of ASCII letters and digits; every other character separates runs and is dropped.
 */
public final class NameFormatter {

    private static final Pattern WORD = Pattern.compile("[A-Za-z0-9]+");

    private NameFormatter() {
    }

    /**
     * Formats components under a style given by wire name.
     *
     * @throws UnsupportedStyleException if the wire name is not a known style
     */
    public static String format(String style, List<String> parts) {
        NamingStyle resolved = NamingStyle.fromWireName(style)
            .orElseThrow(() -> new UnsupportedStyleException(String.format("unsupported style \"%s\"", style)));
        return format(resolved, parts);
    }

    public static String format(NamingStyle style, List<String> parts) {
        switch (style) {
            case DASHED:
                return String.join("-", lowercased(parts, "-"));
            case UNDERSCORE:
                return String.join("_", lowercased(parts, "_"));
            case STRAIGHT:
                return String.join("", lowercased(parts, ""));
            case PASCAL:
                return pascal(parts);
            case PASCAL_DASHED:
                return pascalDashed(parts);
            case CAMEL:
                return camel(parts);
            default:
                throw new UnsupportedStyleException(String.format("unsupported style \"%s\"", style));
        }
    }

    /** Lowercases each component's runs joined by the separator; components without runs vanish. */
    private static List<String> lowercased(List<String> parts, String separator) {
        List<String> out = new ArrayList<>(parts.size());
        for (String part : parts) {
            List<String> words = splitWords(part);
            if (!words.isEmpty()) {
                out.add(String.join(separator, words).toLowerCase(Locale.ROOT));
            }
        }
        return out;
    }

    private static String pascal(List<String> parts) {
        StringBuilder out = new StringBuilder();
        for (String part : parts) {
            out.append(pascalize(part));
        }
        return out.toString();
    }

    private static String pascalDashed(List<String> parts) {
        List<String> words = new ArrayList<>();
        for (String part : parts) {
            for (String word : splitWords(part)) {
                words.add(titleWord(word));
            }
        }
        return String.join("-", words);
    }

    private static String camel(List<String> parts) {
        if (parts.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder(String.join("", splitWords(parts.get(0))).toLowerCase(Locale.ROOT));
        for (String part : parts.subList(1, parts.size())) {
            out.append(pascalize(part));
        }
        return out.toString();
    }

    private static String pascalize(String value) {
        StringBuilder out = new StringBuilder();
        for (String word : splitWords(value)) {
            out.append(titleWord(word));
        }
        return out.toString();
    }

    static List<String> splitWords(String value) {
        List<String> words = new ArrayList<>();
        if (value == null) {
            return words;
        }
        Matcher matcher = WORD.matcher(value);
        while (matcher.find()) {
            words.add(matcher.group());
        }
        return words;
    }

    static String titleWord(String word) {
        if (word.length() <= 1) {
            return word.toUpperCase(Locale.ROOT);
        }
        return word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1).toLowerCase(Locale.ROOT);
    }
}
