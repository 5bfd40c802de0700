package com.streamfirst.nomicon.application;

import com.streamfirst.nomicon.domain.ConstraintViolationException;
import com.streamfirst.nomicon.domain.ConstraintViolationException.Rule;
import com.streamfirst.nomicon.domain.ResourceConstraint;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.BiPredicate;
import java.util.regex.Pattern;

/**
 * Checks finished names against per-resource structural constraints. Checks run in a fixed
 * order and stop at the first violation.
 */
public final class ConstraintValidator {

    private static final Pattern DOTTED_QUAD =
        Pattern.compile("^(25[0-5]|2[0-4][0-9]|1[0-9][0-9]|[1-9]?[0-9])(\\.(25[0-5]|2[0-4][0-9]|1[0-9][0-9]|[1-9]?[0-9])){3}$");
    private static final String MAPPED_IPV4_PREFIX = "::ffff:";

    private ConstraintValidator() {
    }

    /**
     * Validates a name for a resource type. An empty key, an empty name or a key without a
     * constraint entry always passes.
     *
     * @throws ConstraintViolationException on the first rule the name breaks
     */
    public static void validate(String resourceKey, String name, Map<String, ResourceConstraint> constraints) {
        if (resourceKey == null || resourceKey.isEmpty() || name == null || name.isEmpty()) {
            return;
        }
        ResourceConstraint constraint = constraints.get(resourceKey);
        if (constraint == null) {
            return;
        }
        validate(resourceKey, name, constraint);
    }

    static void validate(String resourceKey, String name, ResourceConstraint constraint) {
        if (constraint.getMinLength() > 0 && name.length() < constraint.getMinLength()) {
            throw new ConstraintViolationException(resourceKey, name, Rule.MIN_LENGTH,
                "is shorter than " + constraint.getMinLength() + " characters");
        }
        if (constraint.getMaxLength() > 0 && name.length() > constraint.getMaxLength()) {
            throw new ConstraintViolationException(resourceKey, name, Rule.MAX_LENGTH,
                "exceeds " + constraint.getMaxLength() + " characters");
        }
        Pattern pattern = constraint.getPattern();
        if (pattern != null && !pattern.matcher(name).find()) {
            String description = constraint.getPatternDescription().isEmpty()
                ? pattern.pattern()
                : constraint.getPatternDescription();
            throw new ConstraintViolationException(resourceKey, name, Rule.PATTERN, "must match: " + description);
        }

        boolean fold = constraint.isCaseInsensitive();
        String comparable = fold ? name.toLowerCase(Locale.ROOT) : name;

        String prefix = firstMatch(constraint.getForbiddenPrefixes(), comparable, fold, String::startsWith);
        if (prefix != null) {
            throw new ConstraintViolationException(resourceKey, name, Rule.FORBIDDEN_PREFIX,
                "must not start with prefix \"" + prefix + "\"");
        }
        String suffix = firstMatch(constraint.getForbiddenSuffixes(), comparable, fold, String::endsWith);
        if (suffix != null) {
            throw new ConstraintViolationException(resourceKey, name, Rule.FORBIDDEN_SUFFIX,
                "must not end with suffix \"" + suffix + "\"");
        }
        String substring = firstMatch(constraint.getForbiddenSubstrings(), comparable, fold, String::contains);
        if (substring != null) {
            throw new ConstraintViolationException(resourceKey, name, Rule.FORBIDDEN_SUBSTRING,
                "must not contain \"" + substring + "\"");
        }

        if (constraint.isDisallowIpAddress() && isIpv4Address(name)) {
            throw new ConstraintViolationException(resourceKey, name, Rule.IP_ADDRESS,
                "must not be formatted as an IP address");
        }
    }

    /** Returns the first non-empty candidate (as configured) that the test accepts, or null. */
    private static String firstMatch(
            List<String> candidates, String comparable, boolean fold, BiPredicate<String, String> test) {
        for (String candidate : candidates) {
            if (candidate == null || candidate.isEmpty()) {
                continue;
            }
            String folded = fold ? candidate.toLowerCase(Locale.ROOT) : candidate;
            if (test.test(comparable, folded)) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * True for a dotted-quad IPv4 literal, or the same literal in IPv4-mapped IPv6 form. Never
     * resolves host names.
     */
    static boolean isIpv4Address(String value) {
        String candidate = value;
        if (candidate.regionMatches(true, 0, MAPPED_IPV4_PREFIX, 0, MAPPED_IPV4_PREFIX.length())) {
            candidate = candidate.substring(MAPPED_IPV4_PREFIX.length());
        }
        return DOTTED_QUAD.matcher(candidate).matches();
    }
}
