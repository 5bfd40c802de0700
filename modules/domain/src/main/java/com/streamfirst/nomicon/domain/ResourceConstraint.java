package com.streamfirst.nomicon.domain;

import java.util.List;
import java.util.regex.Pattern;
import lombok.Builder;
import lombok.Value;

/**
 * Structural rules a finished name must satisfy for one resource type. Zero lengths mean "no
 * bound" and a null pattern means "any shape". A resource type without a constraint entry accepts
 * every name.
 */
@Value
public class ResourceConstraint {
  /** Minimum length, inclusive; 0 disables the check */
  int minLength;

  /** Maximum length, inclusive; 0 disables the check */
  int maxLength;

  /** Pattern the whole name must match, or null */
  Pattern pattern;

  /** Human-readable form of the pattern used in violation messages */
  String patternDescription;

  List<String> forbiddenPrefixes;
  List<String> forbiddenSuffixes;
  List<String> forbiddenSubstrings;

  /** Reject names that parse as an IPv4 literal */
  boolean disallowIpAddress;

  /** Compare forbidden affixes and substrings case-insensitively */
  boolean caseInsensitive;

  @Builder(toBuilder = true)
  private ResourceConstraint(
      int minLength,
      int maxLength,
      Pattern pattern,
      String patternDescription,
      List<String> forbiddenPrefixes,
      List<String> forbiddenSuffixes,
      List<String> forbiddenSubstrings,
      boolean disallowIpAddress,
      boolean caseInsensitive) {
    this.minLength = minLength;
    this.maxLength = maxLength;
    this.pattern = pattern;
    this.patternDescription = patternDescription == null ? "" : patternDescription;
    this.forbiddenPrefixes = forbiddenPrefixes == null ? List.of() : List.copyOf(forbiddenPrefixes);
    this.forbiddenSuffixes = forbiddenSuffixes == null ? List.of() : List.copyOf(forbiddenSuffixes);
    this.forbiddenSubstrings =
        forbiddenSubstrings == null ? List.of() : List.copyOf(forbiddenSubstrings);
    this.disallowIpAddress = disallowIpAddress;
    this.caseInsensitive = caseInsensitive;
  }

  /**
   * Builds a constraint with a compiled pattern and its description.
   */
  public static ResourceConstraint of(int minLength, int maxLength, String regex, String description) {
    return builder()
        .minLength(minLength)
        .maxLength(maxLength)
        .pattern(Pattern.compile(regex))
        .patternDescription(description)
        .build();
  }
}
