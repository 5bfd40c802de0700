package com.streamfirst.nomicon.domain;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A successfully built and validated name together with everything that went into it.
 */
@Value
@Builder
public class BuildResult {
  /** The final, validated name */
  @NonNull String name;

  /** The style the name was rendered in */
  @NonNull NamingStyle style;

  /** Every resolved component, canonical keys first, after overrides */
  @NonNull Map<String, String> components;

  /** The non-empty component values that were joined, in recipe order */
  @NonNull List<String> parts;

  @NonNull String regionCode;

  @NonNull String resourceAcronym;
}
