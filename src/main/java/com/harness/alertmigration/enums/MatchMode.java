package com.harness.alertmigration.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Aggregation applied to a list of rule predicates. Stored lowercase in rule data.
 */
public enum MatchMode {
  ALL,
  ANY,
  NONE;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Exact lookup of a stored value. Anything else, including other casings, maps to
   * {@code null}.
   */
  @JsonCreator
  public static MatchMode fromValue(String value) {
    for (MatchMode mode : values()) {
      if (mode.value().equals(value)) {
        return mode;
      }
    }
    return null;
  }
}
