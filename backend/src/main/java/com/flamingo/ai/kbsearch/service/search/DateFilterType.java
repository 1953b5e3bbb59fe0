package com.flamingo.ai.kbsearch.service.search;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Comparison applied by a {@link DateFilter}. */
public enum DateFilterType {
  /** year >= bound. */
  FROM,
  /** year <= bound. */
  UNTIL,
  /** year == bound. */
  IN_YEAR,
  /** from <= year <= to. */
  RANGE,
  /** year > bound. */
  AFTER,
  /** year < bound. */
  BEFORE;

  @JsonValue
  public String jsonName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
