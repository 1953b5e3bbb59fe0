package com.flamingo.ai.kbsearch.service.search;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A year constraint recognized in a query. Single-bound filters carry {@code year}; a range
 * carries {@code from} and {@code to}, always ascending.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DateFilter(DateFilterType type, Integer year, Integer from, Integer to) {

  public static DateFilter of(DateFilterType type, int year) {
    if (type == DateFilterType.RANGE) {
      throw new IllegalArgumentException("A range needs two bounds");
    }
    return new DateFilter(type, year, null, null);
  }

  public static DateFilter range(int first, int second) {
    return new DateFilter(
        DateFilterType.RANGE, null, Math.min(first, second), Math.max(first, second));
  }

  public boolean accepts(int candidateYear) {
    return switch (type) {
      case FROM -> candidateYear >= year;
      case UNTIL -> candidateYear <= year;
      case IN_YEAR -> candidateYear == year;
      case RANGE -> candidateYear >= from && candidateYear <= to;
      case AFTER -> candidateYear > year;
      case BEFORE -> candidateYear < year;
    };
  }
}
