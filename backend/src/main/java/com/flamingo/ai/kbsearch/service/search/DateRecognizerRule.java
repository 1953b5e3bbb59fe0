package com.flamingo.ai.kbsearch.service.search;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Italian date expressions, declared in precedence order. The first rule whose pattern occurs in
 * the query determines the filter.
 */
public enum DateRecognizerRule {
  /** "dal 2021", "dall'2021", "dal 2021 in poi". */
  FROM(DateFilterType.FROM, "\\b(?:dallo\\s+|dal\\s+|dall['’]\\s*)(\\d{4})(?:\\s+in\\s+poi)?\\b"),

  /** "fino al 2020", "entro il 2020". */
  UNTIL(DateFilterType.UNTIL, "\\b(?:fino\\s+al|entro(?:\\s+il)?)\\s+(\\d{4})\\b"),

  /** "nel 2023", "nell'anno 2023". */
  IN_YEAR(DateFilterType.IN_YEAR, "\\bnel(?:l['’]\\s*|lo\\s+|\\s+)(?:anno\\s+)?(\\d{4})\\b"),

  /** "tra il 2020 e il 2022", "fra 2020 e 2022". */
  RANGE(
      DateFilterType.RANGE,
      "\\b(?:tra|fra)\\s+(?:il\\s+)?(\\d{4})\\s+e\\s+(?:il\\s+)?(\\d{4})\\b"),

  /** "dopo il 2019", "successivi al 2020". */
  AFTER(DateFilterType.AFTER, "\\b(?:dopo(?:\\s+il)?|successiv[aeio]\\s+al)\\s+(\\d{4})\\b"),

  /** "prima del 2022", "precedenti al 2021". */
  BEFORE(DateFilterType.BEFORE, "\\b(?:prima\\s+del|precedent[aeio]\\s+al)\\s+(\\d{4})\\b");

  private final DateFilterType type;
  private final Pattern pattern;

  DateRecognizerRule(DateFilterType type, String regex) {
    this.type = type;
    this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
  }

  /** A recognized expression and where it sits in the query. */
  public record Match(DateFilter filter, int start, int end) {}

  public Optional<Match> recognize(String query) {
    Matcher matcher = pattern.matcher(query);
    if (!matcher.find()) {
      return Optional.empty();
    }
    DateFilter filter =
        type == DateFilterType.RANGE
            ? DateFilter.range(
                Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)))
            : DateFilter.of(type, Integer.parseInt(matcher.group(1)));
    return Optional.of(new Match(filter, matcher.start(), matcher.end()));
  }
}
