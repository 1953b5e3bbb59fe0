package com.flamingo.ai.kbsearch.service.search;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Drops hits whose year falls outside a date filter. The year comes from the metadata field, then
 * the tender folder in the path, then a year suffix on the file name. Hits without a known year
 * are kept.
 */
@Component
public class SmartDateFilter {

  private static final Pattern TENDER_FOLDER = Pattern.compile("_Gare[/\\\\](\\d{4})_");
  private static final Pattern YEAR_SUFFIX =
      Pattern.compile("[_-](\\d{4})\\.(?:pdf|docx?)", Pattern.CASE_INSENSITIVE);

  /** Kept hits and how many were dropped. */
  public record Outcome(List<SearchHit> hits, int removed) {}

  public Outcome apply(List<SearchHit> hits, DateFilter filter) {
    List<SearchHit> kept = new ArrayList<>(hits.size());
    for (SearchHit hit : hits) {
      OptionalInt year = yearOf(hit);
      if (year.isEmpty() || filter.accepts(year.getAsInt())) {
        kept.add(hit);
      }
    }
    return new Outcome(kept, hits.size() - kept.size());
  }

  static OptionalInt yearOf(SearchHit hit) {
    if (hit.getYear() != null && isPlausible(hit.getYear())) {
      return OptionalInt.of(hit.getYear());
    }
    String path = hit.getPath() != null ? hit.getPath() : hit.getFileName();
    if (path == null) {
      return OptionalInt.empty();
    }
    Matcher folder = TENDER_FOLDER.matcher(path);
    if (folder.find() && isPlausible(Integer.parseInt(folder.group(1)))) {
      return OptionalInt.of(Integer.parseInt(folder.group(1)));
    }
    Matcher suffix = YEAR_SUFFIX.matcher(path);
    if (suffix.find() && isPlausible(Integer.parseInt(suffix.group(1)))) {
      return OptionalInt.of(Integer.parseInt(suffix.group(1)));
    }
    return OptionalInt.empty();
  }

  private static boolean isPlausible(int year) {
    return year >= 2000 && year <= 2099;
  }
}
