package com.flamingo.ai.kbsearch.service.search;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Collapses hits that are versions of the same file. Hits cluster by base name; the survivor is
 * the highest score, then a final marker, then the higher version, then a PDF. Survivors keep the
 * input order.
 */
@Component
public class ResultDeduplicator {

  private static final Comparator<Candidate> PREFERENCE =
      Comparator.<Candidate>comparingDouble(c -> c.hit().getScore())
          .thenComparing(c -> c.info().isFinal())
          .thenComparingDouble(c -> c.info().version())
          .thenComparing(c -> c.info().pdf());

  /** Surviving hits and how many were removed. */
  public record Outcome(List<SearchHit> hits, int removed) {}

  private record Candidate(SearchHit hit, VersionInfo info) {}

  public Outcome deduplicate(List<SearchHit> hits) {
    Map<String, Candidate> best = new LinkedHashMap<>();
    for (SearchHit hit : hits) {
      VersionInfo info =
          VersionInfo.parse(hit.getFileName() != null ? hit.getFileName() : hit.getPath());
      String key = info.baseName().isEmpty() ? "id:" + hit.getDocumentId() : info.baseName();
      Candidate candidate = new Candidate(hit, info);
      best.merge(key, candidate, (a, b) -> PREFERENCE.compare(b, a) > 0 ? b : a);
    }

    Set<SearchHit> survivors = Collections.newSetFromMap(new IdentityHashMap<>());
    best.values().forEach(c -> survivors.add(c.hit()));
    List<SearchHit> kept = new ArrayList<>(survivors.size());
    for (SearchHit hit : hits) {
      if (survivors.contains(hit)) {
        kept.add(hit);
      }
    }
    return new Outcome(kept, hits.size() - kept.size());
  }
}
