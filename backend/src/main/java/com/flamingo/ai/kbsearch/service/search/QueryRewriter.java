package com.flamingo.ai.kbsearch.service.search;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Recognizes one date expression per query and strips stopwords for the lexical backend. The
 * vector backend always receives the original text.
 */
@Component
@Slf4j
public class QueryRewriter {

  static final Set<String> ITALIAN_STOPWORDS =
      Set.of(
          "il", "lo", "la", "i", "gli", "le", "un", "uno", "una", "dei", "degli", "delle", "di",
          "a", "da", "in", "con", "su", "per", "tra", "fra", "del", "dello", "della", "al", "allo",
          "alla", "ai", "agli", "alle", "dal", "dallo", "dalla", "dai", "dagli", "dalle", "nel",
          "nello", "nella", "nei", "negli", "nelle", "sul", "sullo", "sulla", "sui", "sugli",
          "sulle", "e", "o", "ma", "però", "anche", "oppure", "che", "cui", "chi", "quale",
          "quanto", "questo", "quello", "questi", "quelli", "suo", "sua", "loro", "nostro",
          "vostro", "essere", "avere", "fare", "è", "sono", "ha", "hanno", "fa", "fanno");

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final List<DateRecognizerRule> rules;

  public QueryRewriter() {
    this(Arrays.asList(DateRecognizerRule.values()));
  }

  QueryRewriter(List<DateRecognizerRule> rules) {
    this.rules = List.copyOf(rules);
  }

  public RewrittenQuery rewrite(String query) {
    String original = query == null ? "" : query.strip();
    Optional<DateRecognizerRule.Match> match = Optional.empty();
    for (DateRecognizerRule rule : rules) {
      match = rule.recognize(original);
      if (match.isPresent()) {
        break;
      }
    }

    String withoutDate =
        match
            .map(m -> original.substring(0, m.start()) + " " + original.substring(m.end()))
            .orElse(original);
    withoutDate = WHITESPACE.matcher(withoutDate).replaceAll(" ").strip();

    String cleaned =
        Arrays.stream(WHITESPACE.split(withoutDate.toLowerCase(Locale.ROOT)))
            .filter(token -> token.length() > 1)
            .filter(token -> !ITALIAN_STOPWORDS.contains(token))
            .collect(Collectors.joining(" "));
    if (cleaned.isEmpty()) {
      cleaned = withoutDate;
    }

    Optional<DateFilter> dateFilter = match.map(DateRecognizerRule.Match::filter);
    log.debug(
        "[REWRITE] '{}' -> '{}' dateFilter={}", original, cleaned, dateFilter.orElse(null));
    return new RewrittenQuery(original, cleaned, dateFilter);
  }
}
