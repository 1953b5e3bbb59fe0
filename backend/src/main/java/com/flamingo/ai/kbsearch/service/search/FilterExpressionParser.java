package com.flamingo.ai.kbsearch.service.search;

import com.flamingo.ai.kbsearch.exception.InvalidRequestException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Parses structured filters, either as a {@code key:value[,key:value...]} expression or as a
 * key/value map, into canonical field names. Unknown keys are rejected.
 */
@Component
public class FilterExpressionParser {

  private static final Map<String, String> KEYS = new LinkedHashMap<>();

  static {
    for (String canonical :
        new String[] {"area", "year", "client", "subject", "docType", "category", "extension", "lot"}) {
      KEYS.put(canonical.toLowerCase(Locale.ROOT), canonical);
    }
    KEYS.put("anno", "year");
    KEYS.put("cliente", "client");
    KEYS.put("oggetto", "subject");
    KEYS.put("tipo_doc", "docType");
    KEYS.put("categoria", "category");
    KEYS.put("ext", "extension");
  }

  public Map<String, Object> parse(String expression) {
    Map<String, String> raw = new LinkedHashMap<>();
    if (expression == null || expression.isBlank()) {
      return Map.of();
    }
    for (String part : expression.split(",")) {
      if (part.isBlank()) {
        continue;
      }
      int colon = part.indexOf(':');
      if (colon <= 0) {
        throw new InvalidRequestException("Malformed filter '" + part.strip() + "', expected key:value");
      }
      raw.put(part.substring(0, colon), part.substring(colon + 1));
    }
    return normalize(raw);
  }

  public Map<String, Object> normalize(Map<String, String> filters) {
    Map<String, Object> canonical = new LinkedHashMap<>();
    if (filters == null) {
      return canonical;
    }
    for (Map.Entry<String, String> entry : filters.entrySet()) {
      String key = canonicalKey(entry.getKey());
      String value = entry.getValue() == null ? "" : entry.getValue().strip();
      if (value.isEmpty()) {
        continue;
      }
      canonical.put(key, convert(key, value));
    }
    return canonical;
  }

  private static String canonicalKey(String key) {
    String canonical = key == null ? null : KEYS.get(key.strip().toLowerCase(Locale.ROOT));
    if (canonical == null) {
      throw new InvalidRequestException(
          "Unknown filter key '" + key + "'. Allowed: " + String.join(", ", KEYS.keySet()));
    }
    return canonical;
  }

  private static Object convert(String key, String value) {
    switch (key) {
      case "year":
        try {
          return Integer.valueOf(value);
        } catch (NumberFormatException e) {
          throw new InvalidRequestException("Filter year must be a number, got '" + value + "'");
        }
      case "extension":
        return (value.startsWith(".") ? value.substring(1) : value).toLowerCase(Locale.ROOT);
      default:
        return value;
    }
  }
}
