package com.flamingo.ai.kbsearch.elasticsearch;

import co.elastic.clients.elasticsearch._types.query_dsl.Operator;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Translates canonical structured filters into Elasticsearch filter clauses. */
final class SearchFilterQueries {

  private SearchFilterQueries() {}

  static List<Query> toFilterQueries(Map<String, Object> filters) {
    List<Query> queries = new ArrayList<>();
    if (filters == null) {
      return queries;
    }
    for (Map.Entry<String, Object> entry : filters.entrySet()) {
      String field = entry.getKey();
      Object value = entry.getValue();
      if (value == null) {
        continue;
      }
      switch (field) {
        case "year" -> {
          int year =
              value instanceof Number n ? n.intValue() : Integer.parseInt(value.toString().trim());
          queries.add(Query.of(q -> q.term(t -> t.field("year").value(year))));
        }
        case "subject" ->
            queries.add(
                Query.of(
                    q ->
                        q.match(
                            m -> m.field("subject").query(value.toString()).operator(Operator.And))));
        default ->
            queries.add(
                Query.of(
                    q ->
                        q.term(
                            t -> t.field(field).value(value.toString()).caseInsensitive(true))));
      }
    }
    return queries;
  }

  static Integer asInteger(Object value) {
    if (value instanceof Number n) {
      return n.intValue();
    }
    return value == null ? null : Integer.valueOf(value.toString());
  }

  static String asString(Object value) {
    return value == null ? null : value.toString();
  }
}
