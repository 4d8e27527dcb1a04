package io.intellixity.dynattr.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Filters over one entity type combined with AND or OR. */
@JsonDeserialize(using = CriteriaJsonDeserializer.class)
public record Criteria(List<Criterion> filters, SearchLogic logic) {
  public Criteria {
    filters = List.copyOf(Objects.requireNonNull(filters, "filters"));
    logic = logic == null ? SearchLogic.AND : logic;
  }

  public static Criteria and(Criterion... filters) {
    return new Criteria(Arrays.asList(filters), SearchLogic.AND);
  }

  public static Criteria or(Criterion... filters) {
    return new Criteria(Arrays.asList(filters), SearchLogic.OR);
  }

  /** Filter map in entry order: attribute name to literal or {@code {value, operator}} map. */
  public static Criteria fromMap(Map<String, ?> filterMap, SearchLogic logic) {
    List<Criterion> out = new ArrayList<>();
    if (filterMap != null) {
      filterMap.forEach((name, condition) -> out.add(Criterion.fromEntry(name, condition)));
    }
    return new Criteria(out, logic);
  }

  public boolean isEmpty() {
    return filters.isEmpty();
  }
}
