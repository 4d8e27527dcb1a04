package io.intellixity.dynattr.service;

import io.intellixity.dynattr.model.AttributeDefinition;
import io.intellixity.dynattr.model.AttributeType;
import io.intellixity.dynattr.model.ValueSlot;
import io.intellixity.dynattr.query.Criteria;
import io.intellixity.dynattr.query.Criterion;
import io.intellixity.dynattr.query.Filters;
import io.intellixity.dynattr.query.LikeOptions;
import io.intellixity.dynattr.query.QueryValidationException;
import io.intellixity.dynattr.query.SearchLogic;
import io.intellixity.dynattr.query.SortField;
import io.intellixity.dynattr.service.internal.StorageGuard;
import io.intellixity.dynattr.spi.capability.BackendCapabilities;
import io.intellixity.dynattr.spi.capability.Feature;
import io.intellixity.dynattr.spi.exec.StorageEngine;
import io.intellixity.dynattr.spi.search.SlotPredicate;
import io.intellixity.dynattr.validation.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Evaluates filter maps into sets of entity ids.
 * <p>
 * Each filter yields the ids of entities whose value record matches; AND intersects them starting
 * from every entity of the type that has any value, OR unions them. Operands are cast through the
 * attribute's type first, so text attributes compare lexicographically even for numeric-looking
 * strings.
 * <p>
 * A NULL filter matches entities whose record holds null and entities without a record for the
 * attribute. Entities that hold no value at all are unknown to the store and therefore never
 * match anything.
 */
public final class SearchCompiler {
  private static final Logger log = LoggerFactory.getLogger(SearchCompiler.class);

  private final AttributeCatalog catalog;
  private final StorageEngine engine;
  private final BackendCapabilities capabilities;
  private final Clock clock;

  public SearchCompiler(AttributeCatalog catalog, StorageEngine engine, BackendCapabilities capabilities, Clock clock) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.capabilities = Objects.requireNonNull(capabilities, "capabilities");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** AND of all filters. An empty filter map matches every entity with a value. */
  public Set<String> search(String entityType, Map<String, ?> filterMap) {
    return search(entityType, Criteria.fromMap(filterMap, SearchLogic.AND));
  }

  public Set<String> advancedSearch(String entityType, Map<String, ?> filterMap, SearchLogic logic) {
    return search(entityType, Criteria.fromMap(filterMap, logic));
  }

  public Set<String> advancedSearch(String entityType, Map<String, ?> filterMap, String logic) {
    return advancedSearch(entityType, filterMap, SearchLogic.parse(logic));
  }

  public Set<String> search(String entityType, Criteria criteria) {
    Objects.requireNonNull(entityType, "entityType");
    Set<String> out = StorageGuard.run(log, "search", null, attributeNames(criteria),
        () -> new Evaluation(entityType).run(criteria));
    log.debug("dynattr.search entityType={} logic={} filters={} matched={}",
        entityType, criteria.logic(), criteria.filters(), out.size());
    return out;
  }

  public Set<String> searchText(String entityType, String attribute, String term, boolean caseSensitive) {
    return search(entityType, Criteria.and(Criterion.like(attribute, term, new LikeOptions(caseSensitive, false))));
  }

  /** Inclusive range; a {@code null} bound is open. With both bounds open, every non-null value matches. */
  public Set<String> searchNumberRange(String entityType, String attribute, Number min, Number max) {
    return search(entityType, Criteria.and(range(attribute, min, max)));
  }

  public Set<String> searchDateRange(String entityType, String attribute, Object from, Object to) {
    return search(entityType, Criteria.and(range(attribute, from, to)));
  }

  public Set<String> searchBoolean(String entityType, String attribute, boolean value) {
    return search(entityType, Criteria.and(Filters.eq(attribute, value)));
  }

  /**
   * {@code ids} ordered by the attribute's typed value; entities without a value come last.
   */
  public List<String> orderBy(String entityType, Collection<String> ids, SortField sort) {
    AttributeDefinition def = catalog.require(sort.attribute());
    return StorageGuard.run(log, "sort", null, List.of(def.name()),
        () -> engine.orderEntityIds(entityType, ids, def.name(), def.slot(), sort.direction()));
  }

  private static Criterion range(String attribute, Object min, Object max) {
    if (min != null && max != null) return Filters.between(attribute, min, max);
    if (min != null) return Filters.ge(attribute, min);
    if (max != null) return Filters.le(attribute, max);
    return Filters.notNull(attribute);
  }

  private static List<String> attributeNames(Criteria criteria) {
    List<String> out = new ArrayList<>();
    for (Criterion c : criteria.filters()) out.add(c.attribute());
    return out;
  }

  /** State of one search call; the universe is loaded at most once. */
  private final class Evaluation {
    private final String entityType;
    private Set<String> universe;

    Evaluation(String entityType) {
      this.entityType = entityType;
    }

    Set<String> run(Criteria criteria) {
      // unknown attributes fail before any value query
      List<AttributeDefinition> defs = new ArrayList<>();
      for (Criterion c : criteria.filters()) defs.add(catalog.require(c.attribute()));

      if (criteria.logic() == SearchLogic.OR) {
        Set<String> out = new LinkedHashSet<>();
        for (int i = 0; i < defs.size(); i++) out.addAll(matching(defs.get(i), criteria.filters().get(i)));
        return out;
      }

      Set<String> out = new LinkedHashSet<>(universe());
      for (int i = 0; i < defs.size() && !out.isEmpty(); i++) {
        out.retainAll(matching(defs.get(i), criteria.filters().get(i)));
      }
      return out;
    }

    private Set<String> universe() {
      if (universe == null) universe = engine.entityIds(entityType);
      return universe;
    }

    private Set<String> matching(AttributeDefinition def, Criterion c) {
      ValueSlot slot = def.slot();
      String name = def.name();
      return switch (c.operator()) {
        case NULL -> {
          Set<String> out = new LinkedHashSet<>(engine.matchingEntityIds(entityType, name, SlotPredicate.isNull(slot)));
          Set<String> missing = new LinkedHashSet<>(universe());
          missing.removeAll(engine.matchingEntityIds(entityType, name, SlotPredicate.notNull(slot)));
          out.addAll(missing);
          yield out;
        }
        case NOT_NULL -> engine.matchingEntityIds(entityType, name, SlotPredicate.notNull(slot));
        case EQ, NE, LT, GT, LE, GE ->
            engine.matchingEntityIds(entityType, name, SlotPredicate.compare(slot, c.operator(), operand(def, c.value())));
        case IN -> {
          List<Object> values = new ArrayList<>();
          for (Object v : c.values()) {
            if (v != null) values.add(operand(def, v));
          }
          yield values.isEmpty() ? Set.of() : engine.matchingEntityIds(entityType, name, SlotPredicate.in(slot, values));
        }
        case BETWEEN -> engine.matchingEntityIds(entityType, name,
            SlotPredicate.between(slot, operand(def, c.min()), operand(def, c.max())));
        case LIKE -> {
          if (slot != ValueSlot.STRING) {
            throw new QueryValidationException("LIKE is only supported for text and select attributes, not '" + name + "'");
          }
          boolean fullText = c.like().fullText()
              && def.type() == AttributeType.TEXT
              && capabilities.supports(Feature.FULLTEXT_SEARCH);
          yield engine.matchingEntityIds(entityType, name,
              SlotPredicate.like(slot, Values.toText(c.value()), c.like().caseSensitive(), fullText));
        }
      };
    }

    /** Filter operand cast to the attribute's storage type. */
    private Object operand(AttributeDefinition def, Object raw) {
      if (raw instanceof Map<?, ?> || raw instanceof Collection<?>) {
        throw new QueryValidationException("Filter value for '" + def.name() + "' must be a scalar: " + raw);
      }
      if (def.type() != AttributeType.SELECT && def.type().typeViolation(def, raw, clock) != null) {
        throw new QueryValidationException(
            "Filter value '" + raw + "' for attribute '" + def.name() + "' is not a valid " + def.type().id());
      }
      return def.type().cast(raw, clock);
    }
  }
}
