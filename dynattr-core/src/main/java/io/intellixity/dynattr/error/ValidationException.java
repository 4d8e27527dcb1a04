package io.intellixity.dynattr.error;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One or more attribute values were rejected. Carries every violation and the raw input that
 * caused them.
 */
public final class ValidationException extends AttributeException {
  private final List<Violation> violations;
  private final Map<String, Object> rawValues;

  public ValidationException(List<Violation> violations, Map<String, Object> rawValues) {
    super("Attribute validation failed: " + summary(violations),
        violations.size() == 1 ? violations.get(0).userMessage() : "The given attribute values are invalid.",
        Map.of("attributes", names(violations)),
        null);
    this.violations = List.copyOf(violations);
    this.rawValues = rawValues == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(rawValues));
  }

  public List<Violation> violations() { return violations; }

  /** Offending raw input keyed by attribute name; values may be {@code null}. */
  public Map<String, Object> rawValues() { return rawValues; }

  public List<String> messagesFor(String attributeName) {
    List<String> out = new ArrayList<>();
    for (Violation v : violations) {
      if (v.attributeName().equals(attributeName)) out.add(v.userMessage());
    }
    return out;
  }

  /** Attribute name to messages, in first-seen order. */
  public Map<String, List<String>> messagesByAttribute() {
    Map<String, List<String>> out = new LinkedHashMap<>();
    for (Violation v : violations) {
      out.computeIfAbsent(v.attributeName(), k -> new ArrayList<>()).add(v.userMessage());
    }
    return out;
  }

  @Override
  public String code() { return "validation_failed"; }

  @Override
  public Map<String, Object> toMap() {
    Map<String, Object> out = super.toMap();
    List<Map<String, Object>> list = new ArrayList<>();
    for (Violation v : violations) {
      Map<String, Object> m = new LinkedHashMap<>();
      m.put("attributeName", v.attributeName());
      m.put("userMessage", v.userMessage());
      m.put("machineContext", v.machineContext());
      list.add(m);
    }
    out.put("violations", list);
    return out;
  }

  private static List<String> names(List<Violation> violations) {
    return violations.stream().map(Violation::attributeName).distinct().toList();
  }

  private static String summary(List<Violation> violations) {
    StringBuilder sb = new StringBuilder();
    for (Violation v : violations) {
      if (sb.length() > 0) sb.append("; ");
      sb.append(v.attributeName()).append(": ").append(v.userMessage());
    }
    return sb.toString();
  }
}
