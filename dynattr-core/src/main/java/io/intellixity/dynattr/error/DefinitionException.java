package io.intellixity.dynattr.error;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** An attribute definition violates one or more constraints; all of them are listed. */
public class DefinitionException extends AttributeException {
  private final Map<String, List<String>> violations;

  public DefinitionException(Map<String, List<String>> violations) {
    this(copy(violations), null);
  }

  protected DefinitionException(Map<String, List<String>> violations, String userMessage) {
    super("Invalid attribute definition: " + flatten(violations),
        userMessage == null ? "The attribute definition is invalid." : userMessage,
        Map.of("violations", violations), null);
    this.violations = violations;
  }

  /** Field ({@code name}, {@code label}, {@code type}, {@code options}, {@code validation}) to messages. */
  public Map<String, List<String>> violations() { return violations; }

  public List<String> messages() {
    List<String> out = new ArrayList<>();
    violations.values().forEach(out::addAll);
    return out;
  }

  @Override
  public String code() { return "definition_invalid"; }

  static Map<String, List<String>> copy(Map<String, List<String>> in) {
    Map<String, List<String>> out = new LinkedHashMap<>();
    in.forEach((k, v) -> out.put(k, List.copyOf(v)));
    return Collections.unmodifiableMap(out);
  }

  private static String flatten(Map<String, List<String>> v) {
    List<String> all = new ArrayList<>();
    v.values().forEach(all::addAll);
    return String.join(" ", all);
  }
}
