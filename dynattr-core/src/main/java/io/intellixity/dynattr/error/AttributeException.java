package io.intellixity.dynattr.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base of all attribute engine errors.
 * <p>
 * {@link #getMessage()} is for logs and may reference internal names; {@link #userMessage()} is
 * safe to show to end users. {@link #context()} carries machine-readable details.
 */
public abstract class AttributeException extends RuntimeException {
  private final String userMessage;
  private final Map<String, Object> context;

  protected AttributeException(String message, String userMessage, Map<String, Object> context, Throwable cause) {
    super(message, cause);
    this.userMessage = userMessage == null ? message : userMessage;
    this.context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
  }

  public String userMessage() { return userMessage; }
  public Map<String, Object> context() { return context; }

  /** Stable error code for API responses. */
  public abstract String code();

  /** Representation for API responses. */
  public Map<String, Object> toMap() {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("code", code());
    out.put("message", userMessage);
    if (!context.isEmpty()) out.put("context", context);
    return out;
  }

  static Map<String, Object> ctx(Object... kv) {
    Map<String, Object> m = new LinkedHashMap<>();
    for (int i = 0; i + 1 < kv.length; i += 2) {
      if (kv[i + 1] != null) m.put(String.valueOf(kv[i]), kv[i + 1]);
    }
    return m;
  }
}
