package io.intellixity.dynattr.query;

import java.util.Map;

/**
 * Options of a LIKE filter. Full-text matching is used only where the backend supports it and
 * silently degrades to LIKE elsewhere.
 */
public record LikeOptions(boolean caseSensitive, boolean fullText) {
  public static final LikeOptions DEFAULT = new LikeOptions(false, false);

  public static LikeOptions fromMap(Map<?, ?> m) {
    if (m == null) return DEFAULT;
    return new LikeOptions(flag(m.get("case_sensitive")), flag(m.get("full_text")));
  }

  private static boolean flag(Object o) {
    if (o instanceof Boolean b) return b;
    return o != null && Boolean.parseBoolean(String.valueOf(o));
  }
}
