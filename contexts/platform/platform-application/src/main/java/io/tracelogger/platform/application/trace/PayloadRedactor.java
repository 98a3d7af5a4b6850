package io.tracelogger.platform.application.trace;

import jakarta.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Masks configured keys in structured payloads before they leave the process.
 *
 * <p>Only maps (and the lists nested inside them) are inspected; a payload whose top level is not
 * a map, or any value that is neither a map nor a collection, passes through untouched. Matching
 * is case-insensitive. Inputs are never mutated: matching maps are copied. A map or collection
 * that contains itself, directly or further down, is cut at the repeat with {@link #CYCLE}.
 *
 * <p>Thread-safety: immutable.
 */
public final class PayloadRedactor {

  /** Replacement written in place of a masked value. */
  public static final String REDACTED = "<<redacted>>";

  /** Replacement written where a container would repeat one of its own ancestors. */
  public static final String CYCLE = "<<cycle>>";

  private final Set<String> keysLower;

  public PayloadRedactor(@Nullable Collection<String> keys) {
    Set<String> lower = new LinkedHashSet<>();
    if (keys != null) {
      for (String k : keys) {
        if (k != null && !k.isBlank()) {
          lower.add(k.trim().toLowerCase(Locale.ROOT));
        }
      }
    }
    this.keysLower = Set.copyOf(lower);
  }

  /** Whether any key is configured. */
  public boolean isActive() {
    return !keysLower.isEmpty();
  }

  /**
   * Returns the payload with configured keys masked.
   *
   * @param payload arbitrary payload (may be null)
   * @return a redacted copy for maps; the input itself otherwise
   */
  public Object redact(@Nullable Object payload) {
    if (!isActive() || !(payload instanceof Map<?, ?>)) {
      return payload;
    }
    return redactValue(payload, Collections.newSetFromMap(new IdentityHashMap<>()));
  }

  private Object redactValue(Object value, Set<Object> path) {
    if (!(value instanceof Map<?, ?>) && !(value instanceof Collection<?>)) {
      return value;
    }
    if (!path.add(value)) {
      return CYCLE;
    }
    try {
      if (value instanceof Map<?, ?> map) {
        Map<Object, Object> out = new LinkedHashMap<>(Math.max(4, map.size() * 2));
        for (Map.Entry<?, ?> e : map.entrySet()) {
          Object key = e.getKey();
          if (key != null && keysLower.contains(String.valueOf(key).toLowerCase(Locale.ROOT))) {
            out.put(key, REDACTED);
          } else {
            out.put(key, redactValue(e.getValue(), path));
          }
        }
        return out;
      }
      Collection<?> items = (Collection<?>) value;
      List<Object> out = new ArrayList<>(items.size());
      for (Object item : items) {
        out.add(redactValue(item, path));
      }
      return out;
    } finally {
      path.remove(value);
    }
  }
}
