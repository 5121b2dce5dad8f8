package io.changefeed.dedupe;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Builds deduplication keys of the form {@code resource:operation:k1:v1|k2:v2}.
 *
 * <p>Parameters are sorted by name, so the same request built with a different
 * parameter order maps to the same key.
 */
public final class CacheKeys {

  private CacheKeys() {}

  public static String of(String resource, String operation) {
    return of(resource, operation, Map.of());
  }

  /**
   * @param resource  resource or table name
   * @param operation operation name, e.g. {@code select}
   * @param params    request parameters; null values render as {@code null}
   * @return the key
   */
  public static String of(String resource, String operation, Map<String, ?> params) {
    Objects.requireNonNull(resource, "resource");
    Objects.requireNonNull(operation, "operation");
    StringBuilder key = new StringBuilder(resource).append(':').append(operation).append(':');
    if (params != null && !params.isEmpty()) {
      boolean first = true;
      for (Map.Entry<String, ?> param : new TreeMap<String, Object>(params).entrySet()) {
        if (!first) {
          key.append('|');
        }
        key.append(param.getKey()).append(':').append(param.getValue());
        first = false;
      }
    }
    return key.toString();
  }

  /**
   * Returns the prefix shared by every key of {@code resource} and {@code operation},
   * for use with {@link RequestDeduplicator#invalidatePrefix(String)}.
   */
  public static String prefix(String resource, String operation) {
    return Objects.requireNonNull(resource, "resource") + ":"
        + Objects.requireNonNull(operation, "operation") + ":";
  }
}
