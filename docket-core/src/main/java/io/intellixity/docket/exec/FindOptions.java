package io.intellixity.docket.exec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options handed to the store's find unchanged.
 *
 * @param sort  field to direction ({@code 1} ascending, {@code -1} descending), in priority order
 * @param skip  records to skip, or null
 * @param limit maximum records to return (positive), or null for all
 */
public record FindOptions(Map<String, Integer> sort, Integer skip, Integer limit) {
  private static final FindOptions NONE = new FindOptions(Map.of(), null, null);

  public FindOptions {
    sort = (sort == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sort));
    if (skip != null && skip < 0) throw new IllegalArgumentException("skip must be >= 0");
    if (limit != null && limit <= 0) throw new IllegalArgumentException("limit must be > 0");
  }

  public static FindOptions none() { return NONE; }

  public FindOptions sortBy(String field, int direction) {
    if (direction != 1 && direction != -1) throw new IllegalArgumentException("direction must be 1 or -1");
    Map<String, Integer> m = new LinkedHashMap<>(sort);
    m.put(field, direction);
    return new FindOptions(m, skip, limit);
  }

  public FindOptions skip(int n) { return new FindOptions(sort, n, limit); }

  public FindOptions limit(int n) { return new FindOptions(sort, skip, n); }
}
