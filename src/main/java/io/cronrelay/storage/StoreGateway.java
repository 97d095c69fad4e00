package io.cronrelay.storage;

import java.util.List;
import java.util.Map;

/**
 * Query/execute capability over the two scheduler tables. Values are always bound, never interpolated.
 */
public interface StoreGateway {
    /**
     * Runs a read and returns each row as a column-label keyed map, in result order.
     */
    List<Map<String, Object>> query(String sql, List<?> params);

    /**
     * Runs a write and returns the affected row count.
     */
    int execute(String sql, List<?> params);
}
