package com.prism.perspective.api.model;

import java.util.List;

/**
 * Request for one reference table, restricted to the instruments present in the
 * current request.
 *
 * @param table                  reference table name
 * @param columns                columns to return besides {@code instrument_id}
 * @param instrumentIds          distinct ids to fetch
 * @param effectiveDate          as-of date, {@code yyyy-MM-dd}
 * @param systemVersionTimestamp optional system-versioned snapshot, may be null
 */
public record ReferenceQuery(
        String table,
        List<String> columns,
        List<Long> instrumentIds,
        String effectiveDate,
        String systemVersionTimestamp) {

    public ReferenceQuery {
        columns = List.copyOf(columns);
        instrumentIds = List.copyOf(instrumentIds);
    }
}
