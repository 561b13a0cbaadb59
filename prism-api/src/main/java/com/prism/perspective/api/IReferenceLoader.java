package com.prism.perspective.api;

import com.prism.perspective.api.exceptions.ReferenceLoadException;
import com.prism.perspective.api.model.ReferenceQuery;
import com.prism.perspective.runtime.frame.Frame;

/**
 * Source of instrument reference data.
 * <p>
 * Implementations must be safe to call from several threads at once; the
 * engine fetches the tables of one request in parallel.
 */
public interface IReferenceLoader {

    /**
     * Loads one table for the given instruments.
     *
     * @return frame with an {@code instrument_id} column plus the requested columns,
     *         at most one row per instrument
     * @throws ReferenceLoadException if the table cannot be fetched
     */
    Frame load(ReferenceQuery query);
}
