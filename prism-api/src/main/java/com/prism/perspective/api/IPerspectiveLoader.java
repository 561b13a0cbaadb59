package com.prism.perspective.api;

import com.prism.perspective.api.exceptions.PerspectiveLoadException;
import com.prism.perspective.api.model.PerspectiveDefinition;

import java.util.Map;

/**
 * Source of stored perspective definitions.
 */
public interface IPerspectiveLoader {

    /**
     * Loads every perspective, merging entries that share an id: rules are
     * concatenated and the active and supported flags are and-ed.
     *
     * @param systemVersionTimestamp optional snapshot timestamp, may be null
     * @return perspective id to definition
     * @throws PerspectiveLoadException if the source cannot be read or is empty
     */
    Map<Integer, PerspectiveDefinition> loadPerspectives(String systemVersionTimestamp);
}
