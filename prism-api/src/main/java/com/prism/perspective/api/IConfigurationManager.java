package com.prism.perspective.api;

import com.prism.perspective.runtime.model.PerspectiveConfiguration;

/**
 * Holds the active {@link PerspectiveConfiguration} and replaces it on reload.
 */
public interface IConfigurationManager {

    /**
     * Current snapshot. Never null once the manager is constructed.
     */
    PerspectiveConfiguration getConfiguration();

    /**
     * Reloads perspective definitions from their source. On failure the previous
     * snapshot stays active and the error is rethrown.
     */
    void reload();
}
