package com.prism.perspective.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Entry point: applies the requested perspectives to the records of one request.
 */
public interface IPerspectiveEngine {

    /**
     * Processes a request document.
     *
     * @param request JSON request with {@code perspective_configurations} and the
     *                record containers
     * @return response map, ready for JSON serialization
     * @throws com.prism.perspective.api.exceptions.PerspectiveException on any
     *         configuration, request or reference-data error
     */
    Map<String, Object> process(JsonNode request);
}
