package com.prism.perspective.infra.loader;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prism.perspective.api.IPerspectiveLoader;
import com.prism.perspective.api.exceptions.PerspectiveLoadException;
import com.prism.perspective.api.model.PerspectiveDefinition;
import com.prism.perspective.api.model.RuleDefinition;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Reads perspective definitions from a JSON file shaped like the database export:
 * <pre>
 * {"perspectives": [
 *   {"id": 1, "name": "Equities", "is_active": true,
 *    "is_compatible_with_sub_setting_service": true, "rules": [ ... ]}
 * ]}
 * </pre>
 * Entries sharing an id are merged.
 */
public class JsonFilePerspectiveLoader implements IPerspectiveLoader {
    private static final Logger logger = Logger.getLogger(JsonFilePerspectiveLoader.class.getName());

    private final Path path;
    private final ObjectMapper mapper;

    public JsonFilePerspectiveLoader(Path path, ObjectMapper mapper) {
        this.path = path;
        this.mapper = mapper;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Document(@JsonProperty("perspectives") List<PerspectiveDefinition> perspectives) {
    }

    @Override
    public Map<Integer, PerspectiveDefinition> loadPerspectives(String systemVersionTimestamp) {
        if (systemVersionTimestamp != null) {
            logger.fine("File loader ignores system version timestamp " + systemVersionTimestamp);
        }
        Document document;
        try {
            document = mapper.readValue(path.toFile(), Document.class);
        } catch (IOException e) {
            throw new PerspectiveLoadException("Failed to read perspectives from " + path, e);
        }
        if (document == null || document.perspectives() == null || document.perspectives().isEmpty()) {
            throw new PerspectiveLoadException("No perspectives found in " + path);
        }
        Map<Integer, PerspectiveDefinition> grouped = group(document.perspectives());
        logger.info(String.format("Loaded %d perspectives from %s", grouped.size(), path));
        return grouped;
    }

    /**
     * Merges entries by id: rules are concatenated in order, flags are and-ed and the
     * first name wins.
     */
    static Map<Integer, PerspectiveDefinition> group(List<PerspectiveDefinition> entries) {
        Map<Integer, PerspectiveDefinition> out = new LinkedHashMap<>();
        for (PerspectiveDefinition entry : entries) {
            if (entry.id() == null) {
                throw new PerspectiveLoadException("Perspective entry without id: " + entry.name());
            }
            out.merge(entry.id(), entry, (existing, next) -> {
                List<RuleDefinition> rules = new ArrayList<>(existing.rules());
                rules.addAll(next.rules());
                return new PerspectiveDefinition(existing.id(),
                        existing.name() != null ? existing.name() : next.name(),
                        existing.active() && next.active(),
                        existing.supported() && next.supported(),
                        rules);
            });
        }
        return out;
    }
}
