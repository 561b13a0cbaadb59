package com.prism.perspective.core.engine;

import com.prism.perspective.api.model.Criteria;
import com.prism.perspective.api.model.Modifier;
import com.prism.perspective.api.model.Perspective;
import com.prism.perspective.api.model.Rule;
import com.prism.perspective.compiler.NestedCriteriaCollector;
import com.prism.perspective.core.ingestion.ReferenceDataJoiner;
import com.prism.perspective.runtime.model.PerspectiveConfiguration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Works out which reference tables and columns a request needs: the
 * {@code required_columns} hints of the requested perspectives plus those of the
 * modifiers active for them. {@code position_data} is never fetched.
 * {@code INSTRUMENT_CATEGORIZATION} always contributes {@link #BASE_COLUMNS},
 * which the default modifiers read.
 */
public final class RequiredTablesResolver {
    private static final Logger logger = Logger.getLogger(RequiredTablesResolver.class.getName());

    public static final String INSTRUMENT_CATEGORIZATION = "INSTRUMENT_CATEGORIZATION";
    public static final List<String> BASE_COLUMNS = List.of("liquidity_type_id", "position_source_type_id");

    private RequiredTablesResolver() {
        throw new AssertionError("No instances");
    }

    public static Map<String, List<String>> resolve(PerspectiveConfiguration configuration,
                                                    Map<String, Map<Integer, List<String>>> requested) {
        Map<String, List<String>> tables = new LinkedHashMap<>();
        Set<String> modifiers = new LinkedHashSet<>();
        for (Map<Integer, List<String>> perspectives : requested.values()) {
            perspectives.forEach((id, names) -> {
                PerspectiveConfiguration.mergeRequiredColumns(tables, configuration.requiredColumnsForPerspective(id));
                modifiers.addAll(configuration.activeModifiers(names == null ? List.of() : names));
            });
        }
        PerspectiveConfiguration.mergeRequiredColumns(tables, configuration.requiredColumnsForModifiers(modifiers));
        PerspectiveConfiguration.mergeRequiredColumns(tables, Map.of(INSTRUMENT_CATEGORIZATION, BASE_COLUMNS));
        tables.remove(ReferenceDataJoiner.POSITION_DATA);

        warnOnUndeclaredTables(configuration, requested, modifiers, tables);
        return tables;
    }

    /**
     * Leaves may name their source table. A table named there but absent from
     * every hint is never fetched, so its columns will read as null.
     */
    private static void warnOnUndeclaredTables(PerspectiveConfiguration configuration,
                                               Map<String, Map<Integer, List<String>>> requested,
                                               Set<String> modifiers, Map<String, List<String>> tables) {
        List<Criteria> trees = new ArrayList<>();
        for (Map<Integer, List<String>> perspectives : requested.values()) {
            for (Integer id : perspectives.keySet()) {
                configuration.perspective(id).map(Perspective::rules)
                        .ifPresent(rules -> rules.stream().map(Rule::criteria).forEach(trees::add));
            }
        }
        for (String name : modifiers) {
            configuration.modifier(name).map(Modifier::criteria).ifPresent(trees::add);
        }
        for (String table : NestedCriteriaCollector.referencedTables(trees)) {
            if (!tables.containsKey(table) && !ReferenceDataJoiner.POSITION_DATA.equals(table)) {
                logger.warning("Criteria reference table " + table + " but no required_columns entry declares it");
            }
        }
    }
}
