package com.prism.perspective.infra.loader;

import com.prism.perspective.api.IReferenceLoader;
import com.prism.perspective.api.exceptions.ReferenceLoadException;
import com.prism.perspective.api.model.ReferenceQuery;
import com.prism.perspective.runtime.evaluation.ExprEvaluator;
import com.prism.perspective.runtime.frame.Frame;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.prism.perspective.runtime.expr.Exprs.col;

/**
 * Reference tables held in memory, for tests and local runs.
 * <p>
 * Each table needs an {@code instrument_id} column. A table with an {@code ed}
 * column is restricted to rows whose {@code ed} equals the query's effective date.
 */
public class InMemoryReferenceLoader implements IReferenceLoader {

    static final String INSTRUMENT_ID = "instrument_id";
    static final String EFFECTIVE_DATE = "ed";

    private final Map<String, Frame> tables = new ConcurrentHashMap<>();
    private final List<ReferenceQuery> queries = new CopyOnWriteArrayList<>();

    public InMemoryReferenceLoader withTable(String name, Frame table) {
        if (!table.hasColumn(INSTRUMENT_ID)) {
            throw new IllegalArgumentException("Reference table " + name + " has no " + INSTRUMENT_ID + " column");
        }
        tables.put(name, table);
        return this;
    }

    @Override
    public Frame load(ReferenceQuery query) {
        queries.add(query);
        Frame table = tables.get(query.table());
        if (table == null) {
            throw new ReferenceLoadException(query.table(), "no such table", null);
        }
        List<String> columns = new ArrayList<>();
        columns.add(INSTRUMENT_ID);
        for (String column : query.columns()) {
            if (!table.hasColumn(column)) {
                throw new ReferenceLoadException(query.table(), "unknown column " + column, null);
            }
            if (!columns.contains(column)) {
                columns.add(column);
            }
        }

        Frame rows = table.filter(ExprEvaluator.evaluate(col(INSTRUMENT_ID).isIn(query.instrumentIds()), table));
        if (rows.hasColumn(EFFECTIVE_DATE) && query.effectiveDate() != null) {
            rows = rows.filter(ExprEvaluator.evaluate(col(EFFECTIVE_DATE).eq(query.effectiveDate()), rows));
        }
        return rows.select(columns);
    }

    /**
     * Queries received so far, in arrival order.
     */
    public List<ReferenceQuery> queries() {
        return Collections.unmodifiableList(new ArrayList<>(queries));
    }
}
