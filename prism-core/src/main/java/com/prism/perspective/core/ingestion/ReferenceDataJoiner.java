/*
 * Copyright (c) 2025 Prism Perspective Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.prism.perspective.core.ingestion;

import com.prism.perspective.api.IReferenceLoader;
import com.prism.perspective.api.exceptions.ReferenceLoadException;
import com.prism.perspective.api.model.NullSentinels;
import com.prism.perspective.api.model.ReferenceQuery;
import com.prism.perspective.runtime.evaluation.LazyFrame;
import com.prism.perspective.runtime.frame.Column;
import com.prism.perspective.runtime.frame.Frame;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

import static com.prism.perspective.core.ingestion.DataIngestion.INSTRUMENT_ID;
import static com.prism.perspective.core.ingestion.DataIngestion.PARENT_INSTRUMENT_ID;

/**
 * Fetches the reference tables a request needs and left-joins them onto the
 * position and lookthrough frames.
 * <p>
 * Tables are fetched in parallel, one task per table, on a pool bounded by
 * {@code maxThreads}. {@code PARENT_INSTRUMENT} is served from the
 * {@code INSTRUMENT} table using the parent ids; its columns are prefixed with
 * {@code parent_} and joined on {@code parent_instrument_id}. Every other table
 * joins on {@code instrument_id}. Any failed fetch aborts the request with a
 * {@link ReferenceLoadException}.
 */
public class ReferenceDataJoiner {
    private static final Logger logger = Logger.getLogger(ReferenceDataJoiner.class.getName());

    public static final String POSITION_DATA = "position_data";
    public static final String PARENT_INSTRUMENT = "PARENT_INSTRUMENT";
    public static final String INSTRUMENT = "INSTRUMENT";
    static final String PARENT_PREFIX = "parent_";

    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    private final IReferenceLoader loader;
    private final int maxThreads;

    public ReferenceDataJoiner(IReferenceLoader loader, int maxThreads) {
        if (maxThreads < 1) {
            throw new IllegalArgumentException("maxThreads must be at least 1, got " + maxThreads);
        }
        this.loader = loader;
        this.maxThreads = maxThreads;
    }

    public IngestedFrames join(IngestedFrames frames, Map<String, List<String>> requiredTables,
                               String effectiveDate, String systemVersionTimestamp) {
        Map<String, List<String>> tables = new LinkedHashMap<>(requiredTables);
        tables.remove(POSITION_DATA);
        if (tables.isEmpty() || !frames.hasPositions()) {
            return frames;
        }

        List<Long> instrumentIds = distinctIds(frames, INSTRUMENT_ID);
        List<Long> parentIds = distinctIds(frames, PARENT_INSTRUMENT_ID);
        Map<String, ReferenceQuery> queries = new LinkedHashMap<>();
        tables.forEach((table, columns) -> {
            boolean parent = PARENT_INSTRUMENT.equals(table);
            List<Long> ids = parent ? parentIds : instrumentIds;
            if (ids.isEmpty()) {
                logger.fine(() -> "No ids to fetch for " + table + ", skipping");
                return;
            }
            queries.put(table, new ReferenceQuery(parent ? INSTRUMENT : table, columns, ids,
                    effectiveDate, systemVersionTimestamp));
        });
        if (queries.isEmpty()) {
            return frames;
        }

        Map<String, Frame> loaded = fetchAll(queries);
        Frame positions = frames.positions();
        Frame lookthroughs = frames.lookthroughs();
        for (Map.Entry<String, Frame> entry : loaded.entrySet()) {
            if (PARENT_INSTRUMENT.equals(entry.getKey())) {
                Frame parent = prefixParentColumns(entry.getValue());
                positions = joinOn(positions, parent, PARENT_INSTRUMENT_ID);
                lookthroughs = joinOn(lookthroughs, parent, PARENT_INSTRUMENT_ID);
            } else {
                positions = joinOn(positions, entry.getValue(), INSTRUMENT_ID);
                lookthroughs = joinOn(lookthroughs, entry.getValue(), INSTRUMENT_ID);
            }
        }
        return new IngestedFrames(positions, lookthroughs);
    }

    private Map<String, Frame> fetchAll(Map<String, ReferenceQuery> queries) {
        int threads = Math.min(queries.size(), maxThreads);
        int pool = POOL_SEQUENCE.incrementAndGet();
        AtomicInteger threadSequence = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "Reference-Loader-" + pool + "-" + threadSequence.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            Map<String, Future<Frame>> futures = new LinkedHashMap<>();
            queries.forEach((table, query) -> futures.put(table, executor.submit(() -> loader.load(query))));

            Map<String, Frame> out = new LinkedHashMap<>();
            for (Map.Entry<String, Future<Frame>> future : futures.entrySet()) {
                out.put(future.getKey(), await(future.getKey(), future.getValue()));
            }
            logger.fine(() -> "Loaded reference tables " + out.keySet() + " on " + threads + " threads");
            return out;
        } finally {
            executor.shutdownNow();
        }
    }

    private static Frame await(String table, Future<Frame> future) {
        try {
            Frame frame = future.get();
            if (frame == null) {
                throw new ReferenceLoadException(table, "loader returned no data", null);
            }
            return frame;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ReferenceLoadException rle) {
                throw rle;
            }
            throw new ReferenceLoadException(table, String.valueOf(cause.getMessage()), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReferenceLoadException(table, "interrupted", e);
        }
    }

    static Frame prefixParentColumns(Frame parent) {
        Map<String, String> mapping = new LinkedHashMap<>();
        for (String name : parent.columnNames()) {
            mapping.put(name, INSTRUMENT_ID.equals(name) ? PARENT_INSTRUMENT_ID : PARENT_PREFIX + name);
        }
        return parent.rename(mapping);
    }

    private static Frame joinOn(Frame records, Frame reference, String key) {
        if (records.isEmpty() || !records.hasColumn(key) || !reference.hasColumn(key)) {
            return records;
        }
        return LazyFrame.of(records).leftJoin(LazyFrame.of(reference), List.of(key)).collect();
    }

    /**
     * Distinct ids of {@code column} across both frames, skipping nulls, sentinels
     * and values that are not integral.
     */
    static List<Long> distinctIds(IngestedFrames frames, String column) {
        Set<Long> ids = new LinkedHashSet<>();
        for (Frame frame : List.of(frames.positions(), frames.lookthroughs())) {
            if (!frame.hasColumn(column)) {
                continue;
            }
            Column values = frame.column(column);
            for (int i = 0; i < values.size(); i++) {
                Long id = asId(values.get(i));
                if (id != null && id != NullSentinels.INT_NULL) {
                    ids.add(id);
                }
            }
        }
        return new ArrayList<>(ids);
    }

    private static Long asId(Object value) {
        if (value == null || NullSentinels.isSentinel(value)) {
            return null;
        }
        if (value instanceof Long l) {
            return l;
        }
        if (value instanceof Double d) {
            return d == Math.rint(d) ? d.longValue() : null;
        }
        if (value instanceof String s) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
