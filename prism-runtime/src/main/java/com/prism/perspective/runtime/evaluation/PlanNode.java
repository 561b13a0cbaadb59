package com.prism.perspective.runtime.evaluation;

import com.prism.perspective.runtime.expr.Expr;
import com.prism.perspective.runtime.frame.Column;
import com.prism.perspective.runtime.frame.DataType;
import com.prism.perspective.runtime.frame.Frame;
import com.prism.perspective.runtime.frame.FrameException;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One operator of a lazy plan. Nodes are immutable and may be shared by several
 * downstream plans; {@link PlanExecutor} evaluates a shared node once per run.
 */
abstract class PlanNode {

    /** Output column names, resolved without executing the plan. */
    abstract List<String> schema();

    abstract Frame execute(PlanExecutor executor);

    abstract String describe();

    static final class Source extends PlanNode {
        private final Frame frame;

        Source(Frame frame) {
            this.frame = frame;
        }

        @Override
        List<String> schema() {
            return frame.columnNames();
        }

        @Override
        Frame execute(PlanExecutor executor) {
            return frame;
        }

        @Override
        String describe() {
            return "SOURCE " + frame;
        }
    }

    static final class WithColumns extends PlanNode {
        private final PlanNode input;
        private final LinkedHashMap<String, Expr> exprs;

        WithColumns(PlanNode input, Map<String, Expr> exprs) {
            this.input = input;
            this.exprs = new LinkedHashMap<>(exprs);
        }

        @Override
        List<String> schema() {
            List<String> names = new ArrayList<>(input.schema());
            for (String name : exprs.keySet()) {
                if (!names.contains(name)) {
                    names.add(name);
                }
            }
            return names;
        }

        @Override
        Frame execute(PlanExecutor executor) {
            Frame frame = executor.execute(input);
            // All expressions see the input frame, not each other's output.
            LinkedHashMap<String, Column> added = new LinkedHashMap<>();
            exprs.forEach((name, expr) -> added.put(name, ExprEvaluator.evaluate(expr, frame)));
            return frame.withColumns(added);
        }

        @Override
        String describe() {
            return "WITH_COLUMNS " + exprs.keySet();
        }
    }

    static final class Filter extends PlanNode {
        private final PlanNode input;
        private final Expr predicate;

        Filter(PlanNode input, Expr predicate) {
            this.input = input;
            this.predicate = predicate;
        }

        @Override
        List<String> schema() {
            return input.schema();
        }

        @Override
        Frame execute(PlanExecutor executor) {
            Frame frame = executor.execute(input);
            return frame.filter(ExprEvaluator.evaluate(predicate, frame));
        }

        @Override
        String describe() {
            return "FILTER " + predicate;
        }
    }

    static final class Select extends PlanNode {
        private final PlanNode input;
        private final List<String> names;

        Select(PlanNode input, List<String> names) {
            this.input = input;
            this.names = List.copyOf(names);
        }

        @Override
        List<String> schema() {
            return names;
        }

        @Override
        Frame execute(PlanExecutor executor) {
            return executor.execute(input).select(names);
        }

        @Override
        String describe() {
            return "SELECT " + names;
        }
    }

    static final class Rename extends PlanNode {
        private final PlanNode input;
        private final Map<String, String> mapping;

        Rename(PlanNode input, Map<String, String> mapping) {
            this.input = input;
            this.mapping = Map.copyOf(mapping);
        }

        @Override
        List<String> schema() {
            List<String> names = new ArrayList<>();
            for (String name : input.schema()) {
                names.add(mapping.getOrDefault(name, name));
            }
            return names;
        }

        @Override
        Frame execute(PlanExecutor executor) {
            return executor.execute(input).rename(mapping);
        }

        @Override
        String describe() {
            return "RENAME " + mapping;
        }
    }

    /** Keeps the first row of every distinct combination of the subset columns. */
    static final class Unique extends PlanNode {
        private final PlanNode input;
        private final List<String> subset;

        Unique(PlanNode input, List<String> subset) {
            this.input = input;
            this.subset = List.copyOf(subset);
        }

        @Override
        List<String> schema() {
            return input.schema();
        }

        @Override
        Frame execute(PlanExecutor executor) {
            Frame frame = executor.execute(input);
            IntArrayList first = new IntArrayList();
            for (IntArrayList rows : frame.groupIndices(subset).values()) {
                first.add(rows.getInt(0));
            }
            return frame.take(first.toIntArray());
        }

        @Override
        String describe() {
            return "UNIQUE " + subset;
        }
    }

    /**
     * Left join. Unmatched left rows get nulls on the right side, right key columns are
     * dropped, and right columns whose names collide with the left get a suffix.
     */
    static final class LeftJoin extends PlanNode {
        static final String SUFFIX = "_right";

        private final PlanNode left;
        private final PlanNode right;
        private final List<String> leftOn;
        private final List<String> rightOn;

        LeftJoin(PlanNode left, PlanNode right, List<String> leftOn, List<String> rightOn) {
            if (leftOn.size() != rightOn.size() || leftOn.isEmpty()) {
                throw new FrameException("Join keys must be non-empty and of equal length: "
                        + leftOn + " / " + rightOn);
            }
            this.left = left;
            this.right = right;
            this.leftOn = List.copyOf(leftOn);
            this.rightOn = List.copyOf(rightOn);
        }

        @Override
        List<String> schema() {
            List<String> names = new ArrayList<>(left.schema());
            Set<String> leftNames = new HashSet<>(names);
            for (String name : right.schema()) {
                if (!rightOn.contains(name)) {
                    names.add(leftNames.contains(name) ? name + SUFFIX : name);
                }
            }
            return names;
        }

        @Override
        Frame execute(PlanExecutor executor) {
            Frame l = executor.execute(left);
            Frame r = executor.execute(right);

            Map<List<Object>, IntArrayList> index = r.groupIndices(rightOn);
            Map<List<Object>, IntArrayList> leftGroups = l.groupIndices(leftOn);

            IntArrayList leftRows = new IntArrayList(l.height());
            IntArrayList rightRows = new IntArrayList(l.height());
            // Output rows follow the left input order.
            int[][] matchesByRow = new int[l.height()][];
            for (Map.Entry<List<Object>, IntArrayList> group : leftGroups.entrySet()) {
                IntArrayList matches = group.getKey().contains(null) ? null : index.get(group.getKey());
                int[] m = matches == null ? null : matches.toIntArray();
                for (int k = 0; k < group.getValue().size(); k++) {
                    matchesByRow[group.getValue().getInt(k)] = m;
                }
            }
            for (int row = 0; row < matchesByRow.length; row++) {
                int[] m = matchesByRow[row];
                if (m == null) {
                    leftRows.add(row);
                    rightRows.add(-1);
                } else {
                    for (int rr : m) {
                        leftRows.add(row);
                        rightRows.add(rr);
                    }
                }
            }

            Frame joined = l.take(leftRows.toIntArray());
            int[] rightIdx = rightRows.toIntArray();
            LinkedHashMap<String, Column> added = new LinkedHashMap<>();
            for (String name : r.columnNames()) {
                if (rightOn.contains(name)) {
                    continue;
                }
                String target = l.hasColumn(name) ? name + SUFFIX : name;
                added.put(target, r.column(name).take(rightIdx));
            }
            return joined.withColumns(added);
        }

        @Override
        String describe() {
            return "LEFT_JOIN " + leftOn + " = " + rightOn;
        }
    }

    /** Group-by with sum aggregations; an all-null group sums to zero. */
    static final class GroupBySum extends PlanNode {
        private final PlanNode input;
        private final List<String> keys;
        private final LinkedHashMap<String, Expr> sums;

        GroupBySum(PlanNode input, List<String> keys, Map<String, Expr> sums) {
            this.input = input;
            this.keys = List.copyOf(keys);
            this.sums = new LinkedHashMap<>(sums);
        }

        @Override
        List<String> schema() {
            List<String> names = new ArrayList<>(keys);
            names.addAll(sums.keySet());
            return names;
        }

        @Override
        Frame execute(PlanExecutor executor) {
            Frame frame = executor.execute(input);
            Map<List<Object>, IntArrayList> groups = frame.groupIndices(keys);
            int[] first = new int[groups.size()];
            int g = 0;
            for (IntArrayList rows : groups.values()) {
                first[g++] = rows.getInt(0);
            }
            Frame out = frame.select(keys).take(first);

            LinkedHashMap<String, Column> added = new LinkedHashMap<>();
            for (Map.Entry<String, Expr> agg : sums.entrySet()) {
                Column values = ExprEvaluator.evaluate(agg.getValue(), frame);
                added.put(agg.getKey(), sum(values, groups));
            }
            return out.withColumns(added);
        }

        private static Column sum(Column values, Map<List<Object>, IntArrayList> groups) {
            boolean integral = values.type() == DataType.LONG;
            if (!integral && values.type() != DataType.DOUBLE && values.type() != DataType.NULL) {
                throw new FrameException("Sum requires a numeric column, got " + values.type());
            }
            long[] longs = new long[groups.size()];
            double[] doubles = new double[groups.size()];
            int g = 0;
            for (IntArrayList rows : groups.values()) {
                for (int k = 0; k < rows.size(); k++) {
                    int row = rows.getInt(k);
                    if (values.isNull(row)) {
                        continue;
                    }
                    if (integral) {
                        longs[g] += values.getLong(row);
                    } else {
                        doubles[g] += values.getDouble(row);
                    }
                }
                g++;
            }
            return integral ? Column.ofLongs(longs, new BitSet()) : Column.ofDoubles(doubles, new BitSet());
        }

        @Override
        String describe() {
            return "GROUP_BY " + keys + " SUM " + sums.keySet();
        }
    }
}
