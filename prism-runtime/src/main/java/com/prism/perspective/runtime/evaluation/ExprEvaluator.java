package com.prism.perspective.runtime.evaluation;

import com.prism.perspective.runtime.expr.Expr;
import com.prism.perspective.runtime.frame.Column;
import com.prism.perspective.runtime.frame.DataType;
import com.prism.perspective.runtime.frame.Frame;
import com.prism.perspective.runtime.frame.FrameException;
import it.unimi.dsi.fastutil.doubles.DoubleOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;

import java.util.BitSet;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Vectorized evaluator for {@link Expr} trees.
 * <p>
 * Each node is evaluated once over the whole frame and produces a {@link Column};
 * there is no per-row interpretation of the tree. A column referenced by an
 * expression but absent from the frame evaluates to an all-null column.
 */
public final class ExprEvaluator {
    private static final Logger logger = Logger.getLogger(ExprEvaluator.class.getName());

    private ExprEvaluator() {
        throw new AssertionError("No instances");
    }

    public static Column evaluate(Expr expr, Frame frame) {
        int n = frame.height();
        if (expr instanceof Expr.Col c) {
            if (!frame.hasColumn(c.name())) {
                logger.fine(() -> "Column '" + c.name() + "' not present, evaluating as null");
                return Column.nulls(n);
            }
            return frame.column(c.name());
        }
        if (expr instanceof Expr.Lit l) {
            return Column.constant(l.value(), n);
        }
        if (expr instanceof Expr.Compare c) {
            return compare(c.op(), evaluate(c.left(), frame), evaluate(c.right(), frame));
        }
        if (expr instanceof Expr.Logical l) {
            return logical(l.op(), evaluate(l.left(), frame), evaluate(l.right(), frame));
        }
        if (expr instanceof Expr.Not not) {
            return negate(evaluate(not.input(), frame));
        }
        if (expr instanceof Expr.Arith a) {
            return arithmetic(a.op(), evaluate(a.left(), frame), evaluate(a.right(), frame));
        }
        if (expr instanceof Expr.NullCheck nc) {
            Column input = evaluate(nc.input(), frame);
            boolean[] out = new boolean[n];
            for (int i = 0; i < n; i++) {
                out[i] = input.isNull(i) != nc.negated();
            }
            return Column.ofBooleans(out, new BitSet());
        }
        if (expr instanceof Expr.InSet in) {
            return membership(evaluate(in.input(), frame), in.values());
        }
        if (expr instanceof Expr.When w) {
            return conditional(evaluate(w.condition(), frame),
                    evaluate(w.then(), frame), evaluate(w.otherwise(), frame));
        }
        if (expr instanceof Expr.StringMatch sm) {
            return stringMatch(evaluate(sm.input(), frame), sm.kind(), sm.pattern());
        }
        if (expr instanceof Expr.FillNull f) {
            return evaluate(f.input(), frame).fillNull(f.value());
        }
        if (expr instanceof Expr.SumOver s) {
            return sumOver(evaluate(s.input(), frame), frame, s.partitionBy());
        }
        throw new FrameException("Unsupported expression: " + expr);
    }

    // ========== Comparison ==========

    private static Column compare(Expr.CompareOp op, Column left, Column right) {
        int n = left.size();
        boolean[] out = new boolean[n];
        BitSet nulls = new BitSet(n);
        for (int i = 0; i < n; i++) {
            if (left.isNull(i) || right.isNull(i)) {
                nulls.set(i);
                continue;
            }
            Integer cmp = compareAt(left, right, i);
            if (cmp == null) {
                // Values of unrelated types are never equal and never ordered.
                out[i] = op == Expr.CompareOp.NE;
            } else {
                out[i] = switch (op) {
                    case EQ -> cmp == 0;
                    case NE -> cmp != 0;
                    case GT -> cmp > 0;
                    case LT -> cmp < 0;
                    case GE -> cmp >= 0;
                    case LE -> cmp <= 0;
                };
            }
        }
        return Column.ofBooleans(out, nulls);
    }

    private static Integer compareAt(Column left, Column right, int i) {
        DataType lt = left.type();
        DataType rt = right.type();
        if (lt == DataType.LONG && rt == DataType.LONG) {
            return Long.compare(left.getLong(i), right.getLong(i));
        }
        if (lt.isNumeric() && rt.isNumeric()) {
            return compareDoubles(left.getDouble(i), right.getDouble(i));
        }
        if (lt == DataType.STRING && rt == DataType.STRING) {
            return left.getString(i).compareTo(right.getString(i));
        }
        if (lt == DataType.BOOLEAN && rt == DataType.BOOLEAN) {
            return Boolean.compare(left.getBoolean(i), right.getBoolean(i));
        }
        if (lt.isNumeric() && rt == DataType.STRING) {
            Double parsed = parseNumber(right.getString(i));
            return parsed == null ? null : compareDoubles(left.getDouble(i), parsed);
        }
        if (lt == DataType.STRING && rt.isNumeric()) {
            Double parsed = parseNumber(left.getString(i));
            return parsed == null ? null : compareDoubles(parsed, right.getDouble(i));
        }
        return null;
    }

    private static int compareDoubles(double a, double b) {
        return a < b ? -1 : (a > b ? 1 : 0);
    }

    private static Double parseNumber(String s) {
        try {
            return Double.parseDouble(s.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    // ========== Boolean logic ==========

    private static Column logical(Expr.LogicalOp op, Column left, Column right) {
        requireBoolean(left, op.name());
        requireBoolean(right, op.name());
        int n = left.size();
        boolean[] out = new boolean[n];
        BitSet nulls = new BitSet(n);
        boolean dominant = op == Expr.LogicalOp.OR;
        for (int i = 0; i < n; i++) {
            boolean ln = left.isNull(i);
            boolean rn = right.isNull(i);
            if ((!ln && left.getBoolean(i) == dominant) || (!rn && right.getBoolean(i) == dominant)) {
                out[i] = dominant;
            } else if (ln || rn) {
                nulls.set(i);
            } else {
                out[i] = !dominant;
            }
        }
        return Column.ofBooleans(out, nulls);
    }

    private static Column negate(Column input) {
        requireBoolean(input, "NOT");
        int n = input.size();
        boolean[] out = new boolean[n];
        BitSet nulls = new BitSet(n);
        for (int i = 0; i < n; i++) {
            if (input.isNull(i)) {
                nulls.set(i);
            } else {
                out[i] = !input.getBoolean(i);
            }
        }
        return Column.ofBooleans(out, nulls);
    }

    private static void requireBoolean(Column column, String operation) {
        if (column.type() != DataType.BOOLEAN && column.type() != DataType.NULL) {
            throw new FrameException(operation + " requires BOOLEAN operands, got " + column.type());
        }
    }

    // ========== Arithmetic ==========

    private static Column arithmetic(Expr.ArithOp op, Column left, Column right) {
        int n = left.size();
        if (left.type() == DataType.NULL || right.type() == DataType.NULL) {
            return Column.ofDoubles(new double[n], allSet(n));
        }
        if (!left.type().isNumeric() || !right.type().isNumeric()) {
            throw new FrameException("Arithmetic " + op + " requires numeric operands, got "
                    + left.type() + " and " + right.type());
        }
        BitSet nulls = new BitSet(n);
        if (op != Expr.ArithOp.DIV && left.type() == DataType.LONG && right.type() == DataType.LONG) {
            long[] out = new long[n];
            for (int i = 0; i < n; i++) {
                if (left.isNull(i) || right.isNull(i)) {
                    nulls.set(i);
                    continue;
                }
                long a = left.getLong(i);
                long b = right.getLong(i);
                out[i] = switch (op) {
                    case ADD -> a + b;
                    case SUB -> a - b;
                    default -> a * b;
                };
            }
            return Column.ofLongs(out, nulls);
        }
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            if (left.isNull(i) || right.isNull(i)) {
                nulls.set(i);
                continue;
            }
            double a = left.getDouble(i);
            double b = right.getDouble(i);
            out[i] = switch (op) {
                case ADD -> a + b;
                case SUB -> a - b;
                case MUL -> a * b;
                case DIV -> a / b;
            };
        }
        return Column.ofDoubles(out, nulls);
    }

    // ========== Membership ==========

    private static Column membership(Column input, List<Object> values) {
        LongOpenHashSet longs = new LongOpenHashSet();
        DoubleOpenHashSet doubles = new DoubleOpenHashSet();
        ObjectOpenHashSet<String> strings = new ObjectOpenHashSet<>();
        boolean anyTrue = false;
        boolean anyFalse = false;
        for (Object v : values) {
            if (v instanceof Long || v instanceof Integer || v instanceof Short || v instanceof Byte) {
                longs.add(((Number) v).longValue());
                doubles.add(((Number) v).doubleValue());
            } else if (v instanceof Number num) {
                doubles.add(num.doubleValue());
            } else if (v instanceof Boolean b) {
                anyTrue |= b;
                anyFalse |= !b;
            } else if (v != null) {
                strings.add(v.toString());
            }
        }

        int n = input.size();
        boolean[] out = new boolean[n];
        BitSet nulls = new BitSet(n);
        for (int i = 0; i < n; i++) {
            if (input.isNull(i)) {
                nulls.set(i);
                continue;
            }
            out[i] = switch (input.type()) {
                case LONG -> longs.contains(input.getLong(i));
                case DOUBLE -> doubles.contains(input.getDouble(i));
                case STRING -> strings.contains(input.getString(i));
                case BOOLEAN -> input.getBoolean(i) ? anyTrue : anyFalse;
                case NULL -> false;
            };
        }
        return Column.ofBooleans(out, nulls);
    }

    // ========== Conditional ==========

    private static Column conditional(Column condition, Column then, Column otherwise) {
        requireBoolean(condition, "WHEN");
        int n = condition.size();
        DataType type = DataType.unify(then.type(), otherwise.type());
        BitSet nulls = new BitSet(n);
        switch (type) {
            case LONG: {
                long[] out = new long[n];
                for (int i = 0; i < n; i++) {
                    Column src = pick(condition, then, otherwise, i);
                    if (src.isNull(i)) {
                        nulls.set(i);
                    } else {
                        out[i] = src.getLong(i);
                    }
                }
                return Column.ofLongs(out, nulls);
            }
            case DOUBLE: {
                double[] out = new double[n];
                for (int i = 0; i < n; i++) {
                    Column src = pick(condition, then, otherwise, i);
                    if (src.isNull(i)) {
                        nulls.set(i);
                    } else {
                        out[i] = src.getDouble(i);
                    }
                }
                return Column.ofDoubles(out, nulls);
            }
            case BOOLEAN: {
                boolean[] out = new boolean[n];
                for (int i = 0; i < n; i++) {
                    Column src = pick(condition, then, otherwise, i);
                    if (src.isNull(i)) {
                        nulls.set(i);
                    } else {
                        out[i] = src.getBoolean(i);
                    }
                }
                return Column.ofBooleans(out, nulls);
            }
            case STRING: {
                String[] out = new String[n];
                for (int i = 0; i < n; i++) {
                    Column src = pick(condition, then, otherwise, i);
                    out[i] = src.isNull(i) ? null : src.getString(i);
                }
                return Column.ofStrings(out);
            }
            default:
                return Column.nulls(n);
        }
    }

    private static Column pick(Column condition, Column then, Column otherwise, int i) {
        return !condition.isNull(i) && condition.getBoolean(i) ? then : otherwise;
    }

    // ========== Strings ==========

    private static Column stringMatch(Column input, Expr.MatchKind kind, String pattern) {
        int n = input.size();
        boolean[] out = new boolean[n];
        BitSet nulls = new BitSet(n);
        for (int i = 0; i < n; i++) {
            if (input.isNull(i)) {
                nulls.set(i);
                continue;
            }
            String value = String.valueOf(input.get(i)).toLowerCase(Locale.ROOT);
            out[i] = switch (kind) {
                case CONTAINS -> value.contains(pattern);
                case STARTS_WITH -> value.startsWith(pattern);
                case ENDS_WITH -> value.endsWith(pattern);
                case EQUALS -> value.equals(pattern);
            };
        }
        return Column.ofBooleans(out, nulls);
    }

    // ========== Window ==========

    private static Column sumOver(Column input, Frame frame, List<String> partitionBy) {
        int n = input.size();
        if (input.type() != DataType.NULL && !input.type().isNumeric()) {
            throw new FrameException("Window sum requires a numeric input, got " + input.type());
        }
        boolean integral = input.type() == DataType.LONG;
        long[] longSums = integral ? new long[n] : null;
        double[] doubleSums = integral ? null : new double[n];
        for (IntArrayList rows : frame.groupIndices(partitionBy).values()) {
            long ls = 0;
            double ds = 0.0;
            for (int k = 0; k < rows.size(); k++) {
                int row = rows.getInt(k);
                if (!input.isNull(row)) {
                    if (integral) {
                        ls += input.getLong(row);
                    } else {
                        ds += input.getDouble(row);
                    }
                }
            }
            for (int k = 0; k < rows.size(); k++) {
                if (integral) {
                    longSums[rows.getInt(k)] = ls;
                } else {
                    doubleSums[rows.getInt(k)] = ds;
                }
            }
        }
        return integral ? Column.ofLongs(longSums, new BitSet()) : Column.ofDoubles(doubleSums, new BitSet());
    }

    private static BitSet allSet(int n) {
        BitSet bits = new BitSet(n);
        bits.set(0, n);
        return bits;
    }
}
