package com.prism.perspective.runtime.expr;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Column expression evaluated over a whole frame at once.
 * <p>
 * Expressions are immutable trees of records, so two independently built trees
 * with the same shape are {@code equals}. Boolean expressions follow three-valued
 * logic: a comparison against a null is null, {@code false AND null} is false,
 * {@code true OR null} is true, and a null condition selects the
 * {@code otherwise} branch of a {@link When}.
 */
public sealed interface Expr permits Expr.Col, Expr.Lit, Expr.Compare, Expr.Logical, Expr.Not,
        Expr.Arith, Expr.NullCheck, Expr.InSet, Expr.When, Expr.StringMatch, Expr.FillNull, Expr.SumOver {

    enum CompareOp { EQ, NE, GT, LT, GE, LE }

    enum LogicalOp { AND, OR }

    enum ArithOp { ADD, SUB, MUL, DIV }

    enum MatchKind { CONTAINS, STARTS_WITH, ENDS_WITH, EQUALS }

    record Col(String name) implements Expr {
        public Col {
            Objects.requireNonNull(name, "name");
        }
    }

    record Lit(Object value) implements Expr {
    }

    record Compare(CompareOp op, Expr left, Expr right) implements Expr {
    }

    record Logical(LogicalOp op, Expr left, Expr right) implements Expr {
    }

    record Not(Expr input) implements Expr {
    }

    record Arith(ArithOp op, Expr left, Expr right) implements Expr {
    }

    record NullCheck(Expr input, boolean negated) implements Expr {
    }

    /** Membership test against a fixed list of scalar values. */
    record InSet(Expr input, List<Object> values) implements Expr {
        public InSet {
            values = List.copyOf(values);
        }
    }

    record When(Expr condition, Expr then, Expr otherwise) implements Expr {
    }

    /** Case-insensitive string match; the pattern is stored lower-cased. */
    record StringMatch(Expr input, MatchKind kind, String pattern) implements Expr {
    }

    record FillNull(Expr input, Object value) implements Expr {
    }

    /** Sum of {@code input} within each partition, broadcast back to every row. */
    record SumOver(Expr input, List<String> partitionBy) implements Expr {
        public SumOver {
            partitionBy = List.copyOf(partitionBy);
        }
    }

    default Expr eq(Object value) {
        return new Compare(CompareOp.EQ, this, Exprs.wrap(value));
    }

    default Expr ne(Object value) {
        return new Compare(CompareOp.NE, this, Exprs.wrap(value));
    }

    default Expr gt(Object value) {
        return new Compare(CompareOp.GT, this, Exprs.wrap(value));
    }

    default Expr lt(Object value) {
        return new Compare(CompareOp.LT, this, Exprs.wrap(value));
    }

    default Expr ge(Object value) {
        return new Compare(CompareOp.GE, this, Exprs.wrap(value));
    }

    default Expr le(Object value) {
        return new Compare(CompareOp.LE, this, Exprs.wrap(value));
    }

    default Expr and(Expr other) {
        return new Logical(LogicalOp.AND, this, other);
    }

    default Expr or(Expr other) {
        return new Logical(LogicalOp.OR, this, other);
    }

    default Expr not() {
        return new Not(this);
    }

    default Expr add(Object other) {
        return new Arith(ArithOp.ADD, this, Exprs.wrap(other));
    }

    default Expr mul(Object other) {
        return new Arith(ArithOp.MUL, this, Exprs.wrap(other));
    }

    default Expr div(Object other) {
        return new Arith(ArithOp.DIV, this, Exprs.wrap(other));
    }

    default Expr isNull() {
        return new NullCheck(this, false);
    }

    default Expr isNotNull() {
        return new NullCheck(this, true);
    }

    default Expr isIn(Collection<?> values) {
        return new InSet(this, List.copyOf(values));
    }

    default Expr fillNull(Object value) {
        return new FillNull(this, value);
    }

    default Expr sumOver(List<String> partitionBy) {
        return new SumOver(this, partitionBy);
    }

    /**
     * Names of every column this expression reads, including window partition keys.
     */
    default Set<String> columns() {
        Set<String> out = new LinkedHashSet<>();
        Exprs.collectColumns(this, out);
        return out;
    }

    /**
     * True if {@code candidate} occurs anywhere in this tree, including the root.
     */
    default boolean contains(Expr candidate) {
        return Exprs.containsSubtree(this, candidate);
    }
}
