package com.prism.perspective.compiler;

import com.prism.perspective.api.ICriteriaCompiler;
import com.prism.perspective.api.exceptions.ConfigurationException;
import com.prism.perspective.api.exceptions.CriteriaValueException;
import com.prism.perspective.api.model.Criteria;
import com.prism.perspective.api.model.CriteriaOperator;
import com.prism.perspective.api.model.NestedCriteria;
import com.prism.perspective.api.model.NestedValues;
import com.prism.perspective.runtime.expr.Expr;
import com.prism.perspective.runtime.expr.Exprs;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.prism.perspective.runtime.expr.Exprs.col;

/**
 * Compiles {@link Criteria} trees into boolean {@link Expr} trees.
 * <p>
 * Compilation is pure: the same criteria, perspective id and nested values always
 * yield an equal expression, and nothing is evaluated here.
 *
 * <h3>Nested membership</h3>
 * An {@code In}/{@code NotIn} leaf whose value is itself a criteria tree reads its
 * value set from {@link NestedValues}. When no value set was resolved for it the
 * leaf matches every record and a warning is logged; in strict mode a
 * {@link ConfigurationException} is raised instead.
 */
public class CriteriaCompiler implements ICriteriaCompiler {
    private static final Logger logger = Logger.getLogger(CriteriaCompiler.class.getName());

    private static final List<Object> EMPTY_RANGE = List.of(0.0, 0.0);

    private final boolean strictNestedCriteria;

    public CriteriaCompiler() {
        this(false);
    }

    public CriteriaCompiler(boolean strictNestedCriteria) {
        this.strictNestedCriteria = strictNestedCriteria;
    }

    @Override
    public Expr compile(Criteria criteria, Integer perspectiveId, NestedValues nestedValues) {
        if (criteria == null) {
            return Exprs.TRUE;
        }
        if (criteria instanceof Criteria.And and) {
            return Exprs.all(compileAll(and.children(), perspectiveId, nestedValues));
        }
        if (criteria instanceof Criteria.Or or) {
            return Exprs.any(compileAll(or.children(), perspectiveId, nestedValues));
        }
        if (criteria instanceof Criteria.Not not) {
            return compile(not.child(), perspectiveId, nestedValues).not();
        }
        return compileLeaf((Criteria.Leaf) criteria, perspectiveId, nestedValues);
    }

    private List<Expr> compileAll(List<Criteria> children, Integer perspectiveId, NestedValues nestedValues) {
        List<Expr> out = new ArrayList<>(children.size());
        for (Criteria child : children) {
            out.add(compile(child, perspectiveId, nestedValues));
        }
        return out;
    }

    private Expr compileLeaf(Criteria.Leaf leaf, Integer perspectiveId, NestedValues nestedValues) {
        Expr column = col(leaf.column());
        Object value = CriteriaValueParser.substitutePerspectiveId(leaf.value(), perspectiveId);

        switch (leaf.operator()) {
            case EQ:
            case NE:
            case GT:
            case LT:
            case GE:
            case LE:
                return compileComparison(leaf, column, CriteriaValueParser.parseScalar(value));
            case IN:
            case NOT_IN: {
                Expr membership = value instanceof NestedCriteria nested
                        ? compileNestedMembership(leaf, nested, column, nestedValues)
                        : column.isIn(CriteriaValueParser.parseList(value));
                if (membership == Exprs.TRUE) {
                    return membership;
                }
                return leaf.operator() == CriteriaOperator.IN
                        ? membership : membership.not();
            }
            case IS_NULL:
                return column.isNull();
            case IS_NOT_NULL:
                return column.isNotNull();
            case BETWEEN:
            case NOT_BETWEEN: {
                List<Object> range = parseRangeOrEmpty(leaf, value);
                if (leaf.operator() == CriteriaOperator.BETWEEN) {
                    return column.ge(range.get(0)).and(column.le(range.get(1)));
                }
                return column.lt(range.get(0)).or(column.gt(range.get(1)));
            }
            case LIKE:
                return compileLike(column, value);
            case NOT_LIKE:
                return compileLike(column, value).not();
            default:
                throw new ConfigurationException("Unsupported operator: " + leaf.operator());
        }
    }

    private Expr compileComparison(Criteria.Leaf leaf, Expr column, Object value) {
        if (value instanceof List || value instanceof NestedCriteria) {
            throw new CriteriaValueException(CriteriaValueException.Reason.UNSUPPORTED_VALUE, value,
                    "Operator " + leaf.operator().symbol() + " on '" + leaf.column() + "' needs a scalar");
        }
        if (value == null) {
            return switch (leaf.operator()) {
                case EQ -> column.isNull();
                case NE -> column.isNotNull();
                default -> throw new CriteriaValueException(CriteriaValueException.Reason.UNSUPPORTED_VALUE,
                        null, "Operator " + leaf.operator().symbol() + " on '" + leaf.column() + "' needs a value");
            };
        }
        return switch (leaf.operator()) {
            case EQ -> column.eq(value);
            case NE -> column.ne(value);
            case GT -> column.gt(value);
            case LT -> column.lt(value);
            case GE -> column.ge(value);
            default -> column.le(value);
        };
    }

    private Expr compileNestedMembership(Criteria.Leaf leaf, NestedCriteria nested, Expr column,
                                         NestedValues nestedValues) {
        Optional<List<Object>> values = nestedValues.lookup(nested.cacheKey());
        if (values.isPresent()) {
            return column.isIn(values.get());
        }
        if (strictNestedCriteria) {
            throw new ConfigurationException("No value set resolved for nested criteria on '"
                    + leaf.column() + "': " + nested.cacheKey());
        }
        logger.warning("No value set resolved for nested criteria on '" + leaf.column()
                + "', leaf matches all records: " + nested.cacheKey());
        return Exprs.TRUE;
    }

    private List<Object> parseRangeOrEmpty(Criteria.Leaf leaf, Object value) {
        try {
            return CriteriaValueParser.parseRange(value);
        } catch (CriteriaValueException e) {
            logger.log(Level.WARNING, "Malformed range on '" + leaf.column() + "', using [0, 0]", e);
            return EMPTY_RANGE;
        }
    }

    private Expr compileLike(Expr column, Object value) {
        String pattern = String.valueOf(CriteriaValueParser.parseScalar(value));
        if (pattern.length() >= 2 && pattern.startsWith("%") && pattern.endsWith("%")) {
            return Exprs.matches(column, Expr.MatchKind.CONTAINS, pattern.substring(1, pattern.length() - 1));
        }
        if (pattern.endsWith("%")) {
            return Exprs.matches(column, Expr.MatchKind.STARTS_WITH, pattern.substring(0, pattern.length() - 1));
        }
        if (pattern.startsWith("%")) {
            return Exprs.matches(column, Expr.MatchKind.ENDS_WITH, pattern.substring(1));
        }
        return Exprs.matches(column, Expr.MatchKind.EQUALS, pattern);
    }
}
