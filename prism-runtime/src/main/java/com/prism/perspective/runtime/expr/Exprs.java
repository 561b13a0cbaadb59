package com.prism.perspective.runtime.expr;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Static factories for {@link Expr} trees.
 */
public final class Exprs {

    public static final Expr TRUE = new Expr.Lit(Boolean.TRUE);
    public static final Expr FALSE = new Expr.Lit(Boolean.FALSE);

    private Exprs() {
        throw new AssertionError("No instances");
    }

    public static Expr col(String name) {
        return new Expr.Col(name);
    }

    public static Expr lit(Object value) {
        return new Expr.Lit(value);
    }

    /**
     * Conjunction of all expressions; an empty list is {@link #TRUE}.
     */
    public static Expr all(List<Expr> exprs) {
        Expr result = null;
        for (Expr e : exprs) {
            result = result == null ? e : result.and(e);
        }
        return result == null ? TRUE : result;
    }

    /**
     * Disjunction of all expressions; an empty list is {@link #FALSE}.
     */
    public static Expr any(List<Expr> exprs) {
        Expr result = null;
        for (Expr e : exprs) {
            result = result == null ? e : result.or(e);
        }
        return result == null ? FALSE : result;
    }

    public static Expr matches(Expr input, Expr.MatchKind kind, String pattern) {
        return new Expr.StringMatch(input, kind, pattern.toLowerCase(Locale.ROOT));
    }

    public static WhenBuilder when(Expr condition) {
        return new WhenBuilder(condition);
    }

    public static final class WhenBuilder {
        private final Expr condition;

        private WhenBuilder(Expr condition) {
            this.condition = condition;
        }

        public ThenBuilder then(Object value) {
            return new ThenBuilder(condition, wrap(value));
        }
    }

    public static final class ThenBuilder {
        private final Expr condition;
        private final Expr then;

        private ThenBuilder(Expr condition, Expr then) {
            this.condition = condition;
            this.then = then;
        }

        public Expr otherwise(Object value) {
            return new Expr.When(condition, then, wrap(value));
        }
    }

    static Expr wrap(Object value) {
        return value instanceof Expr e ? e : new Expr.Lit(value);
    }

    static void collectColumns(Expr expr, Set<String> out) {
        if (expr instanceof Expr.Col c) {
            out.add(c.name());
        } else if (expr instanceof Expr.Compare c) {
            collectColumns(c.left(), out);
            collectColumns(c.right(), out);
        } else if (expr instanceof Expr.Logical l) {
            collectColumns(l.left(), out);
            collectColumns(l.right(), out);
        } else if (expr instanceof Expr.Arith a) {
            collectColumns(a.left(), out);
            collectColumns(a.right(), out);
        } else if (expr instanceof Expr.When w) {
            collectColumns(w.condition(), out);
            collectColumns(w.then(), out);
            collectColumns(w.otherwise(), out);
        } else if (expr instanceof Expr.SumOver s) {
            collectColumns(s.input(), out);
            out.addAll(s.partitionBy());
        } else {
            for (Expr child : children(expr)) {
                collectColumns(child, out);
            }
        }
    }

    static boolean containsSubtree(Expr expr, Expr candidate) {
        if (expr.equals(candidate)) {
            return true;
        }
        for (Expr child : children(expr)) {
            if (containsSubtree(child, candidate)) {
                return true;
            }
        }
        return false;
    }

    static List<Expr> children(Expr expr) {
        if (expr instanceof Expr.Compare c) {
            return List.of(c.left(), c.right());
        } else if (expr instanceof Expr.Logical l) {
            return List.of(l.left(), l.right());
        } else if (expr instanceof Expr.Arith a) {
            return List.of(a.left(), a.right());
        } else if (expr instanceof Expr.When w) {
            return List.of(w.condition(), w.then(), w.otherwise());
        } else if (expr instanceof Expr.Not n) {
            return List.of(n.input());
        } else if (expr instanceof Expr.NullCheck n) {
            return List.of(n.input());
        } else if (expr instanceof Expr.InSet i) {
            return List.of(i.input());
        } else if (expr instanceof Expr.StringMatch s) {
            return List.of(s.input());
        } else if (expr instanceof Expr.FillNull f) {
            return List.of(f.input());
        } else if (expr instanceof Expr.SumOver s) {
            return List.of(s.input());
        }
        return List.of();
    }
}
