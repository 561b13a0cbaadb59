package com.prism.perspective.api.model;

import com.prism.perspective.api.exceptions.ConfigurationException;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Leaf operators understood by the criteria compiler.
 */
public enum CriteriaOperator {
    EQ("=", "=="),
    NE("!="),
    GT(">"),
    LT("<"),
    GE(">="),
    LE("<="),
    IN("In"),
    NOT_IN("NotIn"),
    IS_NULL("IsNull"),
    IS_NOT_NULL("IsNotNull"),
    BETWEEN("Between"),
    NOT_BETWEEN("NotBetween"),
    LIKE("Like"),
    NOT_LIKE("NotLike");

    private static final Map<String, CriteriaOperator> BY_SYMBOL = new HashMap<>();

    static {
        for (CriteriaOperator op : values()) {
            for (String symbol : op.symbols) {
                BY_SYMBOL.put(symbol.toLowerCase(Locale.ROOT), op);
            }
        }
    }

    private final String[] symbols;

    CriteriaOperator(String... symbols) {
        this.symbols = symbols;
    }

    /** Canonical stored spelling. */
    public String symbol() {
        return symbols[0];
    }

    public boolean isMembership() {
        return this == IN || this == NOT_IN;
    }

    public static CriteriaOperator fromSymbol(String symbol) {
        CriteriaOperator op = symbol == null ? null : BY_SYMBOL.get(symbol.trim().toLowerCase(Locale.ROOT));
        if (op == null) {
            throw new ConfigurationException("Unknown criteria operator: " + symbol);
        }
        return op;
    }
}
