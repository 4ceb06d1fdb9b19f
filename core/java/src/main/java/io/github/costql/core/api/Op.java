package io.github.costql.core.api;

/**
 * Comparison operators a {@link FilterComparator} can carry.
 * <p>
 * Each operator defines the SQL symbol it compiles to and the short code used as
 * the suffix of generated parameter names ({@code <field>_<code>}).
 * </p>
 *
 * <p><strong>Mappings:</strong></p>
 * <ul>
 *     <li>EQ / = / eq</li>
 *     <li>IN / IN / in</li>
 *     <li>NOT_IN / NOT IN / nin</li>
 *     <li>GT / &gt; / gt</li>
 *     <li>GTE / &gt;= / gte</li>
 *     <li>LT / &lt; / lt</li>
 *     <li>LTE / &lt;= / lte</li>
 * </ul>
 *
 * The declaration order is the order in which the operators of one comparator
 * are emitted by the compiler.
 *
 * @since 1.0.0
 */
public enum Op {

    /** Equality operator: "=" */
    EQ("=", "eq"),

    /** Inclusion operator for collections: "IN" */
    IN("IN", "in"),

    /** Negated inclusion operator: "NOT IN" */
    NOT_IN("NOT IN", "nin"),

    /** Greater than operator: "&gt;" */
    GT(">", "gt"),

    /** Greater than or equal operator: "&gt;=" */
    GTE(">=", "gte"),

    /** Less than operator: "&lt;" */
    LT("<", "lt"),

    /** Less than or equal operator: "&lt;=" */
    LTE("<=", "lte");

    private final String symbol;
    private final String code;

    Op(String symbol, String code) {
        this.symbol = symbol;
        this.code = code;
    }

    /**
     * @return the SQL symbol of this operator
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * @return the short code used in parameter names
     */
    public String getCode() {
        return code;
    }

    /**
     * @return true when the operator binds a collection of values
     */
    public boolean supportsMultipleValues() {
        return this == IN || this == NOT_IN;
    }

    /**
     * Resolves an operator from its symbol, code or enum name, ignoring case.
     *
     * @param value the text to resolve
     * @return the operator, or {@code null} if nothing matches
     */
    public static Op fromString(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        for (Op op : values()) {
            if (op.symbol.equalsIgnoreCase(trimmed)
                    || op.code.equalsIgnoreCase(trimmed)
                    || op.name().equalsIgnoreCase(trimmed)) {
                return op;
            }
        }
        return null;
    }
}
