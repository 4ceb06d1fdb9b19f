package io.github.costql.core.utils;

import java.util.regex.Pattern;

/**
 * SQL identifier checks for names that end up in query text rather than in a bound
 * parameter.
 *
 * @since 1.0.0
 */
public final class Identifiers {

    /**
     * One unquoted identifier: a letter or underscore, then letters, digits or underscores.
     */
    public static final Pattern SIMPLE = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /**
     * Dot-separated {@link #SIMPLE} identifiers, such as {@code schema.table}.
     */
    public static final Pattern QUALIFIED = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");

    private Identifiers() {
    }

    public static boolean isSimple(String name) {
        return name != null && SIMPLE.matcher(name).matches();
    }

    public static boolean isQualified(String name) {
        return name != null && QUALIFIED.matcher(name).matches();
    }
}
