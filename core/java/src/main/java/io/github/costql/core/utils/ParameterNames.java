package io.github.costql.core.utils;

import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Allocates parameter names for one compiled query.
 * <p>
 * Characters outside {@code [A-Za-z0-9_]} are replaced by {@code _}. A name that
 * was already handed out gets a {@code _2}, {@code _3}, ... suffix in encounter
 * order, so compiling the same filter twice yields the same names.
 * </p>
 *
 * @since 1.0.0
 */
public final class ParameterNames {

    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9_]");

    private final Set<String> used = new HashSet<>();

    /**
     * Replaces every character outside {@code [A-Za-z0-9_]} with {@code _}.
     *
     * @param raw the raw name
     * @return the sanitized name
     */
    public static String sanitize(String raw) {
        return UNSAFE.matcher(raw).replaceAll("_");
    }

    /**
     * @param base the field path plus operator code
     * @return a name unique within this allocator
     */
    public String allocate(String base) {
        String name = sanitize(base);
        if (used.add(name)) {
            return name;
        }
        int suffix = 2;
        while (!used.add(name + "_" + suffix)) {
            suffix++;
        }
        return name + "_" + suffix;
    }
}
