package io.github.costql.core.api;

/**
 * Enum whose bound representation differs from its constant name.
 * <p>
 * When a filter value is an enum implementing this interface, the compiler binds
 * {@link #bindValue()} as a string; any other enum is bound by {@link Enum#name()}.
 * </p>
 *
 * @since 1.0.0
 */
public interface BindableEnum {

    /**
     * @return the string stored in the backend for this constant
     */
    String bindValue();
}
