package io.github.costql.jpa;

import io.github.costql.core.exception.InternalQueryException;
import io.github.costql.core.impl.RelationalDialect;
import io.github.costql.core.model.CompiledPredicate;
import io.github.costql.core.model.ParameterBinding;
import io.github.costql.core.utils.Identifiers;
import jakarta.persistence.EntityManager;
import jakarta.persistence.Query;

import java.util.Objects;

/**
 * Creates native queries around a relational predicate and binds its parameters by name.
 * <p>
 * Only predicates compiled with {@link RelationalDialect} can be bound: their
 * placeholders are {@code :name} and their values are host objects. Table and
 * column names are never parameters, so they are checked against a plain
 * identifier pattern before being written into the query text.
 * </p>
 *
 * @since 1.0.0
 */
public final class NativeQueryBinder {

    private NativeQueryBinder() {
    }

    /**
     * @param em        the entity manager
     * @param sql       the query text, predicate included
     * @param predicate the relational predicate whose bindings are applied
     * @return the bound query
     * @throws InternalQueryException if the predicate was compiled for another dialect
     */
    public static Query create(EntityManager em, String sql, CompiledPredicate predicate) {
        Objects.requireNonNull(em, "em must not be null");
        Query query = em.createNativeQuery(sql);
        bind(query, predicate);
        return query;
    }

    public static void bind(Query query, CompiledPredicate predicate) {
        for (ParameterBinding binding : predicate.bindings()) {
            if (!RelationalDialect.INSTANCE.declaredType(binding.value()).equals(binding.declaredType())) {
                throw new InternalQueryException(String.format(
                        "Parameter '%s' was not compiled for the relational dialect (declared type %s)",
                        binding.name(), binding.declaredType()));
            }
            query.setParameter(binding.name(), binding.wireValue());
        }
    }

    /**
     * @param name a table or column name, optionally dot-qualified
     * @return the name
     * @throws InternalQueryException if the name is not a plain identifier
     */
    public static String identifier(String name) {
        if (!Identifiers.isQualified(name)) {
            throw new InternalQueryException("Not a valid SQL identifier: " + name);
        }
        return name;
    }
}
