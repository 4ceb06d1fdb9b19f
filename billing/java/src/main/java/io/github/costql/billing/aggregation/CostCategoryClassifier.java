package io.github.costql.billing.aggregation;

import io.github.costql.billing.model.CostGroup;

import java.util.Map;
import java.util.Objects;

/**
 * Assigns a cost category to {@link CostGroup#COMPUTE} or {@link CostGroup#STORAGE}.
 * <p>
 * Categories listed explicitly win. Any other category is storage when its name
 * starts with {@value #STORAGE_PREFIX} and compute otherwise, so a new storage
 * product with a different name is counted as compute until it is listed.
 * </p>
 *
 * <pre>{@code
 * CostCategoryClassifier classifier = CostCategoryClassifier.withOverrides(
 *     Map.of("Filestore", CostGroup.STORAGE));
 * }</pre>
 *
 * @since 1.0.0
 */
public final class CostCategoryClassifier {

    public static final String STORAGE_PREFIX = "Cloud Storage";

    private static final CostCategoryClassifier PREFIX_ONLY = new CostCategoryClassifier(Map.of());

    private final Map<String, CostGroup> explicit;

    private CostCategoryClassifier(Map<String, CostGroup> explicit) {
        this.explicit = Map.copyOf(explicit);
    }

    public static CostCategoryClassifier prefixHeuristic() {
        return PREFIX_ONLY;
    }

    public static CostCategoryClassifier withOverrides(Map<String, CostGroup> explicit) {
        return new CostCategoryClassifier(Objects.requireNonNull(explicit, "explicit must not be null"));
    }

    public CostGroup classify(String costCategory) {
        CostGroup listed = explicit.get(costCategory);
        if (listed != null) {
            return listed;
        }
        return costCategory != null && costCategory.startsWith(STORAGE_PREFIX) ? CostGroup.STORAGE : CostGroup.COMPUTE;
    }
}
