package io.github.costql.billing.model;

/**
 * Summary bucket of a cost category.
 *
 * @since 1.0.0
 */
public enum CostGroup {
    COMPUTE("C"),
    STORAGE("S");

    private final String code;

    CostGroup(String code) {
        this.code = code;
    }

    /**
     * @return the one-letter code used in serialized details
     */
    public String getCode() {
        return code;
    }
}
