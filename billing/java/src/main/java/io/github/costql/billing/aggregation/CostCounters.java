package io.github.costql.billing.aggregation;

import io.github.costql.billing.model.CostGroup;

/**
 * Monthly and daily totals of one grouping value, split into compute and storage.
 *
 * @since 1.0.0
 */
final class CostCounters {

    private double computeMonthly;
    private double computeDaily;
    private double storageMonthly;
    private double storageDaily;

    void addMonthly(CostGroup group, double cost) {
        if (group == CostGroup.STORAGE) {
            storageMonthly += cost;
        } else {
            computeMonthly += cost;
        }
    }

    void addDaily(CostGroup group, double cost) {
        if (group == CostGroup.STORAGE) {
            storageDaily += cost;
        } else {
            computeDaily += cost;
        }
    }

    double computeMonthly() {
        return computeMonthly;
    }

    double computeDaily() {
        return computeDaily;
    }

    double storageMonthly() {
        return storageMonthly;
    }

    double storageDaily() {
        return storageDaily;
    }

    double totalMonthly() {
        return computeMonthly + storageMonthly;
    }

    double totalDaily() {
        return computeDaily + storageDaily;
    }
}
