package org.rentalrepairs.engine.domain.model;

/**
 * Workload aggregates over the active workers of a roster.
 */
public final class WorkloadDistribution {

    private static final WorkloadDistribution EMPTY = new WorkloadDistribution(0, 0.0, 0, 0, 0);

    private final int totalWorkers;
    private final double averageWorkload;
    private final int minWorkload;
    private final int maxWorkload;
    private final int overloadedWorkers;

    public WorkloadDistribution(int totalWorkers, double averageWorkload, int minWorkload,
                                int maxWorkload, int overloadedWorkers) {
        this.totalWorkers = totalWorkers;
        this.averageWorkload = averageWorkload;
        this.minWorkload = minWorkload;
        this.maxWorkload = maxWorkload;
        this.overloadedWorkers = overloadedWorkers;
    }

    public static WorkloadDistribution empty() {
        return EMPTY;
    }

    public int getTotalWorkers() {
        return totalWorkers;
    }

    public double getAverageWorkload() {
        return averageWorkload;
    }

    public int getMinWorkload() {
        return minWorkload;
    }

    public int getMaxWorkload() {
        return maxWorkload;
    }

    public int getOverloadedWorkers() {
        return overloadedWorkers;
    }

    @Override
    public String toString() {
        return String.format("WorkloadDistribution{total=%d, avg=%.2f, min=%d, max=%d, overloaded=%d}",
                totalWorkers, averageWorkload, minWorkload, maxWorkload, overloadedWorkers);
    }
}
