package com.vcsight.ingestor.transform;

/**
 * Buckets of the VM resource score. Lower bounds are inclusive, upper bounds
 * exclusive: 10 is Medium, 50 is High, 100 is Critical.
 */
public enum ResourceCategory {
    LOW("Low", 10),
    MEDIUM("Medium", 50),
    HIGH("High", 100),
    CRITICAL("Critical", Double.POSITIVE_INFINITY);

    private final String label;
    private final double upperExclusive;

    ResourceCategory(String label, double upperExclusive) {
        this.label = label;
        this.upperExclusive = upperExclusive;
    }

    public String label() { return label; }

    public static ResourceCategory of(double score) {
        for (ResourceCategory category : values()) {
            if (score < category.upperExclusive) return category;
        }
        return CRITICAL;
    }
}
