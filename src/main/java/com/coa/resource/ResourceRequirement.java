package com.coa.resource;

/**
 * A resource a COA needs, with its priority tier.
 *
 * @param resource Resource name
 * @param tier     Priority tier
 * @param weight   Tier weight (1.0 / 0.6 / 0.3)
 */
public record ResourceRequirement(
        String resource,
        PriorityTier tier,
        double weight
) {
    public ResourceRequirement(String resource, PriorityTier tier) {
        this(resource, tier, tier.weight());
    }

    public static ResourceRequirement required(String resource) {
        return new ResourceRequirement(resource, PriorityTier.REQUIRED);
    }

    public static ResourceRequirement recommended(String resource) {
        return new ResourceRequirement(resource, PriorityTier.RECOMMENDED);
    }

    public static ResourceRequirement optional(String resource) {
        return new ResourceRequirement(resource, PriorityTier.OPTIONAL);
    }

    @Override
    public String toString() {
        return resource + "(" + tier + ", " + weight + ")";
    }
}
