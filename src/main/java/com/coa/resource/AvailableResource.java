package com.coa.resource;

/**
 * A friendly resource available in the current situation.
 *
 * @param name         Resource or asset name
 * @param tacticalRole Tactical role, also used for matching (may be null)
 * @param quantity     Available quantity
 * @param operational  False when the asset is under maintenance or otherwise unusable
 */
public record AvailableResource(
        String name,
        String tacticalRole,
        int quantity,
        boolean operational
) {
    /**
     * Create an operational resource with quantity 1.
     */
    public static AvailableResource of(String name) {
        return new AvailableResource(name, null, 1, true);
    }

    public boolean usable() {
        return operational && quantity > 0;
    }
}
