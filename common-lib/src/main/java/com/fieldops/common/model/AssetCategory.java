package com.fieldops.common.model;

/**
 * Crew type a fleet vehicle belongs to. Drives symbology on the map and the
 * split of the fleet layer into its two sub-layers.
 */
public enum AssetCategory {
    FIBER,
    ELECTRIC
}
