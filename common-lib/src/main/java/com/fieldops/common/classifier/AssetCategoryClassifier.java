package com.fieldops.common.classifier;

import com.fieldops.common.model.AssetCategory;

import java.util.Locale;

/**
 * Pure stateless classifier that maps a vehicle name to its {@link AssetCategory}.
 *
 * <p>Rules:
 * <ol>
 *   <li>name contains "fiber" or "cable" (any case) → {@link AssetCategory#FIBER}</li>
 *   <li>otherwise                                  → {@link AssetCategory#ELECTRIC}</li>
 * </ol>
 *
 * <p>No reactive types. No logging. No side-effects.
 */
public final class AssetCategoryClassifier {

    private AssetCategoryClassifier() {}

    /**
     * @param vehicleName device name as registered with the telematics provider
     * @return detected category; {@link AssetCategory#ELECTRIC} for {@code null} or blank names
     */
    public static AssetCategory classify(String vehicleName) {
        if (vehicleName == null || vehicleName.isBlank()) {
            return AssetCategory.ELECTRIC;
        }
        String lower = vehicleName.toLowerCase(Locale.ROOT);
        if (lower.contains("fiber") || lower.contains("cable")) {
            return AssetCategory.FIBER;
        }
        return AssetCategory.ELECTRIC;
    }
}
