package com.isobolt.generator.model.asset;

import java.util.List;
import java.util.Optional;

/**
 * Locates the bump gradient map inside an appearance asset.
 *
 * Generic appearances connect it under {@code generic_bump_map}, metal appearances under
 * {@code metal_pattern_shader}. Only a connected asset whose {@code BaseSchema} is
 * {@code GradientSchema} qualifies.
 */
public final class BumpGradientMaps {

    public static final List<String> HOLDER_PROPERTIES = List.of("generic_bump_map", "metal_pattern_shader");
    public static final String BASE_SCHEMA = "BaseSchema";
    public static final String GRADIENT_SCHEMA = "GradientSchema";

    private BumpGradientMaps() {
        // Utility class
    }

    /**
     * Returns the reference property that connects the bump gradient map, searching the
     * holder properties in order.
     */
    public static Optional<ReferenceProperty> findHolder(Asset appearance) {
        if (appearance == null) {
            return Optional.empty();
        }
        for (String holderName : HOLDER_PROPERTIES) {
            Optional<ReferenceProperty> holder = appearance.find(holderName)
                    .filter(ReferenceProperty.class::isInstance)
                    .map(ReferenceProperty.class::cast)
                    .filter(BumpGradientMaps::connectsGradient);
            if (holder.isPresent()) {
                return holder;
            }
        }
        return Optional.empty();
    }

    public static Optional<Asset> find(Asset appearance) {
        return findHolder(appearance).flatMap(ReferenceProperty::getConnectedAsset);
    }

    private static boolean connectsGradient(ReferenceProperty property) {
        return property.getConnectedAsset()
                .flatMap(asset -> asset.findString(BASE_SCHEMA))
                .filter(GRADIENT_SCHEMA::equals)
                .isPresent();
    }
}
