package com.isobolt.generator.model.asset;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Base class for all named properties of an appearance asset.
 */
@Getter
@EqualsAndHashCode
@ToString
public abstract class AssetProperty {

    @NonNull
    private final String name;

    protected AssetProperty(@NonNull String name) {
        this.name = name;
    }

    /**
     * Short type tag used in dumps and in the library file, e.g. {@code string}.
     */
    public abstract String getType();

    public abstract void accept(AssetPropertyVisitor visitor);
}
