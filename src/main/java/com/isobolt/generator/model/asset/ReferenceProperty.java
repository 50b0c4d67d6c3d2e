package com.isobolt.generator.model.asset;

import java.util.Optional;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Property that connects a nested asset, e.g. a bump map or pattern shader.
 */
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class ReferenceProperty extends AssetProperty {

    public static final String TYPE = "reference";

    private final Asset connectedAsset;

    public ReferenceProperty(String name, Asset connectedAsset) {
        super(name);
        this.connectedAsset = connectedAsset;
    }

    /**
     * Returns the single connected asset, if any.
     */
    public Optional<Asset> getConnectedAsset() {
        return Optional.ofNullable(connectedAsset);
    }

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public void accept(AssetPropertyVisitor visitor) {
        visitor.visit(this);
    }
}
