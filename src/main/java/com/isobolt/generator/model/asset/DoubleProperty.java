package com.isobolt.generator.model.asset;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Unitless floating point property, e.g. {@code texture_WAngle}.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class DoubleProperty extends AssetProperty {

    public static final String TYPE = "double";

    private final double value;

    public DoubleProperty(String name, double value) {
        super(name);
        this.value = value;
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
