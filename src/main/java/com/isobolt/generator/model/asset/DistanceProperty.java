package com.isobolt.generator.model.asset;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Length valued property. Texture scales are stored in inches.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class DistanceProperty extends AssetProperty {

    public static final String TYPE = "distance";
    public static final String INCHES = "in";

    private final double value;
    private final String unit;

    public DistanceProperty(String name, double value) {
        this(name, value, INCHES);
    }

    public DistanceProperty(String name, double value, String unit) {
        super(name);
        this.value = value;
        this.unit = unit != null ? unit : INCHES;
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
