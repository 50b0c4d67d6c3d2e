package com.isobolt.generator.model.asset;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Flag property, e.g. {@code texture_URepeat}.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class BooleanProperty extends AssetProperty {

    public static final String TYPE = "boolean";

    private final boolean value;

    public BooleanProperty(String name, boolean value) {
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
