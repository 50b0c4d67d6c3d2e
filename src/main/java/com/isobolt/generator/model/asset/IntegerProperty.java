package com.isobolt.generator.model.asset;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class IntegerProperty extends AssetProperty {

    public static final String TYPE = "integer";

    private final int value;

    public IntegerProperty(String name, int value) {
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
