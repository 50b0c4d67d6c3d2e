package com.isobolt.generator.model.asset;

import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class ListProperty extends AssetProperty {

    public static final String TYPE = "list";

    private final List<AssetProperty> items;

    public ListProperty(String name, List<AssetProperty> items) {
        super(name);
        this.items = items != null ? List.copyOf(items) : List.of();
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
