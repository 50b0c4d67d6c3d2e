package com.isobolt.generator.model.asset;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.NonNull;
import lombok.Value;

/**
 * An appearance asset or a nested asset connected through a {@link ReferenceProperty}.
 *
 * Instances are immutable; the {@code with...} methods return modified copies.
 */
@Value
public class Asset {

    @NonNull
    String name;

    @NonNull
    List<AssetProperty> properties;

    public Asset(@NonNull String name, List<AssetProperty> properties) {
        this.name = name;
        this.properties = properties != null ? List.copyOf(properties) : List.of();
    }

    public Optional<AssetProperty> find(String propertyName) {
        return properties.stream()
                .filter(p -> p.getName().equals(propertyName))
                .findFirst();
    }

    /**
     * Returns the value of a string property, if present and of string type.
     */
    public Optional<String> findString(String propertyName) {
        return find(propertyName)
                .filter(StringProperty.class::isInstance)
                .map(p -> ((StringProperty) p).getValue());
    }

    /**
     * Returns a copy in which the property of the same name is replaced, or appended if absent.
     */
    public Asset withProperty(AssetProperty property) {
        List<AssetProperty> copy = new ArrayList<>(properties);
        boolean replaced = false;
        for (int i = 0; i < copy.size(); i++) {
            if (copy.get(i).getName().equals(property.getName())) {
                copy.set(i, property);
                replaced = true;
                break;
            }
        }
        if (!replaced) {
            copy.add(property);
        }
        return new Asset(name, copy);
    }

    public Asset withName(String newName) {
        return new Asset(newName, properties);
    }
}
