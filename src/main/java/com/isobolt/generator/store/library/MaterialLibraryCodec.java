package com.isobolt.generator.store.library;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.isobolt.generator.model.asset.Asset;
import com.isobolt.generator.model.asset.AssetProperty;
import com.isobolt.generator.model.asset.AssetPropertyVisitor;
import com.isobolt.generator.model.asset.BooleanProperty;
import com.isobolt.generator.model.asset.DistanceProperty;
import com.isobolt.generator.model.asset.DoubleProperty;
import com.isobolt.generator.model.asset.IntegerProperty;
import com.isobolt.generator.model.asset.ListProperty;
import com.isobolt.generator.model.asset.Material;
import com.isobolt.generator.model.asset.ReferenceProperty;
import com.isobolt.generator.model.asset.StringProperty;

/**
 * Converts materials to and from the JSON tree of a material library file.
 *
 * <pre>
 * { "title": "...",
 *   "materials": [ { "name": "...", "manufacturer": "...", "description": "...",
 *                    "comments": "...", "url": "...",
 *                    "appearance": { "name": "...", "properties": [ ... ] } } ] }
 * </pre>
 *
 * Each property carries {@code name} and {@code type}; the remaining fields depend on the type
 * ({@code value}, {@code unit}, {@code asset}, {@code items}).
 */
class MaterialLibraryCodec {

    static final String TITLE = "title";
    static final String MATERIALS = "materials";

    private final ObjectMapper mapper;

    MaterialLibraryCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    String readTitle(JsonNode root, String fallback) {
        JsonNode title = root.get(TITLE);
        return title != null && title.isTextual() ? title.asText() : fallback;
    }

    List<Material> readMaterials(JsonNode root, String documentId) {
        JsonNode materials = root.get(MATERIALS);
        if (materials == null) {
            return List.of();
        }
        if (!materials.isArray()) {
            throw new MaterialLibraryFormatException("\"" + MATERIALS + "\" must be an array");
        }
        List<Material> result = new ArrayList<>();
        for (JsonNode node : materials) {
            result.add(readMaterial(node, documentId));
        }
        return result;
    }

    ObjectNode writeLibrary(String title, Collection<Material> materials) {
        ObjectNode root = mapper.createObjectNode();
        root.put(TITLE, title);
        ArrayNode array = root.putArray(MATERIALS);
        for (Material material : materials) {
            array.add(writeMaterial(material));
        }
        return root;
    }

    private Material readMaterial(JsonNode node, String documentId) {
        String name = requireText(node, "name", "material");
        JsonNode appearance = node.get("appearance");
        return Material.builder()
                .name(name)
                .documentId(documentId)
                .manufacturer(optionalText(node, "manufacturer"))
                .description(optionalText(node, "description"))
                .comments(optionalText(node, "comments"))
                .url(optionalText(node, "url"))
                .appearance(appearance == null || appearance.isNull() ? null : readAsset(appearance))
                .build();
    }

    private Asset readAsset(JsonNode node) {
        String name = requireText(node, "name", "asset");
        return new Asset(name, readProperties(node.get("properties"), name));
    }

    private List<AssetProperty> readProperties(JsonNode array, String owner) {
        if (array == null || array.isNull()) {
            return List.of();
        }
        if (!array.isArray()) {
            throw new MaterialLibraryFormatException("Properties of \"" + owner + "\" must be an array");
        }
        List<AssetProperty> properties = new ArrayList<>();
        for (JsonNode node : array) {
            properties.add(readProperty(node, owner));
        }
        return properties;
    }

    private AssetProperty readProperty(JsonNode node, String owner) {
        String name = requireText(node, "name", "property of \"" + owner + "\"");
        String type = requireText(node, "type", "property \"" + name + "\"");
        JsonNode value = node.get("value");
        switch (type) {
            case StringProperty.TYPE:
                return new StringProperty(name, value == null || value.isNull() ? null : value.asText());
            case DoubleProperty.TYPE:
                return new DoubleProperty(name, requireNumber(value, name).asDouble());
            case DistanceProperty.TYPE:
                return new DistanceProperty(name, requireNumber(value, name).asDouble(), optionalText(node, "unit"));
            case BooleanProperty.TYPE:
                return new BooleanProperty(name, requireBoolean(value, name).asBoolean());
            case IntegerProperty.TYPE:
                return new IntegerProperty(name, requireInteger(value, name).asInt());
            case ReferenceProperty.TYPE:
                JsonNode asset = node.get("asset");
                return new ReferenceProperty(name, asset == null || asset.isNull() ? null : readAsset(asset));
            case ListProperty.TYPE:
                return new ListProperty(name, readProperties(node.get("items"), name));
            default:
                throw new MaterialLibraryFormatException(
                        "Property \"" + name + "\" of \"" + owner + "\" has unknown type \"" + type + "\"");
        }
    }

    private ObjectNode writeMaterial(Material material) {
        ObjectNode node = mapper.createObjectNode();
        node.put("name", material.getName());
        putIfPresent(node, "manufacturer", material.getManufacturer());
        putIfPresent(node, "description", material.getDescription());
        putIfPresent(node, "comments", material.getComments());
        putIfPresent(node, "url", material.getUrl());
        if (material.getAppearance() != null) {
            node.set("appearance", writeAsset(material.getAppearance()));
        }
        return node;
    }

    private ObjectNode writeAsset(Asset asset) {
        ObjectNode node = mapper.createObjectNode();
        node.put("name", asset.getName());
        node.set("properties", writeProperties(asset.getProperties()));
        return node;
    }

    private ArrayNode writeProperties(List<AssetProperty> properties) {
        PropertyNodeWriter writer = new PropertyNodeWriter(mapper.createArrayNode());
        properties.forEach(p -> p.accept(writer));
        return writer.target;
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    private static String requireText(JsonNode node, String field, String what) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new MaterialLibraryFormatException("Missing \"" + field + "\" of " + what);
        }
        return value.asText();
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static JsonNode requireNumber(JsonNode value, String name) {
        if (value == null || !value.isNumber()) {
            throw new MaterialLibraryFormatException("Property \"" + name + "\" requires a numeric value");
        }
        return value;
    }

    private static JsonNode requireInteger(JsonNode value, String name) {
        if (value == null || !value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new MaterialLibraryFormatException("Property \"" + name + "\" requires an integer value");
        }
        return value;
    }

    private static JsonNode requireBoolean(JsonNode value, String name) {
        if (value == null || !value.isBoolean()) {
            throw new MaterialLibraryFormatException("Property \"" + name + "\" requires a boolean value");
        }
        return value;
    }

    private final class PropertyNodeWriter implements AssetPropertyVisitor {

        private final ArrayNode target;

        private PropertyNodeWriter(ArrayNode target) {
            this.target = target;
        }

        @Override
        public void visit(StringProperty property) {
            start(property).put("value", property.getValue());
        }

        @Override
        public void visit(DoubleProperty property) {
            start(property).put("value", property.getValue());
        }

        @Override
        public void visit(DistanceProperty property) {
            start(property).put("value", property.getValue()).put("unit", property.getUnit());
        }

        @Override
        public void visit(BooleanProperty property) {
            start(property).put("value", property.isValue());
        }

        @Override
        public void visit(IntegerProperty property) {
            start(property).put("value", property.getValue());
        }

        @Override
        public void visit(ReferenceProperty property) {
            ObjectNode node = start(property);
            property.getConnectedAsset().ifPresent(asset -> node.set("asset", writeAsset(asset)));
        }

        @Override
        public void visit(ListProperty property) {
            start(property).set("items", writeProperties(property.getItems()));
        }

        private ObjectNode start(AssetProperty property) {
            ObjectNode node = target.addObject();
            node.put("name", property.getName());
            node.put("type", property.getType());
            return node;
        }
    }
}
