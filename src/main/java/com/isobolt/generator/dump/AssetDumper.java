package com.isobolt.generator.dump;

import java.util.List;

import com.isobolt.generator.codegen.util.NumberFormatUtil;
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
 * Renders materials and their appearance assets as an indented text dump, one property per
 * line in the form {@code name (type): value}.
 */
public class AssetDumper {

    private static final String INDENT = "  ";

    public String dump(List<Material> materials) {
        StringBuilder out = new StringBuilder();
        for (Material material : materials) {
            out.append(dump(material));
        }
        return out.toString();
    }

    public String dump(Material material) {
        StringBuilder out = new StringBuilder();
        if (material == null) {
            return line(out, "", "<null> (Material)").toString();
        }
        line(out, "", "Material \"" + material.getName() + "\"");
        field(out, "Document", material.getDocumentId());
        field(out, "Manufacturer", material.getManufacturer());
        field(out, "Description", material.getDescription());
        field(out, "Comments", material.getComments());
        field(out, "URL", material.getUrl());
        if (material.getAppearance() == null) {
            line(out, INDENT, "<No Appearance Asset>");
        } else {
            line(out, INDENT, "<Appearance Asset>");
            dumpAsset(out, material.getAppearance(), INDENT + INDENT);
        }
        return out.toString();
    }

    public String dump(Asset asset) {
        StringBuilder out = new StringBuilder();
        dumpAsset(out, asset, "");
        return out.toString();
    }

    private void dumpAsset(StringBuilder out, Asset asset, String prefix) {
        line(out, prefix, "Asset \"" + asset.getName() + "\"");
        DumpingVisitor visitor = new DumpingVisitor(out, prefix + INDENT);
        asset.getProperties().forEach(p -> p.accept(visitor));
    }

    private static void field(StringBuilder out, String name, String value) {
        line(out, INDENT, name + ": " + (value != null ? value : "<none>"));
    }

    private static StringBuilder line(StringBuilder out, String prefix, String text) {
        return out.append(prefix).append(text).append('\n');
    }

    private final class DumpingVisitor implements AssetPropertyVisitor {

        private final StringBuilder out;
        private final String prefix;

        private DumpingVisitor(StringBuilder out, String prefix) {
            this.out = out;
            this.prefix = prefix;
        }

        @Override
        public void visit(StringProperty property) {
            value(property, property.getValue() != null ? "\"" + property.getValue() + "\"" : "<null>");
        }

        @Override
        public void visit(DoubleProperty property) {
            value(property, NumberFormatUtil.format(property.getValue()));
        }

        @Override
        public void visit(DistanceProperty property) {
            value(property, NumberFormatUtil.format(property.getValue()) + " " + property.getUnit());
        }

        @Override
        public void visit(BooleanProperty property) {
            value(property, Boolean.toString(property.isValue()));
        }

        @Override
        public void visit(IntegerProperty property) {
            value(property, Integer.toString(property.getValue()));
        }

        @Override
        public void visit(ReferenceProperty property) {
            line(out, prefix, header(property));
            property.getConnectedAsset().ifPresent(asset -> {
                line(out, prefix + INDENT, "<Single Connected Asset>");
                dumpAsset(out, asset, prefix + INDENT + INDENT);
            });
        }

        @Override
        public void visit(ListProperty property) {
            line(out, prefix, header(property));
            if (!property.getItems().isEmpty()) {
                line(out, prefix + INDENT, "<Connected Properties>");
                DumpingVisitor nested = new DumpingVisitor(out, prefix + INDENT + INDENT);
                property.getItems().forEach(p -> p.accept(nested));
            }
        }

        private void value(AssetProperty property, String value) {
            line(out, prefix, header(property) + ": " + value);
        }

        private String header(AssetProperty property) {
            return property.getName() + " (" + property.getType() + ")";
        }
    }
}
