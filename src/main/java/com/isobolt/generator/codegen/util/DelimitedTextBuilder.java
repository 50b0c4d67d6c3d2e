package com.isobolt.generator.codegen.util;

import java.util.List;

/**
 * Assembles the comma delimited text understood by CAD type catalogs and lookup tables.
 *
 * The first column holds the row name and has an empty header. Every other header cell
 * carries a unit tag, e.g. {@code Length##LENGTH##MILLIMETERS}.
 */
public class DelimitedTextBuilder {

    public static final String DELIMITER = ",";
    public static final String LINE_SEPARATOR = "\n";

    public static final String LENGTH_MILLIMETERS = "##LENGTH##MILLIMETERS";
    public static final String OTHER = "##OTHER##";

    private final StringBuilder text = new StringBuilder();

    /**
     * Starts a new text with a header row.
     */
    public static DelimitedTextBuilder withHeader(List<Column> columns) {
        DelimitedTextBuilder builder = new DelimitedTextBuilder();
        for (Column column : columns) {
            builder.text.append(DELIMITER).append(column.getName()).append(column.getTag());
        }
        builder.text.append(LINE_SEPARATOR);
        return builder;
    }

    /**
     * Appends a row.
     *
     * @throws IllegalArgumentException if a cell contains the delimiter or a line break
     */
    public DelimitedTextBuilder row(String name, Object... values) {
        text.append(requirePlainCell(name));
        for (Object value : values) {
            text.append(DELIMITER).append(requirePlainCell(String.valueOf(value)));
        }
        text.append(LINE_SEPARATOR);
        return this;
    }

    public String build() {
        return text.toString();
    }

    /**
     * True if the text can be written as one cell.
     */
    public static boolean isPlainCell(String cell) {
        return cell != null && !cell.contains(DELIMITER) && cell.indexOf('\n') < 0 && cell.indexOf('\r') < 0;
    }

    private static String requirePlainCell(String cell) {
        if (!isPlainCell(cell)) {
            throw new IllegalArgumentException("Cell must not contain \"" + DELIMITER + "\" or a line break: " + cell);
        }
        return cell;
    }

    /**
     * A header cell: parameter name plus unit tag.
     */
    public static final class Column {

        private final String name;
        private final String tag;

        private Column(String name, String tag) {
            this.name = name;
            this.tag = tag;
        }

        public static Column length(String name) {
            return new Column(name, LENGTH_MILLIMETERS);
        }

        public static Column other(String name) {
            return new Column(name, OTHER);
        }

        public String getName() {
            return name;
        }

        public String getTag() {
            return tag;
        }
    }
}
