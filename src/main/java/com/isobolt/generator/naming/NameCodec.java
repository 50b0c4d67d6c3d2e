package com.isobolt.generator.naming;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps logical (category, diameter) pairs to material names and back.
 *
 * Name conventions, with prefix {@code GIMBA}:
 * <ul>
 *   <li>plain material: {@code GIMBA - Steel galvanized}</li>
 *   <li>thread template: {@code GIMBA - Steel galvanized - Thread template}</li>
 *   <li>thread material: {@code GIMBA - Steel galvanized - M12 thread}</li>
 * </ul>
 *
 * Categories are arbitrary text, line breaks included; decoding round trips as long as the
 * category does not contain the delimiter.
 */
public class NameCodec {

    public static final String DEFAULT_PREFIX = "GIMBA";
    public static final String DELIMITER = " - ";

    private static final String TEMPLATE_SUFFIX = "Thread template";

    private final String prefix;
    private final Pattern templatePattern;
    private final Pattern derivedPattern;

    public NameCodec() {
        this(DEFAULT_PREFIX);
    }

    public NameCodec(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("Name prefix must not be blank");
        }
        this.prefix = prefix;
        String quoted = Pattern.quote(prefix + DELIMITER);
        this.templatePattern = Pattern.compile(
                "^" + quoted + "(.+)" + Pattern.quote(DELIMITER + TEMPLATE_SUFFIX) + "$", Pattern.DOTALL);
        this.derivedPattern = Pattern.compile(
                "^" + quoted + "(.+)" + Pattern.quote(DELIMITER) + "M(\\d+) thread$", Pattern.DOTALL);
    }

    public String getPrefix() {
        return prefix;
    }

    /**
     * Returns the derived thread material name, e.g. {@code GIMBA - Steel galvanized - M12 thread}.
     */
    public String encode(String category, int diameter) {
        requireCategory(category);
        return prefix + DELIMITER + category + DELIMITER + "M" + diameter + " thread";
    }

    public String encode(DesiredArtifactKey key) {
        return encode(key.getCategory(), key.getDiameter());
    }

    /**
     * Returns the thread template name, e.g. {@code GIMBA - Steel galvanized - Thread template}.
     */
    public String encodeTemplate(String category) {
        requireCategory(category);
        return prefix + DELIMITER + category + DELIMITER + TEMPLATE_SUFFIX;
    }

    /**
     * Returns the plain material name, e.g. {@code GIMBA - Steel galvanized}.
     */
    public String encodePlain(String category) {
        requireCategory(category);
        return prefix + DELIMITER + category;
    }

    /**
     * Extracts the category from a thread template name.
     *
     * @throws NameDecodeException if the name is not a thread template name
     */
    public String decodeCategory(String templateName) {
        Matcher matcher = match(templatePattern, templateName, "thread template");
        return matcher.group(1);
    }

    /**
     * Extracts category and diameter from a derived thread material name.
     *
     * @throws NameDecodeException if the name is not a thread material name
     */
    public DesiredArtifactKey decodeKey(String derivedName) {
        Matcher matcher = match(derivedPattern, derivedName, "thread material");
        try {
            return new DesiredArtifactKey(matcher.group(1), Integer.parseInt(matcher.group(2)));
        } catch (NumberFormatException e) {
            throw new NameDecodeException(derivedName, "diameter out of range", e);
        }
    }

    public boolean isTemplateName(String name) {
        return name != null && templatePattern.matcher(name).matches();
    }

    public boolean isDerivedName(String name) {
        return name != null && derivedPattern.matcher(name).matches();
    }

    public Pattern templatePattern() {
        return templatePattern;
    }

    public Pattern derivedPattern() {
        return derivedPattern;
    }

    /**
     * Human readable form of the template naming rule, for diagnostics.
     */
    public String describeTemplatePattern() {
        return encodeTemplate("<plain material name>");
    }

    private Matcher match(Pattern pattern, String name, String kind) {
        if (name == null) {
            throw new NameDecodeException(null, "name is null");
        }
        Matcher matcher = pattern.matcher(name);
        if (!matcher.matches()) {
            throw new NameDecodeException(name, "not a " + kind + " name");
        }
        return matcher;
    }

    private static void requireCategory(String category) {
        Objects.requireNonNull(category, "category");
        if (category.isEmpty()) {
            throw new IllegalArgumentException("Category must not be empty");
        }
    }
}
