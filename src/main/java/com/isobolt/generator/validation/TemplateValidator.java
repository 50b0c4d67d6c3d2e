package com.isobolt.generator.validation;

import java.util.ArrayList;
import java.util.List;

import com.isobolt.generator.model.asset.BumpGradientMaps;
import com.isobolt.generator.model.asset.Material;
import com.isobolt.generator.naming.NameCodec;

/**
 * Checks whether a material is suitable as a template for thread materials.
 *
 * Checks run in order and stop at the first failure: the material exists, it resides in a
 * store, its name follows the template naming rule, it has an appearance asset, and that
 * asset carries a bump gradient map. The validator only reads; logging the trace is up to
 * the caller.
 */
public class TemplateValidator {

    private static final String OK = " -> OK";
    private static final String FAILED = " -> FAILED";

    private final NameCodec nameCodec;

    public TemplateValidator(NameCodec nameCodec) {
        this.nameCodec = nameCodec;
    }

    public TemplateValidation validate(Material template) {
        List<String> trace = new ArrayList<>();

        if (template == null) {
            trace.add("Material is <null>" + FAILED);
            return TemplateValidation.failure("Material is <null>", trace);
        }

        String longName = "Material \"" + template.getName() + "\"";
        trace.add(longName);

        if (template.getDocumentId() == null) {
            return fail(trace, longName, " does not reside in a material library");
        }
        trace.add("  Material resides in \"" + template.getDocumentId() + "\"" + OK);

        String pattern = nameCodec.describeTemplatePattern();
        if (!nameCodec.isTemplateName(template.getName())) {
            return fail(trace, longName, " has an invalid name, should be \"" + pattern + "\"");
        }
        trace.add("  Material name matches \"" + pattern + "\"" + OK);

        if (!template.hasAppearance()) {
            return fail(trace, longName, " has no appearance asset");
        }
        trace.add("  Material has an appearance asset" + OK);

        if (BumpGradientMaps.find(template.getAppearance()).isEmpty()) {
            trace.add("  Appearance asset has no bump gradient map" + FAILED);
            return TemplateValidation.failure(longName + ": appearance asset has no bump gradient map", trace);
        }
        trace.add("  Appearance asset has a bump gradient map" + OK);

        return TemplateValidation.ok(trace);
    }

    private static TemplateValidation fail(List<String> trace, String longName, String problem) {
        trace.add("  Material" + problem + FAILED);
        return TemplateValidation.failure(longName + problem, trace);
    }
}
