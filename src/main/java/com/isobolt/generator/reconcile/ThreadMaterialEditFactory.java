package com.isobolt.generator.reconcile;

import com.isobolt.generator.model.BoltGeometry;
import com.isobolt.generator.store.BumpPatternEdit;

/**
 * Derives the bump pattern of a thread material from the thread geometry.
 *
 * The pattern is one pitch wide and one circumference high, rotated by the helix angle so
 * that the gradient stripes wind around the shaft.
 */
public class ThreadMaterialEditFactory {

    public static final String DEFAULT_MANUFACTURER = "Matthias Wolff";
    public static final String DEFAULT_URL = "https://github.com/matthias-wolff/Revit-Generic-ISO-Metric-Bolt-Assembly";
    public static final String DEFAULT_HELP_URL =
            "https://matthias-wolff.github.io/Revit-Generic-ISO-Metric-Bolt-Assembly/GIMBA.html";

    static final double MILLIMETERS_PER_INCH = 25.4;

    private final String manufacturer;
    private final String url;
    private final String helpUrl;

    public ThreadMaterialEditFactory() {
        this(DEFAULT_MANUFACTURER, DEFAULT_URL, DEFAULT_HELP_URL);
    }

    public ThreadMaterialEditFactory(String manufacturer, String url, String helpUrl) {
        this.manufacturer = manufacturer;
        this.url = url;
        this.helpUrl = helpUrl;
    }

    public BumpPatternEdit create(String category, BoltGeometry geometry) {
        return BumpPatternEdit.builder()
                .scaleX(geometry.getP() / MILLIMETERS_PER_INCH)
                .scaleY(geometry.getC() / MILLIMETERS_PER_INCH)
                .angle(90 - geometry.getBeta())
                .scaleLock(false)
                .uRepeat(true)
                .vRepeat(true)
                .description("Generic ISO metric bolt assembly: " + category + " with "
                        + geometry.getDesignation() + " thread")
                .comments("Rendering material for " + geometry.getDesignation()
                        + " thread. Use bolt-gen materials to manage thread materials. See " + helpUrl
                        + " for further instructions.")
                .keywordSuffix(":" + geometry.getDesignation())
                .manufacturer(manufacturer)
                .url(url)
                .build();
    }
}
