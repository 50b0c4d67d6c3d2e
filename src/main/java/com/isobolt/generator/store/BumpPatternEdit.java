package com.isobolt.generator.store;

import java.util.Optional;

import com.isobolt.generator.model.asset.Asset;
import com.isobolt.generator.model.asset.BooleanProperty;
import com.isobolt.generator.model.asset.BumpGradientMaps;
import com.isobolt.generator.model.asset.DistanceProperty;
import com.isobolt.generator.model.asset.DoubleProperty;
import com.isobolt.generator.model.asset.Material;
import com.isobolt.generator.model.asset.ReferenceProperty;
import com.isobolt.generator.model.asset.StringProperty;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Changes applied to a duplicated template to turn it into a thread material: the
 * procedural bump pattern parameters plus descriptive material fields.
 */
@Value
@Builder
public class BumpPatternEdit {

    public static final String SCALE_X = "texture_RealWorldScaleX";
    public static final String SCALE_Y = "texture_RealWorldScaleY";
    public static final String ANGLE = "texture_WAngle";
    public static final String SCALE_LOCK = "texture_ScaleLock";
    public static final String U_REPEAT = "texture_URepeat";
    public static final String V_REPEAT = "texture_VRepeat";
    public static final String DESCRIPTION = "description";
    public static final String KEYWORD = "keyword";

    /** Pattern width along U in inches. */
    double scaleX;

    /** Pattern height along V in inches. */
    double scaleY;

    /** Pattern rotation in degrees. */
    double angle;

    boolean scaleLock;

    boolean uRepeat;

    boolean vRepeat;

    @NonNull
    String description;

    String comments;

    /** Appended to the appearance keyword, e.g. {@code :M12}. */
    @NonNull
    String keywordSuffix;

    String manufacturer;

    String url;

    /**
     * Returns a renamed copy of the template with this edit applied.
     *
     * @throws StoreOperationException if the template has no appearance asset or no bump gradient map
     */
    public Material applyTo(Material template, String name) {
        Asset appearance = template.getAppearance();
        if (appearance == null) {
            throw new StoreOperationException("Material \"" + template.getName() + "\" has no appearance asset");
        }
        ReferenceProperty holder = BumpGradientMaps.findHolder(appearance)
                .orElseThrow(() -> new StoreOperationException(
                        "Material \"" + template.getName() + "\" has no bump gradient map"));
        Asset bumpMap = holder.getConnectedAsset().orElseThrow();

        Asset editedMap = bumpMap
                .withProperty(new DistanceProperty(SCALE_X, scaleX, DistanceProperty.INCHES))
                .withProperty(new DistanceProperty(SCALE_Y, scaleY, DistanceProperty.INCHES))
                .withProperty(new DoubleProperty(ANGLE, angle))
                .withProperty(new BooleanProperty(SCALE_LOCK, scaleLock))
                .withProperty(new BooleanProperty(U_REPEAT, uRepeat))
                .withProperty(new BooleanProperty(V_REPEAT, vRepeat));

        String keyword = appearance.findString(KEYWORD).orElse("");
        Asset editedAppearance = appearance
                .withName(name)
                .withProperty(new ReferenceProperty(holder.getName(), editedMap))
                .withProperty(new StringProperty(DESCRIPTION, description))
                .withProperty(new StringProperty(KEYWORD, keyword + keywordSuffix));

        return template.toBuilder()
                .name(name)
                .manufacturer(Optional.ofNullable(manufacturer).orElse(template.getManufacturer()))
                .url(Optional.ofNullable(url).orElse(template.getUrl()))
                .comments(comments)
                .description(description)
                .appearance(editedAppearance)
                .build();
    }
}
