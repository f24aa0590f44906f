package com.modtools.idconflict.conflict;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.modtools.idconflict.model.ResourceCategory;

/**
 * Static knowledge about resource types and well-known mod brands.
 */
public final class ResourceCatalog {

    public static final String UNKNOWN_LABEL = "Unknown resource";

    /** Category and label of a known resource type. */
    public record TypeInfo(ResourceCategory category, String label) {}

    private static final Map<Integer, TypeInfo> TYPES = Map.ofEntries(
            Map.entry(0x0166038C, new TypeInfo(ResourceCategory.SCRIPT, "Python Script")),
            Map.entry(0x015A1849, new TypeInfo(ResourceCategory.GAMEPLAY, "Object Definition")),
            Map.entry(0x01B2D882, new TypeInfo(ResourceCategory.GAMEPLAY, "Tuning")),
            Map.entry(0x025C95B7, new TypeInfo(ResourceCategory.GAMEPLAY, "Autonomy")),
            Map.entry(0x00B2D882, new TypeInfo(ResourceCategory.GAMEPLAY, "Tuning (Legacy)")),
            Map.entry(0x0355E0A6, new TypeInfo(ResourceCategory.BUILD_BUY, "Object Catalog")),
            Map.entry(0x319E4F1D, new TypeInfo(ResourceCategory.TEXTURE, "Diffuse Map")),
            Map.entry(0x0333406C, new TypeInfo(ResourceCategory.TEXTURE, "Image Resource")),
            Map.entry(0x034AEECB, new TypeInfo(ResourceCategory.CAS, "CAS Part")),
            Map.entry(0x03555A5D, new TypeInfo(ResourceCategory.CAS, "CAS Part Thumbnail")),
            Map.entry(0x545AC67A, new TypeInfo(ResourceCategory.SCRIPT, "Binary Script")),
            Map.entry(0x0621661E, new TypeInfo(ResourceCategory.AUDIO, "Audio Stream")),
            Map.entry(0x319E4F87, new TypeInfo(ResourceCategory.TEXTURE, "Normal Map")),
            Map.entry(0x34613C29, new TypeInfo(ResourceCategory.TEXTURE, "Specular Map")),
            Map.entry(0x5B4D8F8C, new TypeInfo(ResourceCategory.GAMEPLAY, "Slot")),
            Map.entry(0xE06C2907, new TypeInfo(ResourceCategory.GAMEPLAY, "Animation Clip")));

    private static final TypeInfo UNKNOWN = new TypeInfo(ResourceCategory.OTHER, UNKNOWN_LABEL);

    private static final Set<Integer> CRITICAL_TYPES = Set.of(
            0x0166038C, 0x015A1849, 0x01B2D882, 0x025C95B7, 0x5B4D8F8C);

    private static final Set<Integer> HIGH_IMPACT_TYPES = Set.of(
            0x0333406C, 0x034AEECB, 0x0355E0A6, 0x545AC67A, 0x319E4F1D, 0x319E4F87, 0x34613C29);

    // Lowercase needle -> brand label. Matched as substrings of the lowercased path.
    private static final Map<String, String> BRAND_KEYWORDS;

    static {
        Map<String, String> brands = new LinkedHashMap<>();
        brands.put("wickedwhims", "WickedWhims");
        brands.put("basemental", "Basemental");
        brands.put("mccc", "MC Command Center");
        brands.put("slice of life", "Slice of Life");
        brands.put("wonderful whims", "WonderfulWhims");
        brands.put("turbodriver", "TURBODRIVER");
        brands.put("littlemssam", "LittleMsSam");
        brands.put("zerobroken", "Zero's Mods");
        brands.put("sacrificial", "Sacrificial");
        BRAND_KEYWORDS = Collections.unmodifiableMap(brands);
    }

    private ResourceCatalog() {
        // Utility class
    }

    public static TypeInfo lookup(int typeId) {
        return TYPES.getOrDefault(typeId, UNKNOWN);
    }

    public static boolean isCriticalType(int typeId) {
        return CRITICAL_TYPES.contains(typeId);
    }

    public static boolean isHighImpactType(int typeId) {
        return HIGH_IMPACT_TYPES.contains(typeId);
    }

    /**
     * Brand labels whose needle occurs anywhere in {@code text}, case-insensitively.
     */
    public static Set<String> matchBrands(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        Set<String> found = new TreeSet<>();
        BRAND_KEYWORDS.forEach((needle, label) -> {
            if (lower.contains(needle)) {
                found.add(label);
            }
        });
        return found;
    }
}
