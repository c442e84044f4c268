package app.mediafill.autofill.resolve;

import java.util.LinkedHashMap;
import java.util.Map;

public record ResourceInfo(
        String url,
        Map<String, String> variants,
        boolean success,
        String error
) {

    public ResourceInfo {
        variants = withoutNulls(variants);
    }

    private static Map<String, String> withoutNulls(Map<String, String> variants) {
        if (variants == null || variants.isEmpty()) {
            return Map.of();
        }
        Map<String, String> present = new LinkedHashMap<>();
        variants.forEach((name, variantUrl) -> {
            if (name != null && variantUrl != null) {
                present.put(name, variantUrl);
            }
        });
        return Map.copyOf(present);
    }

    public static ResourceInfo resolved(String url) {
        return new ResourceInfo(url, Map.of(), true, null);
    }

    public static ResourceInfo resolved(String url, Map<String, String> variants) {
        return new ResourceInfo(url, variants, true, null);
    }

    public static ResourceInfo failed(String error) {
        return new ResourceInfo(null, Map.of(), false, error);
    }

    public String variant(String name) {
        if (name != null) {
            String variantUrl = variants.get(name);
            if (variantUrl != null) {
                return variantUrl;
            }
        }
        return url;
    }

    public ResourceInfo preferVariant(String name) {
        if (name == null || name.isBlank()) {
            return this;
        }
        return new ResourceInfo(variant(name), variants, success, error);
    }
}
