package app.mediafill.autofill.client;

import java.util.Map;

public record FileUrlInfo(
        String url,
        Map<String, String> variantUrls,
        boolean success,
        String error
) {
}
