package app.mediafill.autofill.client;

import java.util.Map;

public record FileUrlsResponse(
        Map<String, FileUrlInfo> results
) {
}
