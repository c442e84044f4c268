package app.mediafill.autofill.client;

import java.util.List;

public record FileUrlsRequest(
        List<String> fileIds,
        boolean includeVariants,
        long expiresIn
) {
}
