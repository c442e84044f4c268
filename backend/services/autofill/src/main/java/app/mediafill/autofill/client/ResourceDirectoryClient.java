package app.mediafill.autofill.client;

import app.mediafill.autofill.config.ResourceClientProps;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Map;

public class ResourceDirectoryClient {

    private final RestClient restClient;
    private final ResourceClientProps props;

    public ResourceDirectoryClient(RestClient resourceRestClient, ResourceClientProps props) {
        this.restClient = resourceRestClient;
        this.props = props;
    }

    public Map<String, FileUrlInfo> getFileUrls(List<String> fileIds) {
        return getFileUrls(fileIds, props.includeVariants(), props.expiresIn());
    }

    public Map<String, FileUrlInfo> getFileUrls(List<String> fileIds, boolean includeVariants, long expiresIn) {
        if (fileIds == null || fileIds.isEmpty()) {
            return Map.of();
        }
        if (fileIds.size() > props.maxBatchSize()) {
            throw new IllegalArgumentException("At most " + props.maxBatchSize()
                    + " file ids can be resolved per request, got " + fileIds.size());
        }

        RestClient.RequestBodySpec request = restClient.post()
                .uri("/internal/files/urls")
                .contentType(MediaType.APPLICATION_JSON)
                .body(new FileUrlsRequest(fileIds, includeVariants, expiresIn));
        if (props.internalToken() != null && !props.internalToken().isBlank()) {
            request.header(HttpHeaders.AUTHORIZATION, bearer(props.internalToken()));
        }

        FileUrlsResponse response = request.retrieve().body(FileUrlsResponse.class);
        if (response == null || response.results() == null) {
            return Map.of();
        }
        return response.results();
    }

    public String getFileUrl(String fileId) {
        if (fileId == null || fileId.isBlank()) {
            throw new IllegalArgumentException("File id is required");
        }
        FileUrlInfo info = getFileUrls(List.of(fileId)).get(fileId);
        if (info == null || !info.success()) {
            String reason = info != null && info.error() != null && !info.error().isBlank()
                    ? info.error()
                    : "file not found";
            throw new IllegalStateException("Failed to resolve url for file " + fileId + ": " + reason);
        }
        return info.url();
    }

    private String bearer(String token) {
        return "Bearer " + token;
    }
}
