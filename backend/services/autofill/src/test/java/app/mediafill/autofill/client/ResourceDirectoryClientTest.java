package app.mediafill.autofill.client;

import app.mediafill.autofill.config.ResourceClientProps;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.headerDoesNotExist;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class ResourceDirectoryClientTest {

    private static final String BASE_URL = "http://resource.local";

    private RestClient.Builder builder;
    private MockRestServiceServer server;

    @BeforeEach
    void setup() {
        builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
    }

    @Test
    void getFileUrls_postsBatchWithTokenAndParsesResults() {
        ResourceDirectoryClient client = client("secret");
        server.expect(requestTo(BASE_URL + "/internal/files/urls"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer secret"))
                .andExpect(content().json("""
                        {"fileIds": ["a", "b"], "includeVariants": true, "expiresIn": 3600}
                        """))
                .andRespond(withSuccess("""
                        {"results": {
                          "a": {"url": "https://cdn/a.jpg", "variantUrls": {"thumbnail_200x200": "https://cdn/a_200.jpg"}, "success": true},
                          "b": {"success": false, "error": "file not found"}
                        }}
                        """, MediaType.APPLICATION_JSON));

        Map<String, FileUrlInfo> results = client.getFileUrls(List.of("a", "b"));

        assertThat(results.get("a").url()).isEqualTo("https://cdn/a.jpg");
        assertThat(results.get("a").variantUrls()).containsEntry("thumbnail_200x200", "https://cdn/a_200.jpg");
        assertThat(results.get("a").success()).isTrue();
        assertThat(results.get("b").success()).isFalse();
        assertThat(results.get("b").error()).isEqualTo("file not found");
        server.verify();
    }

    @Test
    void getFileUrls_omitsAuthorizationWithoutToken() {
        ResourceDirectoryClient client = client(null);
        server.expect(requestTo(BASE_URL + "/internal/files/urls"))
                .andExpect(headerDoesNotExist(HttpHeaders.AUTHORIZATION))
                .andExpect(content().json("""
                        {"fileIds": ["a"], "includeVariants": false, "expiresIn": 60}
                        """))
                .andRespond(withSuccess("{\"results\": null}", MediaType.APPLICATION_JSON));

        assertThat(client.getFileUrls(List.of("a"), false, 60)).isEmpty();
        server.verify();
    }

    @Test
    void getFileUrls_emptyInputSendsNothing() {
        ResourceDirectoryClient client = client("secret");

        assertThat(client.getFileUrls(List.of())).isEmpty();
        assertThat(client.getFileUrls(null)).isEmpty();
        server.verify();
    }

    @Test
    void getFileUrls_rejectsOversizedBatch() {
        ResourceDirectoryClient client = client("secret");
        List<String> ids = IntStream.range(0, 101).mapToObj(i -> "id_" + i).toList();

        assertThatThrownBy(() -> client.getFileUrls(ids))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("100");
        server.verify();
    }

    @Test
    void getFileUrls_propagatesServerErrors() {
        ResourceDirectoryClient client = client("secret");
        server.expect(requestTo(BASE_URL + "/internal/files/urls"))
                .andRespond(withServerError());

        assertThatThrownBy(() -> client.getFileUrls(List.of("a")))
                .isInstanceOf(HttpServerErrorException.class)
                .satisfies(ex -> assertThat(((HttpServerErrorException) ex).getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR));
    }

    @Test
    void getFileUrl_returnsUrlOrFailsWithDirectoryError() {
        ResourceDirectoryClient client = client("secret");
        server.expect(requestTo(BASE_URL + "/internal/files/urls"))
                .andRespond(withSuccess("""
                        {"results": {"a": {"url": "https://cdn/a.jpg", "success": true}}}
                        """, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE_URL + "/internal/files/urls"))
                .andRespond(withSuccess("""
                        {"results": {"b": {"success": false, "error": "expired"}}}
                        """, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE_URL + "/internal/files/urls"))
                .andRespond(withSuccess("{\"results\": {}}", MediaType.APPLICATION_JSON));

        assertThat(client.getFileUrl("a")).isEqualTo("https://cdn/a.jpg");
        assertThatThrownBy(() -> client.getFileUrl("b"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Failed to resolve url for file b: expired");
        assertThatThrownBy(() -> client.getFileUrl("c"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Failed to resolve url for file c: file not found");
        assertThatThrownBy(() -> client.getFileUrl(" "))
                .isInstanceOf(IllegalArgumentException.class);
        server.verify();
    }

    private ResourceDirectoryClient client(String token) {
        ResourceClientProps props = new ResourceClientProps(BASE_URL, token, Duration.ofSeconds(5), null, null, 0, 0);
        return new ResourceDirectoryClient(builder.build(), props);
    }
}
