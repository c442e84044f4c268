package app.mediafill.autofill.config;

import jakarta.validation.constraints.Max;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.resource")
public record ResourceClientProps(
        String baseUrl,
        String internalToken,
        Duration timeout,
        Boolean includeVariants,
        Long expiresIn,
        @Max(1000) int maxBatchSize,
        @Max(64) int maxConcurrentRequests
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    public static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;
    public static final int DEFAULT_MAX_BATCH_SIZE = 100;
    public static final int DEFAULT_MAX_CONCURRENT_REQUESTS = 8;

    public ResourceClientProps {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            timeout = DEFAULT_TIMEOUT;
        }
        if (includeVariants == null) {
            includeVariants = Boolean.TRUE;
        }
        if (expiresIn == null || expiresIn <= 0) {
            expiresIn = DEFAULT_EXPIRES_IN_SECONDS;
        }
        if (maxBatchSize <= 0) {
            maxBatchSize = DEFAULT_MAX_BATCH_SIZE;
        }
        if (maxConcurrentRequests <= 0) {
            maxConcurrentRequests = DEFAULT_MAX_CONCURRENT_REQUESTS;
        }
    }
}
