package app.mediafill.autofill.client;

import app.mediafill.autofill.resolve.MediaResolveException;
import app.mediafill.autofill.resolve.MediaResolver;
import app.mediafill.autofill.resolve.ResourceInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public class ResourceDirectoryResolver implements MediaResolver, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ResourceDirectoryResolver.class);

    private final ResourceDirectoryClient client;
    private final int batchSize;
    private final ExecutorService executor;

    public ResourceDirectoryResolver(ResourceDirectoryClient client, int batchSize, int maxConcurrentRequests) {
        if (client == null) {
            throw new IllegalArgumentException("Resource directory client is required");
        }
        this.client = client;
        this.batchSize = Math.max(batchSize, 1);
        int workers = Math.max(maxConcurrentRequests, 1);
        ThreadPoolExecutor pool = new ThreadPoolExecutor(
                workers,
                workers,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                runnable -> {
                    Thread thread = new Thread(runnable, "resource-resolve-worker");
                    thread.setDaemon(true);
                    return thread;
                }
        );
        pool.allowCoreThreadTimeOut(true);
        this.executor = pool;
    }

    @Override
    public Map<String, ResourceInfo> resolve(List<String> ids, Duration timeout) {
        if (ids == null || ids.isEmpty()) {
            return Map.of();
        }

        List<Future<Map<String, FileUrlInfo>>> futures = new ArrayList<>();
        try {
            for (int from = 0; from < ids.size(); from += batchSize) {
                List<String> batch = List.copyOf(ids.subList(from, Math.min(from + batchSize, ids.size())));
                futures.add(executor.submit(() -> client.getFileUrls(batch)));
            }
        } catch (RejectedExecutionException ex) {
            cancelAll(futures);
            throw new MediaResolveException("Resource resolver is shut down", ex);
        }
        if (futures.size() > 1) {
            log.debug("Resolving {} ids in {} requests", ids.size(), futures.size());
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        Map<String, ResourceInfo> resources = new LinkedHashMap<>();
        try {
            for (Future<Map<String, FileUrlInfo>> future : futures) {
                long remaining = Math.max(deadline - System.nanoTime(), 0L);
                putResources(resources, future.get(remaining, TimeUnit.NANOSECONDS));
            }
            return resources;
        } catch (TimeoutException ex) {
            cancelAll(futures);
            log.warn("Resource directory did not answer within {}ms for {} ids", timeout.toMillis(), ids.size());
            throw new MediaResolveException("Resource directory timed out after " + timeout.toMillis() + "ms", ex);
        } catch (InterruptedException ex) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new MediaResolveException("Media resolve interrupted", ex);
        } catch (ExecutionException ex) {
            cancelAll(futures);
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new MediaResolveException("Media resolve failed", cause);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static void cancelAll(List<? extends Future<?>> futures) {
        for (Future<?> future : futures) {
            future.cancel(true);
        }
    }

    private static void putResources(Map<String, ResourceInfo> resources, Map<String, FileUrlInfo> results) {
        if (results == null) {
            return;
        }
        results.forEach((id, info) -> {
            if (id != null && info != null) {
                resources.put(id, new ResourceInfo(info.url(), info.variantUrls(), info.success(), info.error()));
            }
        });
    }
}
