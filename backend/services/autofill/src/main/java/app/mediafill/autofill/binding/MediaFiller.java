package app.mediafill.autofill.binding;

import app.mediafill.autofill.resolve.MediaResolver;
import app.mediafill.autofill.resolve.ResourceInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Collects the identifiers of all bindings, resolves them with a single {@link MediaResolver}
 * call and writes the results back through each binding.
 * <p>
 * A binding whose identifier is missing from the result, or resolved unsuccessfully, keeps its
 * destination unchanged. If the resolver throws, nothing is written and the exception is
 * propagated as is.
 */
public class MediaFiller {
    private static final Logger log = LoggerFactory.getLogger(MediaFiller.class);

    private final MediaResolver resolver;
    private final Duration defaultTimeout;

    public MediaFiller(MediaResolver resolver, Duration defaultTimeout) {
        if (resolver == null) {
            throw new IllegalArgumentException("Media resolver is required");
        }
        this.resolver = resolver;
        this.defaultTimeout = defaultTimeout == null || defaultTimeout.isZero() || defaultTimeout.isNegative()
                ? Duration.ofSeconds(10)
                : defaultTimeout;
    }

    public Duration defaultTimeout() {
        return defaultTimeout;
    }

    public void fill(Binding... bindings) {
        if (bindings == null || bindings.length == 0) {
            return;
        }
        fill(defaultTimeout, Arrays.asList(bindings));
    }

    public void fill(Collection<? extends Binding> bindings) {
        fill(defaultTimeout, bindings);
    }

    public void fill(Duration timeout, Collection<? extends Binding> bindings) {
        if (bindings == null || bindings.isEmpty()) {
            return;
        }

        IdentifierCollector collector = new IdentifierCollector();
        for (Binding binding : bindings) {
            if (binding != null) {
                collect(binding, collector);
            }
        }
        if (collector.isEmpty()) {
            return;
        }

        Map<String, ResourceInfo> resources = resolve(collector, timeout == null ? defaultTimeout : timeout);

        for (Binding binding : bindings) {
            if (binding != null) {
                distribute(binding, resources);
            }
        }
    }

    public <T> void fillOne(T item, BindingSource<? super T> source) {
        if (item == null) {
            return;
        }
        fill(defaultTimeout, source.bindings(item));
    }

    /**
     * Fills every item with one shared resolve call.
     */
    public <T> void fillAll(Collection<? extends T> items, BindingSource<? super T> source) {
        if (items == null || items.isEmpty()) {
            return;
        }
        List<Binding> bindings = new ArrayList<>();
        for (T item : items) {
            if (item != null) {
                bindings.addAll(source.bindings(item));
            }
        }
        fill(defaultTimeout, bindings);
    }

    public <K, V> void fillValues(Map<K, ? extends V> items, BindingSource<? super V> source) {
        if (items == null || items.isEmpty()) {
            return;
        }
        fillAll(items.values(), source);
    }

    private Map<String, ResourceInfo> resolve(IdentifierCollector collector, Duration timeout) {
        List<String> ids = collector.toList();
        log.debug("Resolving {} media ids", ids.size());
        Map<String, ResourceInfo> resources;
        try {
            resources = resolver.resolve(ids, timeout);
        } catch (RuntimeException ex) {
            log.warn("Media resolve failed for {} ids: {}", ids.size(), ex.getMessage());
            throw ex;
        }
        if (resources == null) {
            return Map.of();
        }
        if (log.isDebugEnabled()) {
            long unresolved = ids.stream()
                    .filter(id -> !isResolved(resources.get(id)))
                    .count();
            if (unresolved > 0) {
                log.debug("{} of {} media ids were not resolved", unresolved, ids.size());
            }
        }
        return resources;
    }

    private void collect(Binding binding, IdentifierCollector collector) {
        if (binding instanceof SingleBinding<?> single) {
            collector.add(single.id().get());
        } else if (binding instanceof MultiBinding<?> multi) {
            collector.addAll(multi.ids().get());
        } else if (binding instanceof RichTextBinding rich) {
            collector.addAll(rich.rewriter().extractIds(rich.raw().get()));
        }
    }

    private void distribute(Binding binding, Map<String, ResourceInfo> resources) {
        if (binding instanceof SingleBinding<?> single) {
            fillSingle(single, resources);
        } else if (binding instanceof MultiBinding<?> multi) {
            fillMulti(multi, resources);
        } else if (binding instanceof RichTextBinding rich) {
            fillRichText(rich, resources);
        }
    }

    private <T> void fillSingle(SingleBinding<T> binding, Map<String, ResourceInfo> resources) {
        String id = binding.id().get();
        if (id == null || id.isEmpty() || binding.target() == null) {
            return;
        }
        ResourceInfo info = resources.get(id);
        if (isResolved(info)) {
            binding.target().accept(binding.transform().apply(info.preferVariant(binding.variant())));
        }
    }

    private <T> void fillMulti(MultiBinding<T> binding, Map<String, ResourceInfo> resources) {
        List<String> ids = binding.ids().get();
        if (ids == null || ids.isEmpty() || binding.targets() == null) {
            return;
        }
        List<T> results = new ArrayList<>(Collections.nCopies(ids.size(), null));
        for (int i = 0; i < ids.size(); i++) {
            String id = ids.get(i);
            if (id == null || id.isEmpty()) {
                continue;
            }
            ResourceInfo info = resources.get(id);
            if (isResolved(info)) {
                results.set(i, binding.transform().apply(info.preferVariant(binding.variant())));
            }
        }
        binding.targets().accept(results);
    }

    private void fillRichText(RichTextBinding binding, Map<String, ResourceInfo> resources) {
        String raw = binding.raw().get();
        if (raw == null || raw.isEmpty() || binding.rendered() == null) {
            return;
        }
        binding.rendered().accept(binding.rewriter().rewrite(raw, resources, binding.variant()));
    }

    private static boolean isResolved(ResourceInfo info) {
        return info != null && info.success();
    }
}
