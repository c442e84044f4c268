package app.mediafill.autofill.mapping;

import app.mediafill.autofill.binding.Binding;
import app.mediafill.autofill.binding.MediaFiller;
import app.mediafill.autofill.binding.RichTextBinding;
import app.mediafill.autofill.mapping.DynamicPlan.Sink;
import app.mediafill.autofill.richtext.RichTextRewriter;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeanUtils;
import org.springframework.core.CollectionFactory;
import org.springframework.util.ClassUtils;
import org.springframework.util.NumberUtils;
import org.springframework.util.ReflectionUtils;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Maps source objects onto destination types and fills their media fields in one resolve call.
 * <p>
 * Mapping runs in two passes. The first walks the cached {@link MappingPlan} of every
 * source/destination pair, allocates destination objects, copies plain fields and records a
 * {@link Binding} for each media field. The second hands all recorded bindings to a single
 * {@link MediaFiller#fill(Duration, Collection)} call, so a whole list of nested objects costs
 * one resolve.
 * <pre>{@code
 * List<ProductView> views = autoFiller.autoFill(products, ProductView.class);
 * }</pre>
 */
public class MediaAutoFiller {
    private static final Logger log = LoggerFactory.getLogger(MediaAutoFiller.class);

    public static final int DEFAULT_MAX_DEPTH = 32;

    private final MediaFiller filler;
    private final MappingPlanRegistry registry;
    private final RichTextRewriter rewriter;
    private final int maxDepth;

    public MediaAutoFiller(MediaFiller filler, MappingPlanRegistry registry) {
        this(filler, registry, RichTextRewriter.defaults(), DEFAULT_MAX_DEPTH);
    }

    public MediaAutoFiller(MediaFiller filler, MappingPlanRegistry registry, RichTextRewriter rewriter, int maxDepth) {
        if (filler == null || registry == null) {
            throw new IllegalArgumentException("Media filler and plan registry are required");
        }
        this.filler = filler;
        this.registry = registry;
        this.rewriter = rewriter == null ? RichTextRewriter.defaults() : rewriter;
        this.maxDepth = maxDepth <= 0 ? DEFAULT_MAX_DEPTH : maxDepth;
    }

    public <S, D> List<D> autoFill(Collection<? extends S> sources, Class<D> destinationType) {
        return autoFill(sources, destinationType, filler.defaultTimeout());
    }

    /**
     * @return one destination per source, in source order; {@code null} sources map to {@code null}
     */
    public <S, D> List<D> autoFill(Collection<? extends S> sources, Class<D> destinationType, Duration timeout) {
        requireType(destinationType);
        if (sources == null || sources.isEmpty()) {
            return new ArrayList<>();
        }
        Session session = new Session();
        List<D> results = new ArrayList<>(sources.size());
        for (S source : sources) {
            results.add(destinationType.cast(session.map(source, destinationType, 0)));
        }
        session.fill(timeout);
        return results;
    }

    public <S, D> D autoFillOne(S source, Class<D> destinationType) {
        return autoFillOne(source, destinationType, filler.defaultTimeout());
    }

    public <S, D> D autoFillOne(S source, Class<D> destinationType, Duration timeout) {
        requireType(destinationType);
        if (source == null) {
            return null;
        }
        Session session = new Session();
        D result = destinationType.cast(session.map(source, destinationType, 0));
        session.fill(timeout);
        return result;
    }

    public <S, D> D autoFillInto(S source, D destination) {
        return autoFillInto(source, destination, filler.defaultTimeout());
    }

    /**
     * Maps onto an existing destination. Fields without a counterpart in the source keep their
     * current values.
     */
    public <S, D> D autoFillInto(S source, D destination, Duration timeout) {
        if (destination == null) {
            throw new IllegalArgumentException("Destination is required");
        }
        if (source == null) {
            return destination;
        }
        Session session = new Session();
        session.mapInto(source, destination, 0);
        session.fill(timeout);
        return destination;
    }

    public <K, S, D> Map<K, D> autoFillValues(Map<K, ? extends S> sources, Class<D> destinationType) {
        return autoFillValues(sources, destinationType, filler.defaultTimeout());
    }

    /**
     * @return destinations under the same keys, in source iteration order
     */
    public <K, S, D> Map<K, D> autoFillValues(Map<K, ? extends S> sources, Class<D> destinationType, Duration timeout) {
        requireType(destinationType);
        if (sources == null || sources.isEmpty()) {
            return new LinkedHashMap<>();
        }
        Session session = new Session();
        Map<K, D> results = new LinkedHashMap<>(sources.size() * 2);
        for (Map.Entry<K, ? extends S> entry : sources.entrySet()) {
            results.put(entry.getKey(), destinationType.cast(session.map(entry.getValue(), destinationType, 0)));
        }
        session.fill(timeout);
        return results;
    }

    public MappingPlanRegistry registry() {
        return registry;
    }

    private static void requireType(Class<?> destinationType) {
        if (destinationType == null) {
            throw new IllegalArgumentException("Destination type is required");
        }
    }

    // bindings recorded while walking one source graph
    private final class Session {
        private final List<Binding> bindings = new ArrayList<>();
        private final Set<Object> inProgress = Collections.newSetFromMap(new IdentityHashMap<>());

        void fill(Duration timeout) {
            if (bindings.isEmpty()) {
                return;
            }
            log.debug("Filling {} media bindings", bindings.size());
            filler.fill(timeout, bindings);
        }

        Object map(Object source, Class<?> destinationType, int depth) {
            if (source == null) {
                return null;
            }
            checkDepth(source, destinationType, depth);
            if (source instanceof JsonNode node) {
                if (!node.isObject()) {
                    return null;
                }
                Object destination = instantiate(destinationType);
                mapDynamic(node, destination);
                return destination;
            }
            if (source instanceof Map<?, ?> payload) {
                Object destination = instantiate(destinationType);
                mapDynamic(payload, destination);
                return destination;
            }
            if (!MappingPlanBuilder.isRecursableSource(source.getClass())) {
                log.debug("Cannot map {} onto {}", source.getClass().getName(), destinationType.getSimpleName());
                return null;
            }
            Object destination = instantiate(destinationType);
            mapObject(source, destination, depth);
            return destination;
        }

        void mapInto(Object source, Object destination, int depth) {
            checkDepth(source, destination.getClass(), depth);
            if (source instanceof JsonNode || source instanceof Map<?, ?>) {
                mapDynamic(source, destination);
                return;
            }
            if (!MappingPlanBuilder.isRecursableSource(source.getClass())) {
                throw new IllegalArgumentException("Cannot map " + source.getClass().getName() + " onto "
                        + destination.getClass().getSimpleName());
            }
            mapObject(source, destination, depth);
        }

        private void mapObject(Object source, Object destination, int depth) {
            MappingPlan plan = registry.planFor(source.getClass(), destination.getClass());
            if (!inProgress.add(source)) {
                throw new CyclicMappingException("Cyclic reference while mapping " + plan.shape()
                        + ": a " + source.getClass().getSimpleName() + " refers back to itself");
            }
            try {
                apply(plan, source, destination, depth);
            } finally {
                inProgress.remove(source);
            }
        }

        private void checkDepth(Object source, Class<?> destinationType, int depth) {
            if (depth > maxDepth) {
                throw new CyclicMappingException("Mapping " + source.getClass().getSimpleName() + " -> "
                        + destinationType.getSimpleName() + " exceeded max depth " + maxDepth);
            }
        }

        private void apply(MappingPlan plan, Object source, Object destination, int depth) {
            for (FieldAction action : plan.actions()) {
                Object value = ReflectionUtils.getField(action.source(), source);
                if (action instanceof FieldAction.CopyVerbatim copy) {
                    write(copy.destination(), destination, copyValue(value, copy));
                } else if (action instanceof FieldAction.LiftIdToUrl lift) {
                    liftId(lift, value, destination);
                } else if (action instanceof FieldAction.LiftIdsToUrls lift) {
                    liftIds(lift, value, destination);
                } else if (action instanceof FieldAction.RewriteRichText rich) {
                    richText(rich.destination(), destination, textOf(value), rich.variant());
                } else if (action instanceof FieldAction.RecurseList recurseList) {
                    write(recurseList.destination(), destination, mapList(value, recurseList, depth));
                } else if (action instanceof FieldAction.RecurseMap recurseMap) {
                    write(recurseMap.destination(), destination, mapMap(value, recurseMap, depth));
                } else if (action instanceof FieldAction.RecurseRecord nested) {
                    write(nested.destination(), destination, map(value, nested.element().destination(), depth + 1));
                }
            }
        }

        private void liftId(FieldAction.LiftIdToUrl lift, Object value, Object destination) {
            String id = idOf(value);
            if (id == null || id.isEmpty()) {
                return;
            }
            Field target = lift.destination();
            bindings.add(Binding.single(() -> id, url -> ReflectionUtils.setField(target, destination, url))
                    .useVariant(lift.variant()));
        }

        private void liftIds(FieldAction.LiftIdsToUrls lift, Object value, Object destination) {
            List<Object> elements = elementsOf(value);
            if (elements == null) {
                return;
            }
            List<String> ids = new ArrayList<>(elements.size());
            for (Object element : elements) {
                ids.add(idOf(element));
            }
            Field target = lift.destination();
            if (ids.isEmpty()) {
                ReflectionUtils.setField(target, destination, new ArrayList<String>());
                return;
            }
            bindings.add(Binding.multi(() -> ids, urls -> ReflectionUtils.setField(target, destination, urls))
                    .useVariant(lift.variant()));
        }

        private void richText(Field target, Object destination, String text, String variant) {
            if (text == null) {
                return;
            }
            ReflectionUtils.setField(target, destination, text);
            if (!text.isEmpty()) {
                bindings.add(new RichTextBinding(() -> text,
                        rendered -> ReflectionUtils.setField(target, destination, rendered), rewriter, variant));
            }
        }

        private Object mapList(Object value, FieldAction.RecurseList action, int depth) {
            List<Object> elements = elementsOf(value);
            if (elements == null) {
                return null;
            }
            Collection<Object> results = CollectionFactory.createCollection(action.destination().getType(), elements.size());
            Class<?> elementType = action.element().destination();
            for (Object element : elements) {
                results.add(map(element, elementType, depth + 1));
            }
            return results;
        }

        private Object mapMap(Object value, FieldAction.RecurseMap action, int depth) {
            Class<?> valueType = action.element().destination();
            if (value instanceof JsonNode node) {
                if (!node.isObject()) {
                    return null;
                }
                Map<Object, Object> results = CollectionFactory.createMap(action.destination().getType(), node.size());
                for (Map.Entry<String, JsonNode> entry : node.properties()) {
                    results.put(entry.getKey(), map(entry.getValue(), valueType, depth + 1));
                }
                return results;
            }
            if (value instanceof Map<?, ?> source) {
                Map<Object, Object> results = CollectionFactory.createMap(action.destination().getType(), source.size());
                for (Map.Entry<?, ?> entry : source.entrySet()) {
                    results.put(entry.getKey(), map(entry.getValue(), valueType, depth + 1));
                }
                return results;
            }
            return null;
        }

        private void mapDynamic(Object payload, Object destination) {
            DynamicPlan plan = registry.dynamicPlanFor(destination.getClass());
            for (Sink sink : plan.sinks()) {
                Object raw = lookup(payload, sink.name());
                if (raw == null) {
                    continue;
                }
                switch (sink.kind()) {
                    case STRING, MEDIA_ID -> write(sink.field(), destination, idOf(raw));
                    case RICH_TEXT -> richText(sink.field(), destination, textOf(raw), sink.variant());
                    case INTEGER -> write(sink.field(), destination, integral(raw, Integer.MIN_VALUE, Integer.MAX_VALUE, Integer.class));
                    case LONG -> write(sink.field(), destination, integral(raw, Long.MIN_VALUE, Long.MAX_VALUE, Long.class));
                    case DOUBLE -> write(sink.field(), destination, raw instanceof Number n ? n.doubleValue() : null);
                    case FLOAT -> write(sink.field(), destination, raw instanceof Number n ? n.floatValue() : null);
                    case BOOLEAN -> write(sink.field(), destination, raw instanceof Boolean b ? b : null);
                }
            }
        }
    }

    private static Object instantiate(Class<?> type) {
        MappingPlanBuilder.requireDestination(type);
        return BeanUtils.instantiateClass(type);
    }

    private static Object copyValue(Object value, FieldAction.CopyVerbatim copy) {
        if (value == null) {
            return null;
        }
        Class<?> targetType = copy.destination().getType();
        return switch (copy.mode()) {
            case ASSIGN -> value;
            case WIDEN -> widen((Number) value, targetType);
            case COLLECTION -> {
                Collection<?> source = (Collection<?>) value;
                Collection<Object> result = CollectionFactory.createCollection(targetType, source.size());
                result.addAll(source);
                yield result;
            }
            case MAP -> {
                Map<?, ?> source = (Map<?, ?>) value;
                Map<Object, Object> result = CollectionFactory.createMap(targetType, source.size());
                result.putAll(source);
                yield result;
            }
        };
    }

    @SuppressWarnings("unchecked")
    private static Number widen(Number value, Class<?> targetType) {
        Class<? extends Number> boxed = (Class<? extends Number>) ClassUtils.resolvePrimitiveIfNecessary(targetType);
        return NumberUtils.convertNumberToTargetClass(value, boxed);
    }

    private static void write(Field field, Object destination, Object value) {
        if (value == null && field.getType().isPrimitive()) {
            return;
        }
        ReflectionUtils.setField(field, destination, value);
    }

    private static Object lookup(Object payload, String name) {
        if (payload instanceof JsonNode node) {
            return scalarOf(node.get(name));
        }
        if (payload instanceof Map<?, ?> map) {
            Object value = map.get(name);
            return value instanceof JsonNode node ? scalarOf(node) : value;
        }
        return null;
    }

    private static Object scalarOf(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return null;
    }

    private static Number integral(Object raw, long min, long max, Class<? extends Number> type) {
        BigInteger truncated = truncate(raw);
        if (truncated == null
                || truncated.compareTo(BigInteger.valueOf(min)) < 0
                || truncated.compareTo(BigInteger.valueOf(max)) > 0) {
            return null;
        }
        return NumberUtils.convertNumberToTargetClass(truncated.longValue(), type);
    }

    // exact integer part of a payload number; null for NaN, infinities and non-numbers
    private static BigInteger truncate(Object raw) {
        if (raw instanceof BigInteger integer) {
            return integer;
        }
        if (raw instanceof BigDecimal decimal) {
            return decimal.toBigInteger();
        }
        if (raw instanceof Double || raw instanceof Float) {
            double value = ((Number) raw).doubleValue();
            return Double.isFinite(value) ? new BigDecimal(value).toBigInteger() : null;
        }
        if (raw instanceof Number number) {
            return BigInteger.valueOf(number.longValue());
        }
        return null;
    }

    private static String idOf(Object value) {
        if (value instanceof CharSequence || value instanceof UUID) {
            return value.toString();
        }
        return null;
    }

    private static String textOf(Object value) {
        return value instanceof CharSequence text ? text.toString() : null;
    }

    private static List<Object> elementsOf(Object value) {
        if (value instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        if (value instanceof JsonNode node) {
            if (!node.isArray()) {
                return null;
            }
            List<Object> elements = new ArrayList<>(node.size());
            Iterator<JsonNode> iterator = node.elements();
            while (iterator.hasNext()) {
                JsonNode element = iterator.next();
                elements.add(element.isNull() ? null : element.isTextual() ? element.textValue() : element);
            }
            return elements;
        }
        if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> elements = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                elements.add(Array.get(value, i));
            }
            return elements;
        }
        return null;
    }
}
