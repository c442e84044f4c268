package app.mediafill.autofill.mapping;

import app.mediafill.autofill.mapping.DynamicPlan.Sink;
import app.mediafill.autofill.mapping.DynamicPlan.SinkKind;
import app.mediafill.autofill.mapping.FieldAction.CopyMode;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeanUtils;
import org.springframework.core.ResolvableType;
import org.springframework.util.ClassUtils;
import org.springframework.util.ReflectionUtils;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

final class MappingPlanBuilder {
    private static final Logger log = LoggerFactory.getLogger(MappingPlanBuilder.class);

    private static final List<String> URL_SUFFIXES = List.of("Url", "URL");
    private static final List<String> URLS_SUFFIXES = List.of("Urls", "URLs", "Url", "URL");
    private static final Map<Class<?>, Set<Class<?>>> WIDENING = Map.of(
            Byte.class, Set.of(Short.class, Integer.class, Long.class, Float.class, Double.class),
            Short.class, Set.of(Integer.class, Long.class, Float.class, Double.class),
            Integer.class, Set.of(Long.class, Double.class),
            Float.class, Set.of(Double.class)
    );

    private final MappingMode mode;

    MappingPlanBuilder(MappingMode mode) {
        this.mode = mode == null ? MappingMode.LENIENT : mode;
    }

    MappingPlan build(ShapePair shape) {
        requireDestination(shape.destination());
        Map<String, Field> sourceFields = fields(shape.source(), false);
        Map<String, Field> destinationFields = fields(shape.destination(), true);

        List<FieldAction> actions = new ArrayList<>();
        List<String> unmapped = new ArrayList<>();
        for (Field destination : destinationFields.values()) {
            FieldAction action = derive(destination, sourceFields);
            if (action == null) {
                unmapped.add(destination.getName());
            } else {
                actions.add(action);
            }
        }

        if (!unmapped.isEmpty()) {
            if (mode == MappingMode.STRICT) {
                throw new MediaMappingException("No compatible source field for " + shape + ": " + unmapped);
            }
            log.debug("Skipping unmapped fields for {}: {}", shape, unmapped);
        }
        log.debug("Built mapping plan for {} with {} actions", shape, actions.size());
        return new MappingPlan(shape, List.copyOf(actions), List.copyOf(unmapped));
    }

    DynamicPlan buildDynamic(Class<?> destinationType) {
        requireDestination(destinationType);
        List<Sink> sinks = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (Field field : fields(destinationType, true).values()) {
            SinkKind kind = sinkKind(field);
            if (kind == null) {
                skipped.add(field.getName());
                continue;
            }
            RichText richText = field.getAnnotation(RichText.class);
            String variant = richText == null ? null : blankToNull(richText.variant());
            sinks.add(new Sink(externalName(field), field, kind, variant));
        }
        if (!skipped.isEmpty()) {
            log.debug("Fields of {} not populated from schema-less payloads: {}", destinationType.getSimpleName(), skipped);
        }
        return new DynamicPlan(destinationType, List.copyOf(sinks));
    }

    static boolean isNested(Class<?> type) {
        return type != null
                && !BeanUtils.isSimpleValueType(type)
                && !type.isArray()
                && !type.isInterface()
                && !type.isRecord()
                && !Modifier.isAbstract(type.getModifiers())
                && !Collection.class.isAssignableFrom(type)
                && !Map.class.isAssignableFrom(type)
                && !type.getName().startsWith("java.")
                && hasNoArgConstructor(type);
    }

    static boolean isSchemaLess(Class<?> type) {
        return type == null
                || type == Object.class
                || Map.class.isAssignableFrom(type)
                || JsonNode.class.isAssignableFrom(type);
    }

    private FieldAction derive(Field destination, Map<String, Field> sources) {
        MediaUrl mediaUrl = destination.getAnnotation(MediaUrl.class);
        if (mediaUrl != null) {
            requireAssignable(destination, String.class, "@MediaUrl");
            Field idSource = sources.get(sourceName(mediaUrl.source(), destination.getName(), URL_SUFFIXES));
            return idSource == null ? null : new FieldAction.LiftIdToUrl(idSource, destination, blankToNull(mediaUrl.variant()));
        }

        MediaUrls mediaUrls = destination.getAnnotation(MediaUrls.class);
        if (mediaUrls != null) {
            requireAssignable(destination, ArrayList.class, "@MediaUrls");
            Field idsSource = sources.get(sourceName(mediaUrls.source(), destination.getName(), URLS_SUFFIXES));
            return idsSource == null ? null : new FieldAction.LiftIdsToUrls(idsSource, destination, blankToNull(mediaUrls.variant()));
        }

        Field source = sources.get(destination.getName());
        if (source == null) {
            return null;
        }

        RichText richText = destination.getAnnotation(RichText.class);
        if (richText != null) {
            requireAssignable(destination, String.class, "@RichText");
            return new FieldAction.RewriteRichText(source, destination, blankToNull(richText.variant()));
        }

        if (destination.isAnnotationPresent(MediaId.class)) {
            return copy(source, destination);
        }

        ResolvableType destinationType = ResolvableType.forField(destination);
        ResolvableType sourceType = ResolvableType.forField(source);
        Class<?> destinationClass = destination.getType();

        if (Collection.class.isAssignableFrom(destinationClass)) {
            Class<?> element = destinationType.asCollection().resolveGeneric(0);
            if (isNested(element)) {
                ElementShape shape = collectionElementShape(sourceType, element);
                return shape == null ? null : new FieldAction.RecurseList(source, destination, shape);
            }
            return copy(source, destination);
        }

        if (Map.class.isAssignableFrom(destinationClass)) {
            Class<?> value = destinationType.asMap().resolveGeneric(1);
            if (isNested(value)) {
                ElementShape shape = mapValueShape(sourceType, destinationType, value);
                return shape == null ? null : new FieldAction.RecurseMap(source, destination, shape);
            }
            return copy(source, destination);
        }

        if (isNested(destinationClass)) {
            ElementShape shape = elementShape(source.getType(), destinationClass);
            if (shape != null) {
                return new FieldAction.RecurseRecord(source, destination, shape);
            }
        }

        return copy(source, destination);
    }

    private ElementShape collectionElementShape(ResolvableType sourceType, Class<?> destinationElement) {
        Class<?> sourceClass = sourceType.resolve(Object.class);
        if (JsonNode.class.isAssignableFrom(sourceClass)) {
            return new ElementShape(JsonNode.class, destinationElement, true);
        }
        Class<?> sourceElement;
        if (Collection.class.isAssignableFrom(sourceClass)) {
            sourceElement = sourceType.asCollection().resolveGeneric(0);
        } else if (sourceClass.isArray()) {
            sourceElement = sourceType.getComponentType().resolve();
        } else {
            return null;
        }
        return elementShape(sourceElement, destinationElement);
    }

    private ElementShape mapValueShape(ResolvableType sourceType, ResolvableType destinationType, Class<?> destinationValue) {
        Class<?> sourceClass = sourceType.resolve(Object.class);
        Class<?> destinationKey = destinationType.asMap().resolveGeneric(0);
        if (JsonNode.class.isAssignableFrom(sourceClass)) {
            if (destinationKey != null && !destinationKey.isAssignableFrom(String.class)) {
                return null;
            }
            return new ElementShape(JsonNode.class, destinationValue, true);
        }
        if (!Map.class.isAssignableFrom(sourceClass)) {
            return null;
        }
        Class<?> sourceKey = sourceType.asMap().resolveGeneric(0);
        if (destinationKey != null && sourceKey != null && !ClassUtils.isAssignable(destinationKey, sourceKey)) {
            return null;
        }
        return elementShape(sourceType.asMap().resolveGeneric(1), destinationValue);
    }

    private ElementShape elementShape(Class<?> source, Class<?> destination) {
        if (isSchemaLess(source)) {
            return new ElementShape(source == null ? Object.class : source, destination, true);
        }
        if (isRecursableSource(source)) {
            return new ElementShape(source, destination, false);
        }
        return null;
    }

    private FieldAction copy(Field source, Field destination) {
        CopyMode copyMode = copyMode(ResolvableType.forField(source), ResolvableType.forField(destination));
        return copyMode == null ? null : new FieldAction.CopyVerbatim(source, destination, copyMode);
    }

    private CopyMode copyMode(ResolvableType source, ResolvableType destination) {
        Class<?> sourceClass = source.resolve(Object.class);
        Class<?> destinationClass = destination.resolve(Object.class);

        if (Collection.class.isAssignableFrom(destinationClass) && Collection.class.isAssignableFrom(sourceClass)) {
            Class<?> destinationElement = destination.asCollection().resolveGeneric(0);
            Class<?> sourceElement = source.asCollection().resolveGeneric(0);
            return compatible(destinationElement, sourceElement) ? CopyMode.COLLECTION : null;
        }
        if (Map.class.isAssignableFrom(destinationClass) && Map.class.isAssignableFrom(sourceClass)) {
            ResolvableType destinationMap = destination.asMap();
            ResolvableType sourceMap = source.asMap();
            boolean keys = compatible(destinationMap.resolveGeneric(0), sourceMap.resolveGeneric(0));
            boolean values = compatible(destinationMap.resolveGeneric(1), sourceMap.resolveGeneric(1));
            return keys && values ? CopyMode.MAP : null;
        }
        if (destination.isAssignableFrom(source)
                || (!destination.hasGenerics() && ClassUtils.isAssignable(destinationClass, sourceClass))) {
            return CopyMode.ASSIGN;
        }
        Set<Class<?>> widening = WIDENING.get(ClassUtils.resolvePrimitiveIfNecessary(sourceClass));
        if (widening != null && widening.contains(ClassUtils.resolvePrimitiveIfNecessary(destinationClass))) {
            return CopyMode.WIDEN;
        }
        return null;
    }

    private static boolean compatible(Class<?> destination, Class<?> source) {
        return destination == null || (source != null && ClassUtils.isAssignable(destination, source));
    }

    static boolean isRecursableSource(Class<?> type) {
        return type != null
                && !BeanUtils.isSimpleValueType(type)
                && !type.isArray()
                && !Collection.class.isAssignableFrom(type)
                && !type.getName().startsWith("java.");
    }

    private static SinkKind sinkKind(Field field) {
        Class<?> type = ClassUtils.resolvePrimitiveIfNecessary(field.getType());
        if (type == String.class) {
            if (field.isAnnotationPresent(RichText.class)) {
                return SinkKind.RICH_TEXT;
            }
            if (field.isAnnotationPresent(MediaId.class)) {
                return SinkKind.MEDIA_ID;
            }
            return SinkKind.STRING;
        }
        if (type == Integer.class) {
            return SinkKind.INTEGER;
        }
        if (type == Long.class) {
            return SinkKind.LONG;
        }
        if (type == Double.class) {
            return SinkKind.DOUBLE;
        }
        if (type == Float.class) {
            return SinkKind.FLOAT;
        }
        if (type == Boolean.class) {
            return SinkKind.BOOLEAN;
        }
        return null;
    }

    private static String externalName(Field field) {
        JsonProperty property = field.getAnnotation(JsonProperty.class);
        if (property != null && !property.value().isEmpty()) {
            return property.value();
        }
        return field.getName();
    }

    private static String sourceName(String declared, String destinationName, List<String> suffixes) {
        if (declared != null && !declared.isBlank()) {
            return declared;
        }
        for (String suffix : suffixes) {
            if (destinationName.endsWith(suffix) && destinationName.length() > suffix.length()) {
                return destinationName.substring(0, destinationName.length() - suffix.length());
            }
        }
        return destinationName;
    }

    private static void requireAssignable(Field destination, Class<?> valueType, String annotation) {
        if (!destination.getType().isAssignableFrom(valueType)) {
            throw new MediaMappingException(annotation + " field " + destination.getDeclaringClass().getSimpleName()
                    + "." + destination.getName() + " must accept " + valueType.getSimpleName());
        }
    }

    static void requireDestination(Class<?> type) {
        if (type.isRecord() || type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            throw new MediaMappingException("Destination type " + type.getName() + " must be a concrete mutable class");
        }
        if (!hasNoArgConstructor(type)) {
            throw new MediaMappingException("Destination type " + type.getName() + " needs a no-arg constructor");
        }
    }

    private static boolean hasNoArgConstructor(Class<?> type) {
        for (Constructor<?> constructor : type.getDeclaredConstructors()) {
            if (constructor.getParameterCount() == 0) {
                return true;
            }
        }
        return false;
    }

    private static Map<String, Field> fields(Class<?> type, boolean writable) {
        Map<String, Field> fields = new LinkedHashMap<>();
        ReflectionUtils.doWithFields(type, field -> {
            ReflectionUtils.makeAccessible(field);
            fields.putIfAbsent(field.getName(), field);
        }, field -> !Modifier.isStatic(field.getModifiers())
                && !field.isSynthetic()
                && !(writable && Modifier.isFinal(field.getModifiers())));
        return fields;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
