package app.mediafill.autofill.mapping;

import java.util.concurrent.ConcurrentHashMap;

public class MappingPlanRegistry {
    private final ConcurrentHashMap<ShapePair, MappingPlan> plans = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Class<?>, DynamicPlan> dynamicPlans = new ConcurrentHashMap<>();
    private final MappingPlanBuilder builder;
    private final MappingMode mode;

    public MappingPlanRegistry() {
        this(MappingMode.LENIENT);
    }

    public MappingPlanRegistry(MappingMode mode) {
        this.mode = mode == null ? MappingMode.LENIENT : mode;
        this.builder = new MappingPlanBuilder(this.mode);
    }

    public MappingPlan planFor(Class<?> source, Class<?> destination) {
        if (source == null || destination == null) {
            throw new IllegalArgumentException("Source and destination types are required");
        }
        ShapePair shape = new ShapePair(source, destination);
        MappingPlan cached = plans.get(shape);
        if (cached != null) {
            return cached;
        }
        // concurrent builders may both derive a plan; the first one stored wins
        MappingPlan built = builder.build(shape);
        MappingPlan existing = plans.putIfAbsent(shape, built);
        return existing == null ? built : existing;
    }

    public DynamicPlan dynamicPlanFor(Class<?> destination) {
        if (destination == null) {
            throw new IllegalArgumentException("Destination type is required");
        }
        DynamicPlan cached = dynamicPlans.get(destination);
        if (cached != null) {
            return cached;
        }
        DynamicPlan built = builder.buildDynamic(destination);
        DynamicPlan existing = dynamicPlans.putIfAbsent(destination, built);
        return existing == null ? built : existing;
    }

    public MappingMode mode() {
        return mode;
    }

    public int size() {
        return plans.size();
    }
}
