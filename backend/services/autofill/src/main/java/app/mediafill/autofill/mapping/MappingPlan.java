package app.mediafill.autofill.mapping;

import java.util.List;

public record MappingPlan(ShapePair shape, List<FieldAction> actions, List<String> unmappedFields) {
}
