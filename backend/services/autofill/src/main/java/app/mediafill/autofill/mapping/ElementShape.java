package app.mediafill.autofill.mapping;

public record ElementShape(Class<?> source, Class<?> destination, boolean schemaLess) {
}
