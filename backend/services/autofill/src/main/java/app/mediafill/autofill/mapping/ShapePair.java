package app.mediafill.autofill.mapping;

public record ShapePair(Class<?> source, Class<?> destination) {

    @Override
    public String toString() {
        return source.getSimpleName() + " -> " + destination.getSimpleName();
    }
}
