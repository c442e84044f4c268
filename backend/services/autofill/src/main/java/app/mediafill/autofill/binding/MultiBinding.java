package app.mediafill.autofill.binding;

import app.mediafill.autofill.resolve.ResourceInfo;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

public record MultiBinding<T>(
        Supplier<? extends List<String>> ids,
        Consumer<? super List<T>> targets,
        Function<ResourceInfo, ? extends T> transform,
        String variant
) implements Binding {

    public MultiBinding<T> useVariant(String name) {
        return new MultiBinding<>(ids, targets, transform, name);
    }
}
