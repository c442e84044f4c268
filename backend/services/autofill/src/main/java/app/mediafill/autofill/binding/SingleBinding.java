package app.mediafill.autofill.binding;

import app.mediafill.autofill.resolve.ResourceInfo;

import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

public record SingleBinding<T>(
        Supplier<String> id,
        Consumer<? super T> target,
        Function<ResourceInfo, ? extends T> transform,
        String variant
) implements Binding {

    public SingleBinding<T> useVariant(String name) {
        return new SingleBinding<>(id, target, transform, name);
    }
}
