package app.mediafill.autofill.binding;

import java.util.List;

@FunctionalInterface
public interface BindingSource<T> {

    List<Binding> bindings(T item);
}
