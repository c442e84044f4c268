package app.mediafill.autofill.binding;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class IdentifierCollector {

    private final Set<String> ids = new LinkedHashSet<>();

    public void add(String id) {
        if (id != null && !id.isEmpty()) {
            ids.add(id);
        }
    }

    public void addAll(Collection<String> values) {
        if (values == null) {
            return;
        }
        for (String id : values) {
            add(id);
        }
    }

    public boolean isEmpty() {
        return ids.isEmpty();
    }

    public int size() {
        return ids.size();
    }

    public List<String> toList() {
        return new ArrayList<>(ids);
    }
}
