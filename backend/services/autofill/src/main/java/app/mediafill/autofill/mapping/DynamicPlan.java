package app.mediafill.autofill.mapping;

import java.lang.reflect.Field;
import java.util.List;

public record DynamicPlan(Class<?> destination, List<Sink> sinks) {

    public record Sink(String name, Field field, SinkKind kind, String variant) {
    }

    public enum SinkKind {
        STRING,
        RICH_TEXT,
        MEDIA_ID,
        INTEGER,
        LONG,
        DOUBLE,
        FLOAT,
        BOOLEAN
    }
}
