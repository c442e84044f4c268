package app.mediafill.autofill.mapping;

import java.lang.reflect.Field;

public sealed interface FieldAction {

    Field source();

    Field destination();

    record CopyVerbatim(Field source, Field destination, CopyMode mode) implements FieldAction {
    }

    record LiftIdToUrl(Field source, Field destination, String variant) implements FieldAction {
    }

    record LiftIdsToUrls(Field source, Field destination, String variant) implements FieldAction {
    }

    record RewriteRichText(Field source, Field destination, String variant) implements FieldAction {
    }

    record RecurseList(Field source, Field destination, ElementShape element) implements FieldAction {
    }

    record RecurseMap(Field source, Field destination, ElementShape element) implements FieldAction {
    }

    record RecurseRecord(Field source, Field destination, ElementShape element) implements FieldAction {
    }

    enum CopyMode {
        ASSIGN,
        WIDEN,
        COLLECTION,
        MAP
    }
}
