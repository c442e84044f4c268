package app.mediafill.autofill.mapping;

public enum MappingMode {
    LENIENT,
    STRICT
}
