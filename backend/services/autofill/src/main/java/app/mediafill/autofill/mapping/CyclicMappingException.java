package app.mediafill.autofill.mapping;

public class CyclicMappingException extends MediaMappingException {

    public CyclicMappingException(String message) {
        super(message);
    }
}
