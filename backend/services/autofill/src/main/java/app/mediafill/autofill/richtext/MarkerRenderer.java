package app.mediafill.autofill.richtext;

@FunctionalInterface
public interface MarkerRenderer {

    String render(String id, String url);
}
