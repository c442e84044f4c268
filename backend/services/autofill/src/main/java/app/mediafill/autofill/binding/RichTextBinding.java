package app.mediafill.autofill.binding;

import app.mediafill.autofill.richtext.RichTextRewriter;

import java.util.function.Consumer;
import java.util.function.Supplier;

public record RichTextBinding(
        Supplier<String> raw,
        Consumer<? super String> rendered,
        RichTextRewriter rewriter,
        String variant
) implements Binding {

    public RichTextBinding {
        if (rewriter == null) {
            rewriter = RichTextRewriter.defaults();
        }
    }

    public RichTextBinding withRewriter(RichTextRewriter customRewriter) {
        if (customRewriter == null) {
            throw new IllegalArgumentException("Rewriter is required");
        }
        return new RichTextBinding(raw, rendered, customRewriter, variant);
    }

    public RichTextBinding useVariant(String name) {
        return new RichTextBinding(raw, rendered, rewriter, name);
    }
}
