package app.mediafill.autofill.binding;

import app.mediafill.autofill.resolve.ResourceInfo;
import app.mediafill.autofill.richtext.RichTextRewriter;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Declares where identifiers live and where their resolved values go.
 * <p>
 * Bindings only hold accessors into caller-owned objects and are meant to live for a single
 * {@link MediaFiller} call:
 * <pre>{@code
 * filler.fill(
 *         Binding.single(product::getCoverId, product::setCoverUrl),
 *         Binding.multi(product::getGalleryIds, product::setGalleryUrls),
 *         Binding.richText(product::getDetail, product::setDetailHtml).useVariant("thumbnail_800x800")
 * );
 * }</pre>
 */
public sealed interface Binding permits SingleBinding, MultiBinding, RichTextBinding {

    static SingleBinding<String> single(Supplier<String> id, Consumer<? super String> url) {
        return singleTo(id, url, ResourceInfo::url);
    }

    static <T> SingleBinding<T> singleTo(Supplier<String> id,
                                         Consumer<? super T> target,
                                         Function<ResourceInfo, ? extends T> transform) {
        return new SingleBinding<>(id, target, transform, null);
    }

    static MultiBinding<String> multi(Supplier<? extends List<String>> ids, Consumer<? super List<String>> urls) {
        return multiTo(ids, urls, ResourceInfo::url);
    }

    static <T> MultiBinding<T> multiTo(Supplier<? extends List<String>> ids,
                                       Consumer<? super List<T>> targets,
                                       Function<ResourceInfo, ? extends T> transform) {
        return new MultiBinding<>(ids, targets, transform, null);
    }

    static RichTextBinding richText(Supplier<String> raw, Consumer<? super String> rendered) {
        return new RichTextBinding(raw, rendered, RichTextRewriter.defaults(), null);
    }
}
