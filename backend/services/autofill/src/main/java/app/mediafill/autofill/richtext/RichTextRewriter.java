package app.mediafill.autofill.richtext;

import app.mediafill.autofill.resolve.ResourceInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds identifier markers in markup and points the adjacent URL attribute at the resolved URL.
 * <p>
 * The default marker is {@code data-href="<id>" src="<url>"}. A match whose identifier is not
 * resolved is left exactly as it was, as is all text outside the matches, so rewriting an
 * already rewritten text with the same resources is a no-op.
 */
public final class RichTextRewriter {

    public static final String DEFAULT_MARKER_ATTRIBUTE = "data-href";
    public static final String DEFAULT_URL_ATTRIBUTE = "src";

    private static final String ID_CHARSET = "[A-Za-z0-9_-]+";
    private static final RichTextRewriter DEFAULT = forAttributes(DEFAULT_MARKER_ATTRIBUTE, DEFAULT_URL_ATTRIBUTE);

    private final Pattern pattern;
    private final MarkerRenderer renderer;

    private RichTextRewriter(Pattern pattern, MarkerRenderer renderer) {
        this.pattern = pattern;
        this.renderer = renderer;
    }

    public static RichTextRewriter defaults() {
        return DEFAULT;
    }

    public static RichTextRewriter forAttributes(String markerAttribute, String urlAttribute) {
        if (markerAttribute == null || markerAttribute.isBlank() || urlAttribute == null || urlAttribute.isBlank()) {
            throw new IllegalArgumentException("Marker and url attribute names are required");
        }
        Pattern pattern = Pattern.compile(Pattern.quote(markerAttribute) + "=\"(" + ID_CHARSET + ")\" "
                + Pattern.quote(urlAttribute) + "=\"[^\"]*\"");
        return new RichTextRewriter(pattern, attributeRenderer(markerAttribute, urlAttribute));
    }

    /**
     * Uses a custom marker pattern. Resolved matches are re-emitted in the default attribute form.
     */
    public static RichTextRewriter withPattern(Pattern pattern) {
        return withPattern(pattern, attributeRenderer(DEFAULT_MARKER_ATTRIBUTE, DEFAULT_URL_ATTRIBUTE));
    }

    public static RichTextRewriter withPattern(Pattern pattern, MarkerRenderer renderer) {
        if (pattern == null || renderer == null) {
            throw new IllegalArgumentException("Pattern and renderer are required");
        }
        int groups = pattern.matcher("").groupCount();
        if (groups != 1) {
            throw new IllegalArgumentException("Marker pattern must have exactly one capture group for the id, got "
                    + groups + ": " + pattern.pattern());
        }
        return new RichTextRewriter(pattern, renderer);
    }

    public Pattern pattern() {
        return pattern;
    }

    public List<String> extractIds(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<String> ids = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            String id = matcher.group(1);
            if (id != null && !id.isEmpty()) {
                ids.add(id);
            }
        }
        return ids;
    }

    public String rewrite(String text, Map<String, ResourceInfo> resources) {
        return rewrite(text, resources, null);
    }

    /**
     * @param variant variant whose URL should be used; the primary URL is used when it is null
     *                or missing for a resource
     */
    public String rewrite(String text, Map<String, ResourceInfo> resources, String variant) {
        if (text == null || text.isEmpty() || resources == null || resources.isEmpty()) {
            return text;
        }
        Matcher matcher = pattern.matcher(text);
        StringBuilder buffer = new StringBuilder(text.length());
        while (matcher.find()) {
            String replacement = renderMatch(matcher, resources, variant);
            matcher.appendReplacement(buffer, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(buffer);
        return buffer.toString();
    }

    private String renderMatch(Matcher matcher, Map<String, ResourceInfo> resources, String variant) {
        String id = matcher.group(1);
        if (id == null || id.isEmpty()) {
            return matcher.group();
        }
        ResourceInfo info = resources.get(id);
        if (info == null || !info.success()) {
            return matcher.group();
        }
        String url = variant == null ? info.url() : info.variant(variant);
        if (url == null) {
            return matcher.group();
        }
        return renderer.render(id, url);
    }

    private static MarkerRenderer attributeRenderer(String markerAttribute, String urlAttribute) {
        return (id, url) -> markerAttribute + "=\"" + id + "\" " + urlAttribute + "=\"" + url + "\"";
    }
}
