package app.mediafill.autofill.config;

import app.mediafill.autofill.mapping.MappingMode;
import app.mediafill.autofill.mapping.MediaAutoFiller;
import app.mediafill.autofill.richtext.RichTextRewriter;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.autofill")
public record AutofillProps(
        MappingMode mappingMode,
        @Max(256) int maxDepth,
        @Pattern(regexp = "[A-Za-z][A-Za-z0-9_:-]*") String markerAttribute,
        @Pattern(regexp = "[A-Za-z][A-Za-z0-9_:-]*") String urlAttribute
) {
    public AutofillProps {
        if (mappingMode == null) {
            mappingMode = MappingMode.LENIENT;
        }
        if (maxDepth <= 0) {
            maxDepth = MediaAutoFiller.DEFAULT_MAX_DEPTH;
        }
        if (markerAttribute == null || markerAttribute.isBlank()) {
            markerAttribute = RichTextRewriter.DEFAULT_MARKER_ATTRIBUTE;
        }
        if (urlAttribute == null || urlAttribute.isBlank()) {
            urlAttribute = RichTextRewriter.DEFAULT_URL_ATTRIBUTE;
        }
    }
}
