package dev.pooleval.labeling;

import dev.pooleval.pool.PooledDocument;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * The text a judge sees for one pooled document.
 *
 * @param docId the document identifier
 * @param title the document title, if the table carries one
 * @param body  the document body, if the table carries one
 */
public record DocumentContent(String docId, @Nullable String title, @Nullable String body) {

    /**
     * Extract judge input from the pass-through content columns of a pooled document.
     *
     * <p>The body is the first non-blank column among {@code bodyFields}, in order.
     */
    public static DocumentContent from(PooledDocument document, LabelingProperties properties) {
        return from(document, properties.getBodyFields(), properties.getTitleField());
    }

    static DocumentContent from(PooledDocument document, List<String> bodyFields, String titleField) {
        Map<String, String> fields = document.contentFields();
        String body = null;
        for (String field : bodyFields) {
            String value = fields.get(field);
            if (value != null && !value.isBlank()) {
                body = value;
                break;
            }
        }
        String title = fields.get(titleField);
        return new DocumentContent(document.docId(), blankToNull(title), body);
    }

    private static @Nullable String blankToNull(@Nullable String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
