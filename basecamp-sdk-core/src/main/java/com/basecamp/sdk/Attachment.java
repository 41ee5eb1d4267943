package com.basecamp.sdk;

/**
 * An uploaded file, referenced from rich text by its signed global ID.
 *
 * @param attachableSgid ID to embed in {@code <bc-attachment>} tags
 */
public record Attachment(String attachableSgid) {
}
