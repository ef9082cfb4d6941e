package org.circuitrepl.completion;

/**
 * A completion query for a position in a document.
 *
 * @param id        Correlation id.
 * @param document  Full text being edited.
 * @param line      Zero-based line of the cursor.
 * @param character Zero-based column of the cursor.
 */
public record CompletionRequest(String id, String document, int line, int character) {
}
