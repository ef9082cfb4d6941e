package org.circuitrepl.completion;

/**
 * One completion candidate.
 *
 * @param label      Text shown and matched against the typed prefix.
 * @param kind       {@code module}, {@code function}, {@code class}, {@code property} or {@code pin}.
 * @param detail     One-line description, may be empty.
 * @param insertText Text that replaces the trailing token.
 */
public record CompletionItem(String label, String kind, String detail, String insertText) {

    public CompletionItem {
        if (insertText == null) {
            insertText = label;
        }
        if (detail == null) {
            detail = "";
        }
    }

    public static CompletionItem of(final String label, final String kind, final String detail) {
        return new CompletionItem(label, kind, detail, label);
    }
}
