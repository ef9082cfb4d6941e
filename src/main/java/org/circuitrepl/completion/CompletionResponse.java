package org.circuitrepl.completion;

import java.util.List;

public record CompletionResponse(String id, List<CompletionItem> items, String error) {

    public static CompletionResponse of(final String id, final List<CompletionItem> items) {
        return new CompletionResponse(id, List.copyOf(items), null);
    }

    public static CompletionResponse failed(final String id, final String error) {
        return new CompletionResponse(id, List.of(), error);
    }
}
