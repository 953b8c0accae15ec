package eu.virtualparadox.notedraft.ingest.extractor;

import java.util.List;

public record ExtractionResult(String text, List<String> warnings) {

    public ExtractionResult {
        text = text == null ? "" : text;
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ExtractionResult of(final String text) {
        return new ExtractionResult(text, List.of());
    }
}
