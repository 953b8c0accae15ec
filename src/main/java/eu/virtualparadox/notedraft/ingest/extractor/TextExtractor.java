package eu.virtualparadox.notedraft.ingest.extractor;

import java.nio.file.Path;

/**
 * Reads raw text out of an uploaded file. Implementations never decide what the
 * text means; empty output is reported through warnings rather than exceptions.
 */
public interface TextExtractor {

    ExtractionResult extract(final Path path);

}
