package eu.virtualparadox.notedraft.ingest.extractor;

import eu.virtualparadox.notedraft.ingest.model.EDocumentKind;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Routes a file to the extractor matching its {@link EDocumentKind}.
 */
@Service
@Primary
@RequiredArgsConstructor
public class CompositeTextExtractor implements TextExtractor {

    private final PlainTextExtractor plainTextExtractor;
    private final PdfTextExtractor pdfTextExtractor;

    @Override
    public ExtractionResult extract(final Path path) {
        return switch (EDocumentKind.fromPath(path)) {
            case PDF -> pdfTextExtractor.extract(path);
            case WORD -> new ExtractionResult("", List.of("Word documents are not supported; convert to PDF or text."));
            default -> plainTextExtractor.extract(path);
        };
    }
}
