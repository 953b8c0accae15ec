package eu.virtualparadox.notedraft.ingest.extractor;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;

/**
 * PDF extractor backed by Apache PDFBox. Pages are stripped one at a time so
 * pages without a text layer (scans) can be reported individually.
 */
@Component
public class PdfTextExtractor implements TextExtractor {

    @Override
    public ExtractionResult extract(final Path path) {
        try (PDDocument pdf = PDDocument.load(path.toFile())) {
            final int pageCount = pdf.getNumberOfPages();
            final PDFTextStripper stripper = new PDFTextStripper();

            final StringBuilder text = new StringBuilder(pageCount * 2_000);
            final List<Integer> emptyPages = new ArrayList<>();

            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);

                final String pageText = Normalizer.normalize(stripper.getText(pdf), Normalizer.Form.NFC);
                if (pageText.isBlank()) {
                    emptyPages.add(page);
                    continue;
                }
                if (!text.isEmpty()) {
                    text.append('\n');
                }
                text.append(pageText);
            }

            final List<String> warnings = new ArrayList<>();
            if (!emptyPages.isEmpty()) {
                warnings.add("No extractable text on page(s) " + emptyPages + "; they may be scanned images.");
            }
            return new ExtractionResult(text.toString(), warnings);
        }
        catch (IOException e) {
            throw new IllegalStateException("Failed to extract text from PDF", e);
        }
    }
}
