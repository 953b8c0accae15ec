package eu.virtualparadox.notedraft.ingest.lifecycle;

import eu.virtualparadox.notedraft.application.config.ApplicationConfig;
import eu.virtualparadox.notedraft.ingest.chunker.Chunker;
import eu.virtualparadox.notedraft.ingest.chunker.EPrivacyMode;
import eu.virtualparadox.notedraft.ingest.classifier.DocumentClassifier;
import eu.virtualparadox.notedraft.ingest.classifier.EpisodeDateExtractor;
import eu.virtualparadox.notedraft.ingest.cleaner.PrivacyRedactor;
import eu.virtualparadox.notedraft.ingest.cleaner.TextCleaner;
import eu.virtualparadox.notedraft.ingest.extractor.ExtractionResult;
import eu.virtualparadox.notedraft.ingest.extractor.TextExtractor;
import eu.virtualparadox.notedraft.ingest.model.Chunk;
import eu.virtualparadox.notedraft.ingest.model.EDocumentKind;
import eu.virtualparadox.notedraft.ingest.model.EDocumentTag;
import eu.virtualparadox.notedraft.ingest.model.EDocumentType;
import eu.virtualparadox.notedraft.ingest.model.SourceDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Turns uploaded files into {@link SourceDocument}s.
 * <ol>
 *   <li>extract raw text through the {@link TextExtractor} collaborator,</li>
 *   <li>clean it and, in {@link EPrivacyMode#REDACT} mode, scrub identifiers,</li>
 *   <li>classify the document and find its episode date,</li>
 *   <li>chunk it with the window geometry of the configured privacy mode.</li>
 * </ol>
 * Callers must not ingest into a document set while a generation batch is reading it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentIngestionService {

    private final TextExtractor textExtractor;
    private final TextCleaner textCleaner;
    private final PrivacyRedactor privacyRedactor;
    private final Chunker chunker;
    private final DocumentClassifier classifier;
    private final EpisodeDateExtractor dateExtractor;
    private final ApplicationConfig config;

    public SourceDocument ingest(final Path path, final EDocumentTag tag) {
        final String name = path.getFileName() == null ? path.toString() : path.getFileName().toString();
        log.info("Ingesting {}", name);
        final ExtractionResult extracted = textExtractor.extract(path);
        return fromText(name, extracted.text(), EDocumentKind.fromPath(path), tag, extracted.warnings());
    }

    public SourceDocument fromText(final String name,
                                   final String text,
                                   final EDocumentKind kind,
                                   final EDocumentTag tag,
                                   final List<String> extractionWarnings) {
        final EPrivacyMode mode = config.getChunking().getPrivacyMode();
        String cleaned = textCleaner.cleanText(text);
        if (mode == EPrivacyMode.REDACT) {
            cleaned = privacyRedactor.redact(cleaned);
        }

        final List<String> warnings = new ArrayList<>(extractionWarnings == null ? List.of() : extractionWarnings);
        if (cleaned.isBlank()) {
            warnings.add("No text could be extracted from " + name + ".");
            log.warn("Document {} produced no text", name);
        }

        final String id = UUID.randomUUID().toString();
        final EDocumentType type = classifier.classify(name, cleaned);
        final String episodeDate = dateExtractor.extract(cleaned).orElse(null);
        final List<Chunk> chunks = chunker.chunk(cleaned, id, name, chunker.configFor(mode), type, episodeDate);

        log.debug("Document {} classified as {} ({}), {} chunks", name, type.label(), episodeDate, chunks.size());
        return new SourceDocument(id, name, kind, cleaned, type, episodeDate,
                EpisodeDateExtractor.toEpochDay(episodeDate), null,
                tag == null ? EDocumentTag.INITIAL : tag, Instant.now(), chunks, warnings);
    }

    /**
     * Applies a manual classification correction. Chunk ids are unchanged because
     * the text is unchanged; only the metadata carried by each chunk is replaced.
     *
     * @param type        corrected type, or {@code null} to keep the current one
     * @param episodeDate corrected ISO date, or {@code null} to keep the current one
     */
    public SourceDocument correct(final SourceDocument document,
                                  final EDocumentType type,
                                  final String episodeDate) {
        final EDocumentType newType = type == null ? document.documentType() : type;
        final String newDate = episodeDate == null ? document.episodeDate() : episodeDate;
        final EPrivacyMode mode = config.getChunking().getPrivacyMode();
        final List<Chunk> chunks = chunker.chunk(document.rawText(), document.id(), document.name(),
                chunker.configFor(mode), newType, newDate);
        log.info("Corrected {} to {} / {}", document.name(), newType.label(), newDate);
        return document.withChunks(newType, newDate, EpisodeDateExtractor.toEpochDay(newDate), chunks);
    }
}
