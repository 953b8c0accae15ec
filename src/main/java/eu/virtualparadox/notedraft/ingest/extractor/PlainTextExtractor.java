package eu.virtualparadox.notedraft.ingest.extractor;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

@Slf4j
@Component
public class PlainTextExtractor implements TextExtractor {

    @Override
    public ExtractionResult extract(final Path path) {
        try {
            return ExtractionResult.of(Files.readString(path, StandardCharsets.UTF_8));
        }
        catch (CharacterCodingException e) {
            log.debug("{} is not valid UTF-8, reading as ISO-8859-1", path);
            return readLatin1(path);
        }
        catch (IOException e) {
            throw new IllegalStateException("Failed to read text file " + path, e);
        }
    }

    private ExtractionResult readLatin1(final Path path) {
        try {
            return new ExtractionResult(Files.readString(path, StandardCharsets.ISO_8859_1),
                    List.of("File is not UTF-8 encoded; decoded as ISO-8859-1."));
        }
        catch (IOException e) {
            throw new IllegalStateException("Failed to read text file " + path, e);
        }
    }
}
