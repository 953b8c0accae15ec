package eu.virtualparadox.notedraft.ingest.cleaner;

import org.springframework.stereotype.Component;

@Component
public class TextCleaner {

    /**
     * Cleans extracted text by removing control characters, zero-width spaces
     * and soft hyphens while keeping line structure, which the classifier and
     * date extractor depend on.
     *
     * @param input raw text, may be {@code null}
     * @return cleaned text, never {@code null}
     */
    public String cleanText(final String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }
        return input
                // CRLF / CR -> LF
                .replaceAll("\\r\\n?", "\n")
                // zero-width and BOM -> remove
                .replaceAll("[\\u200B\\u200C\\u200D\\uFEFF]", "")
                // non-breaking space -> SPACE
                .replace("\u00A0", " ")
                // soft hyphen -> remove
                .replace("\u00AD", "")
                // other format chars -> SPACE
                .replaceAll("\\p{Cf}", " ")
                // control chars except tab and newline -> remove
                .replaceAll("[\\p{Cc}&&[^\\n\\t]]", "")
                // trailing blanks on each line
                .replaceAll("[ \\t]+\\n", "\n")
                // more than one empty line -> one
                .replaceAll("\\n{3,}", "\n\n")
                .trim();
    }
}
