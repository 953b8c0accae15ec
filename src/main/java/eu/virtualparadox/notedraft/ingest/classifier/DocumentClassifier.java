package eu.virtualparadox.notedraft.ingest.classifier;

import eu.virtualparadox.notedraft.ingest.model.EDocumentType;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Rule-based document type detection. Rules are evaluated in declaration
 * order against the file name followed by the head of the text; the first
 * type with a matching pattern wins.
 */
@Component
public class DocumentClassifier {

    static final int HEAD_CHARS = 3000;

    private record Rule(EDocumentType type, List<Pattern> patterns) {

        boolean matches(final String haystack) {
            return patterns.stream().anyMatch(p -> p.matcher(haystack).find());
        }
    }

    private static final List<Rule> RULES = List.of(
            rule(EDocumentType.DISCHARGE_SUMMARY,
                    "discharge\\s+summar", "discharge\\s+instructions", "hospital\\s+discharge",
                    "inpatient\\s+discharge", "date\\s+of\\s+discharge", "hospital\\s+course", "disposition"),
            rule(EDocumentType.PSYCH_EVAL,
                    "psychiatric\\s+evaluation", "psychological\\s+evaluation", "mental\\s+status\\s+exam",
                    "psych\\s+eval", "comprehensive\\s+psychiatric", "diagnostic\\s+evaluation",
                    "psychiatric\\s+consult"),
            rule(EDocumentType.PROGRESS_NOTE,
                    "progress\\s+note", "clinical\\s+note", "office\\s+visit", "follow[- ]?up\\s+note",
                    "outpatient\\s+note", "daily\\s+note", "interval\\s+history"),
            rule(EDocumentType.BIOPSYCHOSOCIAL,
                    "biopsychosocial", "bio[- ]?psycho[- ]?social", "psychosocial\\s+assessment",
                    "comprehensive\\s+assessment", "social\\s+work\\s+assessment"),
            rule(EDocumentType.INTAKE,
                    "intake\\s+assessment", "initial\\s+assessment", "intake\\s+evaluation",
                    "new\\s+patient\\s+intake", "history\\s+and\\s+physical", "admission\\s+note")
    );

    private static Rule rule(final EDocumentType type, final String... regexes) {
        final List<Pattern> patterns = Arrays.stream(regexes)
                .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE))
                .toList();
        return new Rule(type, patterns);
    }

    /**
     * @param fileName original file name, may be {@code null}
     * @param text     document text, may be {@code null}
     * @return detected type, {@link EDocumentType#OTHER} when nothing matches
     */
    public EDocumentType classify(final String fileName, final String text) {
        final String head = text == null ? "" : text.substring(0, Math.min(HEAD_CHARS, text.length()));
        final String haystack = (fileName == null ? "" : fileName) + "\n" + head;
        for (Rule rule : RULES) {
            if (rule.matches(haystack)) {
                return rule.type();
            }
        }
        return EDocumentType.OTHER;
    }
}
