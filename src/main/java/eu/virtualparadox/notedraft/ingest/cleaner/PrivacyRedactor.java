package eu.virtualparadox.notedraft.ingest.cleaner;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * One-way scrubbing of direct identifiers. Applied once at ingestion; the
 * original values are not kept anywhere.
 */
@Component
public class PrivacyRedactor {

    private record Rule(Pattern pattern, String replacement) {
    }

    // order matters: SSN before phone, labelled values before free-form ones
    private static final List<Rule> RULES = List.of(
            new Rule(Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b"), "[REDACTED SSN]"),
            new Rule(Pattern.compile("\\b(?:MRN|Medical Record Number)\\s*[:#]?\\s*\\w+\\b", Pattern.CASE_INSENSITIVE),
                    "MRN: [REDACTED]"),
            new Rule(Pattern.compile("\\b(?:DOB|Date of Birth)\\s*[:#]?\\s*\\d{1,2}[/-]\\d{1,2}[/-]\\d{2,4}\\b",
                    Pattern.CASE_INSENSITIVE), "DOB: [REDACTED]"),
            new Rule(Pattern.compile("\\b\\d{3}[-.)\\s]?\\d{3}[-.\\s]?\\d{4}\\b"), "[REDACTED PHONE]"),
            new Rule(Pattern.compile("\\b[A-Z0-9._%+-]+@[A-Z0-9.-]+\\.[A-Z]{2,}\\b", Pattern.CASE_INSENSITIVE),
                    "[REDACTED EMAIL]"),
            new Rule(Pattern.compile("\\b(Name|Patient Name)\\s*:\\s*[A-Z][a-z]+(?:[ \\t]+[A-Z][a-z]+){0,3}\\b"),
                    "$1: [REDACTED]")
    );

    public String redact(final String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }
        String working = input;
        for (Rule rule : RULES) {
            working = rule.pattern().matcher(working).replaceAll(rule.replacement());
        }
        return working;
    }
}
