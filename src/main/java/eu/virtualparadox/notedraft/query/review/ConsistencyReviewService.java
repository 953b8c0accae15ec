package eu.virtualparadox.notedraft.query.review;

import com.fasterxml.jackson.databind.JsonNode;
import eu.virtualparadox.notedraft.application.config.ApplicationConfig;
import eu.virtualparadox.notedraft.rag.completion.CompletionRequest;
import eu.virtualparadox.notedraft.rag.completion.CompletionService;
import eu.virtualparadox.notedraft.rag.generate.ModelPayloadParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads all drafted sections together and proposes minimal fixes for contradictions,
 * duplicates and vague wording.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConsistencyReviewService {

    static final int MAX_BODY_CHARS = 9000;
    static final String CHANGES_SCHEMA =
            "{\"changes\": [{\"sectionId\": string, \"revisedText\": string, \"issue\": string}]}";

    private static final String INSTRUCTIONS = String.join("\n",
            "You review a drafted clinical summary before handoff.",
            "",
            "Look for:",
            "- contradictions between sections",
            "- repeated facts or duplicate open questions",
            "- inconsistent risk or safety details",
            "- vague or hedging language",
            "",
            "Rules:",
            "- Minimal changes only. Fix the issue, do not rewrite.",
            "- Keep each fact in the most appropriate section and remove duplicates.",
            "- Never add clinical facts.",
            "- Return the full revised section text, not a diff.",
            "- issue is a one-sentence reason for the change.",
            "- Return an empty array if nothing needs to change.",
            "",
            "Output: valid JSON with key changes (array of {sectionId, revisedText, issue}).");

    private final CompletionService completionService;
    private final ModelPayloadParser payloadParser;
    private final ApplicationConfig config;

    public List<ReviewChange> review(final List<ReviewedSection> sections) {
        if (sections.isEmpty()) {
            return List.of();
        }
        final CompletionRequest request = new CompletionRequest(
                config.getGeneration().getModel(),
                INSTRUCTIONS,
                "Sections:\n" + body(sections) + "\n\nReturn JSON now.",
                CHANGES_SCHEMA,
                config.getGeneration().getReviewMaxTokens(),
                false);

        final JsonNode root = payloadParser.readObject(completionService.complete(request));
        final List<ReviewChange> changes = new ArrayList<>();
        if (root == null || !root.path("changes").isArray()) {
            return changes;
        }
        final Set<String> known = sections.stream().map(ReviewedSection::id).collect(Collectors.toSet());
        for (JsonNode item : root.get("changes")) {
            final JsonNode sectionId = item.get("sectionId");
            final JsonNode revised = item.get("revisedText");
            if (sectionId == null || !sectionId.isTextual() || revised == null || !revised.isTextual()) {
                continue;
            }
            if (!known.contains(sectionId.asText())) {
                log.debug("Ignoring review change for unknown section {}", sectionId.asText());
                continue;
            }
            changes.add(new ReviewChange(sectionId.asText(), revised.asText(), issueOf(item)));
        }
        log.info("Consistency review proposed {} changes", changes.size());
        return changes;
    }

    static String body(final List<ReviewedSection> sections) {
        final String body = sections.stream()
                .map(s -> "## " + s.id() + " | " + s.title() + "\n"
                        + StringUtils.defaultIfBlank(StringUtils.trim(s.text()), "(empty)"))
                .collect(Collectors.joining("\n\n"));
        return body.length() > MAX_BODY_CHARS ? body.substring(0, MAX_BODY_CHARS) + "\n…" : body;
    }

    private static String issueOf(final JsonNode item) {
        for (String field : List.of("issue", "rationale")) {
            final JsonNode value = item.get(field);
            if (value != null && value.isTextual()) {
                return value.asText();
            }
        }
        return "Review suggestion";
    }
}
