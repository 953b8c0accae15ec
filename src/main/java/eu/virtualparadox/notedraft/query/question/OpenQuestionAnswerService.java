package eu.virtualparadox.notedraft.query.question;

import com.fasterxml.jackson.databind.JsonNode;
import eu.virtualparadox.notedraft.application.config.ApplicationConfig;
import eu.virtualparadox.notedraft.ingest.model.Chunk;
import eu.virtualparadox.notedraft.rag.completion.CompletionRequest;
import eu.virtualparadox.notedraft.rag.completion.CompletionService;
import eu.virtualparadox.notedraft.rag.generate.Citation;
import eu.virtualparadox.notedraft.rag.generate.CitationMapper;
import eu.virtualparadox.notedraft.rag.generate.ModelPayloadParser;
import eu.virtualparadox.notedraft.rag.generate.PromptBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Answers open questions from chart evidence. Only answers the evidence supports are
 * returned: "Insufficient evidence" replies and answers without a resolvable citation are dropped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OpenQuestionAnswerService {

    static final String ANSWERS_SCHEMA =
            "{\"answers\": [{\"id\": string, \"text\": string, \"citations\": [{\"chunkId\": string, \"excerpt\": string}]}]}";
    private static final String INSUFFICIENT = "insufficient evidence";

    private static final String INSTRUCTIONS = String.join("\n",
            "You answer clinical questions from chart evidence.",
            "",
            "Rules:",
            "- Use only the provided evidence.",
            "- Cite each answer with the chunkId it is based on.",
            "- If the evidence does not answer a question, reply \"Insufficient evidence\".",
            "- Direct clinical language, no hedging.",
            "",
            "Output: valid JSON with key answers (array of {id, text, citations}).");

    private final CompletionService completionService;
    private final PromptBuilder promptBuilder;
    private final ModelPayloadParser payloadParser;
    private final CitationMapper citationMapper;
    private final ApplicationConfig config;

    public List<QuestionAnswer> answer(final List<OpenQuestion> questions, final List<Chunk> evidence) {
        if (questions.isEmpty()) {
            return List.of();
        }
        final StringBuilder list = new StringBuilder();
        for (OpenQuestion question : questions) {
            list.append("- (").append(question.getId()).append(") ").append(question.getText()).append('\n');
        }
        final CompletionRequest request = new CompletionRequest(
                config.getGeneration().getModel(),
                INSTRUCTIONS,
                "Questions:\n" + list + "\nEvidence:\n" + promptBuilder.evidenceBlock(evidence) + "\n\nReturn JSON now.",
                ANSWERS_SCHEMA,
                config.getGeneration().getAnswerMaxTokens(),
                false);

        final JsonNode root = payloadParser.readObject(completionService.complete(request));
        final List<QuestionAnswer> answers = new ArrayList<>();
        if (root == null || !root.path("answers").isArray()) {
            log.warn("Answer payload for {} questions had no answers array", questions.size());
            return answers;
        }
        for (JsonNode item : root.get("answers")) {
            final String id = item.path("id").asText("");
            final String text = item.path("text").asText("").trim();
            if (id.isEmpty() || text.isEmpty() || text.toLowerCase(Locale.ROOT).startsWith(INSUFFICIENT)) {
                continue;
            }
            final List<Citation> citations = citationMapper.map(payloadParser.citationItems(item.get("citations")), evidence);
            if (citations.isEmpty()) {
                log.debug("Dropping uncited answer for question {}", id);
                continue;
            }
            answers.add(new QuestionAnswer(id, text, citations));
        }
        return answers;
    }
}
