package eu.virtualparadox.notedraft.rag.generate;

import eu.virtualparadox.notedraft.application.config.ApplicationConfig;
import eu.virtualparadox.notedraft.ingest.model.Chunk;
import eu.virtualparadox.notedraft.rag.completion.CompletionRequest;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the model requests used by the generator.
 */
@Component
@RequiredArgsConstructor
public class PromptBuilder {

    public static final String SECTION_SCHEMA =
            "{\"text\": string, \"citations\": [{\"chunkId\": string, \"excerpt\": string}]}";
    public static final String CITATIONS_SCHEMA =
            "{\"citations\": [{\"chunkId\": string, \"excerpt\": string}]}";

    private static final int MIN_ENTRY_CHARS = 200;
    private static final int MIN_BODY_CHARS = 80;

    private final ApplicationConfig config;

    /**
     * Serializes evidence as {@code [chunkId] (sourceName)} headers followed by the chunk
     * text. When the block would exceed the configured budget every entry gets an equal
     * share (at least {@value #MIN_ENTRY_CHARS} characters) and long bodies are cut.
     */
    public String evidenceBlock(final List<Chunk> evidence) {
        return evidenceBlock(evidence, config.getGeneration().getEvidenceMaxChars());
    }

    public String evidenceBlock(final List<Chunk> evidence, final int maxChars) {
        if (evidence == null || evidence.isEmpty()) {
            return "(no evidence available)";
        }
        final List<String> headers = new ArrayList<>();
        final List<String> bodies = new ArrayList<>();
        int total = 0;
        for (Chunk chunk : evidence) {
            final String header = "[" + chunk.id() + "] (" + chunk.sourceName() + ")\n";
            headers.add(header);
            bodies.add(chunk.text());
            total += header.length() + chunk.text().length() + 2;
        }

        final int perEntry = Math.max(MIN_ENTRY_CHARS, maxChars / evidence.size());
        final StringBuilder sb = new StringBuilder();
        for (int i = 0; i < headers.size(); i++) {
            String body = bodies.get(i);
            if (total > maxChars) {
                final int bodyBudget = Math.max(MIN_BODY_CHARS, perEntry - headers.get(i).length());
                if (body.length() > bodyBudget) {
                    body = body.substring(0, bodyBudget).trim() + "…";
                }
            }
            if (sb.length() > 0) {
                sb.append("\n\n");
            }
            sb.append(headers.get(i)).append(body);
        }
        return sb.toString();
    }

    public CompletionRequest sectionRequest(final SectionSpec section,
                                            final List<Chunk> evidence,
                                            final GenerationOptions options,
                                            final EPromptMode mode,
                                            final boolean stream) {
        final List<String> rules = new ArrayList<>(List.of(
                "You draft one section of a clinical note from chart evidence.",
                "",
                "Rules:",
                "- Use only facts present in the evidence. Never infer or invent.",
                "- Every factual statement needs a citation: list the supporting chunk ids in the citations array.",
                "- Keep chunk ids out of the prose.",
                "- Write in concise clinical language, without hedging or filler.",
                "- Use \"-\" for bullet points.",
                "- Do not repeat facts that the other sections already state."
        ));
        if (mode != EPromptMode.STANDARD) {
            rules.add("- Each sentence must be backed by at least one cited chunkId. Uncited claims are not allowed.");
        }
        if (mode == EPromptMode.CITATION_BOUND) {
            rules.add("- If a statement cannot be supported by a cited chunk, leave it out.");
        }
        if (options.openQuestions()) {
            rules.add("- If something important for this section is missing or contradictory, end with one");
            rules.add("  \"**Open questions:**\" block holding a single item: \"- Question? (Reason: why it matters)\".");
            rules.add("  Never ask about demographics, identifiers or document metadata.");
        }
        rules.add("");
        rules.add("Output: valid JSON with keys text and citations.");

        final List<String> input = new ArrayList<>();
        input.add("Section: " + section.title());
        if (StringUtils.isNotBlank(section.guidance())) {
            input.add("Guidance:\n" + section.guidance());
        }
        if (StringUtils.isNotBlank(options.extraGuidance())) {
            input.add(options.extraGuidance());
        }
        if (StringUtils.isNotBlank(options.context())) {
            input.add("Other sections (for de-duplication only):\n" + options.context());
        }
        input.add("Evidence:\n" + evidenceBlock(evidence));
        input.add("Return JSON with keys: text, citations.");

        return new CompletionRequest(
                config.getGeneration().getModel(),
                String.join("\n", rules),
                String.join("\n\n", input),
                SECTION_SCHEMA,
                config.getGeneration().getSectionMaxTokens(),
                stream);
    }

    /**
     * Asks the model to attach citations to text it already wrote, without rewriting it.
     */
    public CompletionRequest recoveryRequest(final String text, final List<Chunk> evidence) {
        final String instructions = String.join("\n",
                "You attach evidence to an existing clinical summary.",
                "",
                "Rules:",
                "- For each supported statement return the chunkId of the evidence backing it.",
                "- The excerpt is optional and at most 20 words.",
                "- Do not rewrite the summary.",
                "- Return an empty array if nothing can be cited.",
                "",
                "Output: valid JSON with key citations.");
        final String input = "Summary:\n" + text + "\n\nEvidence:\n" + evidenceBlock(evidence)
                + "\n\nReturn JSON with key: citations.";
        return new CompletionRequest(
                config.getGeneration().getModel(),
                instructions,
                input,
                CITATIONS_SCHEMA,
                config.getGeneration().getRecoveryMaxTokens(),
                false);
    }
}
