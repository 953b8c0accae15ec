package eu.virtualparadox.notedraft.rag.generate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient reader for model answers that are supposed to be JSON.
 *
 * <p>Answers are tried as-is, then as the content of a fenced code block, then as the
 * first balanced {@code {...}} object, then as everything between the first
 * {@code {} and the last {@code }}. Field names vary between models, so the text is
 * taken from the first of {@code text, output, answer, content} and citations from the
 * first of {@code citations, citation, sources, evidence, references, support}.</p>
 */
@Component
public class ModelPayloadParser {

    private static final List<String> TEXT_FIELDS = List.of("text", "output", "answer", "content");
    private static final List<String> CITATION_FIELDS =
            List.of("citations", "citation", "sources", "evidence", "references", "support");
    private static final List<String> ID_FIELDS = List.of("chunkId", "chunk_id", "id", "chunk");
    private static final List<String> EXCERPT_FIELDS = List.of("excerpt", "quote", "text");

    private static final Pattern FENCE = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```", Pattern.CASE_INSENSITIVE);
    private static final Pattern GREEDY_OBJECT = Pattern.compile("\\{[\\s\\S]*}");

    private final ObjectMapper mapper = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS)
            .build();

    /**
     * @throws MalformedPayloadException when no JSON object can be recovered
     */
    public ModelPayload parse(final String content) {
        final JsonNode root = readObject(content);
        if (root == null) {
            throw new MalformedPayloadException("Model answer is not JSON: "
                    + StringUtils.abbreviate(StringUtils.defaultString(content), 120));
        }
        return new ModelPayload(textOf(root), citationsOf(root));
    }

    /**
     * Reads the first JSON object found in the content, or {@code null}.
     */
    public JsonNode readObject(final String content) {
        if (StringUtils.isBlank(content)) {
            return null;
        }
        final String trimmed = content.trim();

        JsonNode node = tryRead(trimmed);
        if (node != null) {
            return node;
        }
        final Matcher fence = FENCE.matcher(trimmed);
        if (fence.find() && (node = tryRead(fence.group(1).trim())) != null) {
            return node;
        }
        final String balanced = firstBalancedObject(trimmed);
        if (balanced != null && (node = tryRead(balanced)) != null) {
            return node;
        }
        final Matcher greedy = GREEDY_OBJECT.matcher(trimmed);
        if (greedy.find()) {
            return tryRead(greedy.group());
        }
        return null;
    }

    /**
     * Turns a citation node into raw citations. Accepts an array or a single item;
     * items are either plain id strings or objects.
     */
    public List<RawCitation> citationItems(final JsonNode node) {
        final List<RawCitation> out = new ArrayList<>();
        if (node == null || node.isNull() || node.isMissingNode()) {
            return out;
        }
        if (node.isArray()) {
            node.forEach(item -> addItem(item, out));
        } else {
            addItem(node, out);
        }
        return out;
    }

    private void addItem(final JsonNode item, final List<RawCitation> out) {
        if (item.isTextual() && StringUtils.isNotBlank(item.asText())) {
            out.add(new RawCitation(item.asText().trim(), ""));
        } else if (item.isObject()) {
            final String id = firstText(item, ID_FIELDS);
            if (StringUtils.isNotBlank(id)) {
                out.add(new RawCitation(id.trim(), StringUtils.defaultString(firstText(item, EXCERPT_FIELDS))));
            }
        }
    }

    private String textOf(final JsonNode root) {
        return StringUtils.defaultString(firstText(root, TEXT_FIELDS)).trim();
    }

    private List<RawCitation> citationsOf(final JsonNode root) {
        for (String field : CITATION_FIELDS) {
            if (root.has(field)) {
                return citationItems(root.get(field));
            }
        }
        return List.of();
    }

    private static String firstText(final JsonNode node, final List<String> fields) {
        for (String field : fields) {
            final JsonNode value = node.get(field);
            if (value != null && value.isTextual()) {
                return value.asText();
            }
        }
        return null;
    }

    private JsonNode tryRead(final String candidate) {
        try {
            final JsonNode node = mapper.readTree(candidate);
            return node != null && node.isObject() ? node : null;
        }
        catch (JsonProcessingException e) {
            return null;
        }
    }

    /**
     * Scans for the first {@code {} and returns the text up to its matching brace,
     * ignoring braces inside string literals.
     */
    static String firstBalancedObject(final String text) {
        final int start = text.indexOf('{');
        if (start < 0) {
            return null;
        }
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            final char ch = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (ch == '\\') {
                    escaped = true;
                } else if (ch == '"') {
                    inString = false;
                }
                continue;
            }
            if (ch == '"') {
                inString = true;
            } else if (ch == '{') {
                depth++;
            } else if (ch == '}' && --depth == 0) {
                return text.substring(start, i + 1);
            }
        }
        return null;
    }
}
