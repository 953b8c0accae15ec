package eu.virtualparadox.notedraft.rag.generate;

import eu.virtualparadox.notedraft.ingest.model.Chunk;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds chunk ids the model wrote into the prose instead of the citation list,
 * and removes them from the prose again.
 */
@Component
public class InlineCitationScanner {

    private static final String ID = "[A-Za-z0-9_-]+_chunk_\\d+";
    private static final Pattern BRACKETED = Pattern.compile("\\[(" + ID + ")]");
    private static final Pattern BARE = Pattern.compile("(?<![A-Za-z0-9_-])(" + ID + ")(?!\\d)");
    private static final Pattern MARKER_GROUP =
            Pattern.compile("[ \\t]*[\\[(]\\s*" + ID + "(?:\\s*[,;]\\s*" + ID + ")*\\s*[\\])]");
    private static final Pattern BARE_MARKER = Pattern.compile("[ \\t]*" + BARE.pattern());

    /**
     * @return chunk ids referenced by the text, including evidence ids that appear
     * verbatim without a marker, as raw citations in order of appearance
     */
    public List<RawCitation> scan(final String text, final List<Chunk> evidence) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        final Set<String> ids = new LinkedHashSet<>();
        collect(BRACKETED.matcher(text), ids);
        collect(BARE.matcher(text), ids);
        if (evidence != null) {
            for (Chunk chunk : evidence) {
                if (text.contains(chunk.id())) {
                    ids.add(chunk.id());
                }
            }
        }
        final List<RawCitation> result = new ArrayList<>(ids.size());
        ids.forEach(id -> result.add(new RawCitation(id, "")));
        return result;
    }

    /**
     * Removes chunk id markers together with the blanks in front of them, e.g.
     * {@code "Sleeps poorly [a_chunk_1]."} becomes {@code "Sleeps poorly."}.
     * Whitespace elsewhere in the text is left as written.
     */
    public String strip(final String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return BARE_MARKER.matcher(MARKER_GROUP.matcher(text).replaceAll("")).replaceAll("").trim();
    }

    private static void collect(final Matcher matcher, final Set<String> ids) {
        while (matcher.find()) {
            ids.add(matcher.group(1));
        }
    }
}
