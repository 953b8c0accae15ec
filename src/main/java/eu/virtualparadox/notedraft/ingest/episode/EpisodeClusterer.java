package eu.virtualparadox.notedraft.ingest.episode;

import eu.virtualparadox.notedraft.ingest.model.SourceDocument;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups dated documents into care episodes. A new episode starts whenever the
 * gap to the previous dated document exceeds {@link #EPISODE_WINDOW_DAYS}.
 * Undated documents keep no episode. The result is an auxiliary index; ranking
 * does not read it.
 */
@Component
public class EpisodeClusterer {

    static final long EPISODE_WINDOW_DAYS = 30;

    /**
     * @return the same documents, in input order, with {@code episodeId} assigned
     */
    public List<SourceDocument> cluster(final List<SourceDocument> documents) {
        final List<SourceDocument> dated = documents.stream()
                .filter(d -> d.chronologicalOrder() != null)
                .sorted(Comparator.comparing(SourceDocument::chronologicalOrder))
                .toList();

        final Map<String, String> episodeByDoc = new HashMap<>();
        int episode = 0;
        Long previous = null;
        for (SourceDocument doc : dated) {
            if (previous == null || doc.chronologicalOrder() - previous > EPISODE_WINDOW_DAYS) {
                episode++;
            }
            episodeByDoc.put(doc.id(), "episode-" + episode);
            previous = doc.chronologicalOrder();
        }

        final List<SourceDocument> result = new ArrayList<>(documents.size());
        for (SourceDocument doc : documents) {
            result.add(doc.withEpisodeId(episodeByDoc.get(doc.id())));
        }
        return result;
    }
}
