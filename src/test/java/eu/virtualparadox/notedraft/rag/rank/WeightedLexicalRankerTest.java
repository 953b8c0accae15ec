package eu.virtualparadox.notedraft.rag.rank;

import eu.virtualparadox.notedraft.ingest.model.Chunk;
import eu.virtualparadox.notedraft.ingest.model.EDocumentType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static eu.virtualparadox.notedraft.rag.rank.RankFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class WeightedLexicalRankerTest {

    private final WeightedLexicalRanker ranker = new WeightedLexicalRanker();

    @Test
    @DisplayName("Only matching chunks are returned without source coverage")
    void cutoff() {
        List<Chunk> result = ranker.rank("mood disorder history", threeSourcePool(), 6, RankOptions.DEFAULT);

        assertThat(result).hasSize(6);
        assertThat(sources(result)).containsExactlyInAnyOrder("A", "B");
    }

    @Test
    @DisplayName("Unmatched sources are surfaced within the limit")
    void includeUnmatchedSources() {
        List<Chunk> result = ranker.rank("mood disorder history", threeSourcePool(), 6, RankOptions.coverAllSources());

        assertThat(result).hasSize(6);
        assertThat(sources(result)).containsExactlyInAnyOrder("A", "B", "C");
        assertThat(result.get(result.size() - 1).sourceId()).isEqualTo("C");
        assertThat(result).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("Document weight orders equal overlaps")
    void weightOrdersTies() {
        Chunk note = chunk("n", "N", "insomnia reported", EDocumentType.OTHER, null);
        Chunk discharge = chunk("d", "D", "insomnia reported", EDocumentType.DISCHARGE_SUMMARY, null);

        List<Chunk> result = ranker.rank("insomnia", List.of(note, discharge), 2, RankOptions.DEFAULT);

        assertThat(result).containsExactly(discharge, note);
    }

    @Test
    @DisplayName("Newer episodes win ties on recency")
    void recency() {
        Chunk older = chunk("o", "O", "anxiety worsening", EDocumentType.PROGRESS_NOTE, "2020-01-01");
        Chunk newer = chunk("n", "N", "anxiety worsening", EDocumentType.PROGRESS_NOTE, "2023-01-01");

        assertThat(ranker.rank("anxiety", List.of(older, newer), 1, RankOptions.DEFAULT)).containsExactly(newer);
    }

    @Test
    @DisplayName("History boost favours documents that carry the history")
    void historyBoost() {
        Chunk note = chunk("n", "N", "trauma trauma", EDocumentType.OTHER, null);
        Chunk eval = chunk("e", "E", "trauma", EDocumentType.PSYCH_EVAL, null);

        assertThat(ranker.rank("trauma", List.of(note, eval), 2, RankOptions.DEFAULT))
                .containsExactly(note, eval);
        assertThat(ranker.rank("trauma", List.of(note, eval), 2, new RankOptions(false, true)))
                .containsExactly(eval, note);
    }

    @Test
    @DisplayName("A query without usable tokens returns the first chunks")
    void emptyQuery() {
        List<Chunk> pool = threeSourcePool();

        assertThat(ranker.rank("a of", pool, 3, RankOptions.DEFAULT)).containsExactlyElementsOf(pool.subList(0, 3));
        assertThat(ranker.rank("mood", List.of(), 3, RankOptions.DEFAULT)).isEmpty();
    }

    @Test
    @DisplayName("A query without usable tokens still covers every source when asked to")
    void emptyQueryCoversSources() {
        Chunk a0 = chunk("a_chunk_0", "a", "Sleeps poorly.");
        Chunk a1 = chunk("a_chunk_1", "a", "Appetite reduced.");
        Chunk b0 = chunk("b_chunk_0", "b", "No known drug allergies.");

        assertThat(ranker.rank("of a", List.of(a0, a1, b0), 2, RankOptions.coverAllSources()))
                .containsExactly(a0, b0);
    }

    @Test
    void tokenizeDropsShortTokensAndPunctuation() {
        assertThat(LexicalRanker.tokenize("Mood: ok, SI-denied; a b c.")).containsExactly("mood", "denied");
    }
}
