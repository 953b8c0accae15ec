package eu.virtualparadox.notedraft.rag.rank;

import eu.virtualparadox.notedraft.ingest.model.Chunk;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static eu.virtualparadox.notedraft.rag.rank.RankFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class DiversityLexicalRankerTest {

    private final DiversityLexicalRanker ranker = new DiversityLexicalRanker();

    @Test
    @DisplayName("Best chunk of every matching source comes before second picks")
    void roundRobinFirst() {
        List<Chunk> pool = List.of(
                chunk("A_0", "A", "suicidal ideation suicidal ideation plan"),
                chunk("A_1", "A", "suicidal ideation plan intent"),
                chunk("A_2", "A", "suicidal ideation passive"),
                chunk("B_0", "B", "ideation denied"));

        List<Chunk> result = ranker.rank("suicidal ideation plan intent", pool, 3, RankOptions.DEFAULT);

        assertThat(result).extracting(Chunk::id).containsExactly("A_0", "B_0", "A_1");
    }

    @Test
    @DisplayName("All three sources appear when unmatched sources are included")
    void coversAllSources() {
        List<Chunk> result = ranker.rank("mood disorder history", threeSourcePool(), 6, RankOptions.coverAllSources());

        assertThat(result).hasSize(6);
        assertThat(sources(result)).containsExactly("A", "B", "C");
    }

    @Test
    @DisplayName("Unmatched sources stay out without the option")
    void noCoverage() {
        List<Chunk> result = ranker.rank("mood disorder history", threeSourcePool(), 6, RankOptions.DEFAULT);

        assertThat(sources(result)).doesNotContain("C");
    }
}
