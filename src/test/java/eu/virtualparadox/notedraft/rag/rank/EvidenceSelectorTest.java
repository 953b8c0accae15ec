package eu.virtualparadox.notedraft.rag.rank;

import eu.virtualparadox.notedraft.application.config.ApplicationConfig;
import eu.virtualparadox.notedraft.ingest.model.Chunk;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static eu.virtualparadox.notedraft.rag.rank.RankFixtures.threeSourcePool;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class EvidenceSelectorTest {

    private final List<Chunk> pool = threeSourcePool();
    private ApplicationConfig config;
    private SemanticRanker semantic;

    @BeforeEach
    void setUp() {
        config = new ApplicationConfig();
        config.getRanking().setSemanticEnabled(true);
        semantic = mock(SemanticRanker.class);
    }

    private EvidenceSelector selector(Optional<SemanticRanker> semanticRanker) {
        return new EvidenceSelector(new WeightedLexicalRanker(), new DiversityLexicalRanker(), semanticRanker, config);
    }

    @Test
    @DisplayName("Semantic result replaces the lexical one when it has content")
    void semanticAdopted() {
        List<Chunk> semanticPick = List.of(pool.get(9));
        when(semantic.rank(anyString(), any(), anyInt(), any())).thenReturn(semanticPick);

        assertThat(selector(Optional.of(semantic)).select("mood disorder history", pool, 6, RankOptions.DEFAULT))
                .isEqualTo(semanticPick);
    }

    @Test
    @DisplayName("Semantic failure keeps the lexical selection")
    void semanticFailure() {
        when(semantic.rank(anyString(), any(), anyInt(), any())).thenThrow(new IllegalStateException("model missing"));
        List<Chunk> lexical = new WeightedLexicalRanker().rank("mood disorder history", pool, 6, RankOptions.DEFAULT);

        assertThat(selector(Optional.of(semantic)).select("mood disorder history", pool, 6, RankOptions.DEFAULT))
                .isEqualTo(lexical);
    }

    @Test
    @DisplayName("Empty semantic result keeps the lexical selection")
    void semanticEmpty() {
        when(semantic.rank(anyString(), any(), anyInt(), any())).thenReturn(List.of());

        assertThat(selector(Optional.of(semantic)).select("mood disorder history", pool, 6, RankOptions.DEFAULT))
                .hasSize(6);
    }

    @Test
    @DisplayName("Strategy switch picks the diversity ranker")
    void strategy() {
        config.getRanking().setSemanticEnabled(false);
        EvidenceSelector selector = selector(Optional.of(semantic));

        List<Chunk> diverse = selector.select("mood disorder history", pool, 2, ERankingStrategy.DIVERSITY, RankOptions.DEFAULT);

        assertThat(RankFixtures.sources(diverse)).containsExactly("A", "B");
        verifyNoInteractions(semantic);
    }

    @Test
    void defaultLimitFromConfig() {
        config.getRanking().setEvidenceLimit(9);
        assertThat(selector(Optional.empty()).defaultLimit()).isEqualTo(9);
    }
}
