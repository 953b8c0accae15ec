package eu.virtualparadox.notedraft.rag.rank;

import eu.virtualparadox.notedraft.ingest.model.Chunk;
import eu.virtualparadox.notedraft.ingest.model.EDocumentType;

import java.util.ArrayList;
import java.util.List;

final class RankFixtures {

    private RankFixtures() {
    }

    static Chunk chunk(String id, String sourceId, String text) {
        return chunk(id, sourceId, text, EDocumentType.PROGRESS_NOTE, null);
    }

    static Chunk chunk(String id, String sourceId, String text, EDocumentType type, String date) {
        return new Chunk(id, sourceId, sourceId + ".txt", text, 0, text.length(), type, date, type.weight());
    }

    /**
     * Ten chunks over three sources; source C never mentions the query terms.
     */
    static List<Chunk> threeSourcePool() {
        List<Chunk> pool = new ArrayList<>();
        pool.add(chunk("A_chunk_0", "A", "Long history of mood disorder with depressive episodes."));
        pool.add(chunk("A_chunk_1", "A", "Mood disorder history includes two hospitalizations."));
        pool.add(chunk("A_chunk_2", "A", "Family history of mood disorder in mother."));
        pool.add(chunk("A_chunk_3", "A", "Mood remained low, history unchanged."));
        pool.add(chunk("B_chunk_0", "B", "Prior history of mood disorder treated with sertraline."));
        pool.add(chunk("B_chunk_1", "B", "Mood disorder symptoms worsened in winter."));
        pool.add(chunk("B_chunk_2", "B", "Disorder onset at age 19."));
        pool.add(chunk("C_chunk_0", "C", "Labs within normal limits."));
        pool.add(chunk("C_chunk_1", "C", "Vitals stable, BMI 24."));
        pool.add(chunk("C_chunk_2", "C", "No known drug allergies."));
        return pool;
    }

    static List<String> sources(List<Chunk> chunks) {
        return chunks.stream().map(Chunk::sourceId).distinct().toList();
    }
}
