package eu.virtualparadox.notedraft.rag.generate;

/**
 * A note section to draft.
 *
 * @param id       stable section id, also the scheduler target id
 * @param title    heading shown to the reader
 * @param guidance what the section must contain
 */
public record SectionSpec(String id, String title, String guidance) {

    /**
     * Text the evidence ranker is queried with.
     */
    public String rankingQuery() {
        return (title == null ? "" : title) + " " + (guidance == null ? "" : guidance);
    }
}
