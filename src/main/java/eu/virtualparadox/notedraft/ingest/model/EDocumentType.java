package eu.virtualparadox.notedraft.ingest.model;

/**
 * Clinical document categories recognised at ingestion. Each type carries the
 * fixed ranking weight applied to every chunk of a document of that type.
 */
public enum EDocumentType {
    DISCHARGE_SUMMARY("discharge-summary", 1.5),
    PSYCH_EVAL("psych-eval", 1.3),
    PROGRESS_NOTE("progress-note", 1.0),
    BIOPSYCHOSOCIAL("biopsychosocial", 1.2),
    INTAKE("intake", 1.0),
    OTHER("other", 0.8);

    private final String label;
    private final double weight;

    EDocumentType(final String label, final double weight) {
        this.label = label;
        this.weight = weight;
    }

    public String label() {
        return label;
    }

    public double weight() {
        return weight;
    }

    public static EDocumentType fromLabel(final String label) {
        for (EDocumentType type : values()) {
            if (type.label.equalsIgnoreCase(label)) {
                return type;
            }
        }
        return OTHER;
    }
}
