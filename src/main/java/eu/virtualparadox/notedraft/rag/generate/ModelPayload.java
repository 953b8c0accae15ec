package eu.virtualparadox.notedraft.rag.generate;

import java.util.List;

public record ModelPayload(String text, List<RawCitation> citations) {

    public ModelPayload {
        text = text == null ? "" : text;
        citations = citations == null ? List.of() : List.copyOf(citations);
    }
}
