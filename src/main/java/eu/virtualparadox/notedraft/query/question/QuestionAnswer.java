package eu.virtualparadox.notedraft.query.question;

import eu.virtualparadox.notedraft.rag.generate.Citation;

import java.util.List;

public record QuestionAnswer(String questionId, String text, List<Citation> citations) {
}
