package eu.virtualparadox.notedraft.query.review;

public record ReviewedSection(String id, String title, String text) {
}
