package eu.virtualparadox.notedraft.query.review;

/**
 * A proposed rewrite of one section. Never applied without the user accepting it.
 *
 * @param revisedText full replacement text for the section
 * @param issue       one-sentence reason for the change
 */
public record ReviewChange(String sectionId, String revisedText, String issue) {
}
