package my.coursesearch.rag;

import my.coursesearch.catalog.CourseMetadata;

/**
 * A window of a normalized course document that is ready for embedding.
 */
public record CourseTextChunk(String sourceDocumentId, int index, String text, CourseMetadata metadata) {
}
