package my.coursesearch.index;

import my.coursesearch.rag.CourseTextChunk;

/**
 * Holds the similarity result for a chunk that matched a query vector.
 */
public record ChunkMatch(CourseTextChunk chunk, double similarity) {
}
