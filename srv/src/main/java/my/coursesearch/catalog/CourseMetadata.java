package my.coursesearch.catalog;

/**
 * Compact course descriptor attached to every chunk and returned to callers.
 */
public record CourseMetadata(String title, String url, String price, String instructor) {
}
