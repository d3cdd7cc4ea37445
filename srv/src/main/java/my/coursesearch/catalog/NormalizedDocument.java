package my.coursesearch.catalog;

/**
 * Text serialization of one course, ready for chunking.
 */
public record NormalizedDocument(String text, CourseMetadata metadata) {

	/**
	 * @return the course url, which identifies the document across chunks.
	 */
	public String documentId() {
		return metadata.url();
	}
}
