package my.coursesearch.exception;

/**
 * Raised when the embedding backend fails or returns an unusable vector.
 */
public class EmbeddingException extends CourseSearchException {

	private static final long serialVersionUID = 1L;

	public EmbeddingException(String message) {
		super(message);
	}

	public EmbeddingException(String message, Throwable cause) {
		super(message, cause);
	}
}
