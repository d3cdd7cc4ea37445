package my.coursesearch.exception;

/**
 * Raised when no persisted index exists at the requested location.
 */
public class IndexNotFoundException extends CourseSearchException {

	private static final long serialVersionUID = 1L;

	public IndexNotFoundException(String message) {
		super(message);
	}

	public IndexNotFoundException(String message, Throwable cause) {
		super(message, cause);
	}
}
