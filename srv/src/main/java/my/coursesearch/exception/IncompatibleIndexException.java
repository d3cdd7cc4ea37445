package my.coursesearch.exception;

/**
 * Raised when a persisted index cannot be used with the running embedding setup.
 */
public class IncompatibleIndexException extends CourseSearchException {

	private static final long serialVersionUID = 1L;

	public IncompatibleIndexException(String message) {
		super(message);
	}

	public IncompatibleIndexException(String message, Throwable cause) {
		super(message, cause);
	}
}
