package my.coursesearch.exception;

/**
 * Raised when a query arrives before an index has been installed.
 */
public class NotInitializedException extends CourseSearchException {

	private static final long serialVersionUID = 1L;

	public NotInitializedException(String message) {
		super(message);
	}
}
