package my.coursesearch.exception;

/**
 * Raised when a course record lacks a required field.
 */
public class ValidationException extends CourseSearchException {

	private static final long serialVersionUID = 1L;

	public ValidationException(String message) {
		super(message);
	}
}
