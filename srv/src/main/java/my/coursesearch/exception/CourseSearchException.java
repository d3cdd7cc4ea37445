package my.coursesearch.exception;

/**
 * Base type for all failures raised by the course search pipeline.
 */
public class CourseSearchException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public CourseSearchException(String message) {
		super(message);
	}

	public CourseSearchException(String message, Throwable cause) {
		super(message, cause);
	}
}
