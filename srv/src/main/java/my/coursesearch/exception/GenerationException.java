package my.coursesearch.exception;

/**
 * Raised when the chat model backend fails to produce an answer.
 */
public class GenerationException extends CourseSearchException {

	private static final long serialVersionUID = 1L;

	public GenerationException(String message) {
		super(message);
	}

	public GenerationException(String message, Throwable cause) {
		super(message, cause);
	}
}
