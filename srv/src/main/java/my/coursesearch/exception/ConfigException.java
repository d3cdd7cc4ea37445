package my.coursesearch.exception;

/**
 * Raised for missing credentials or inconsistent pipeline settings.
 */
public class ConfigException extends CourseSearchException {

	private static final long serialVersionUID = 1L;

	public ConfigException(String message) {
		super(message);
	}

	public ConfigException(String message, Throwable cause) {
		super(message, cause);
	}
}
