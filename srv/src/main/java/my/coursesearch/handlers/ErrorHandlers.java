package my.coursesearch.handlers;

import java.io.UncheckedIOException;
import java.util.Map;
import my.coursesearch.exception.CourseSearchException;
import my.coursesearch.exception.NotInitializedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
class ErrorHandlers {

	private static final Logger logger = LoggerFactory.getLogger(ErrorHandlers.class);

	@ExceptionHandler(NotInitializedException.class)
	public ResponseEntity<Map<String, String>> notInitialized(NotInitializedException e) {
		logger.error("Request served before the course index was ready", e);
		return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
	}

	@ExceptionHandler(CourseSearchException.class)
	public ResponseEntity<Map<String, String>> pipelineFailure(CourseSearchException e) {
		logger.error("Course search pipeline failed", e);
		return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", e.getMessage()));
	}

	@ExceptionHandler(UncheckedIOException.class)
	public ResponseEntity<Map<String, String>> storageFailure(UncheckedIOException e) {
		logger.error("Course index storage failed", e);
		return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", e.getMessage()));
	}
}
