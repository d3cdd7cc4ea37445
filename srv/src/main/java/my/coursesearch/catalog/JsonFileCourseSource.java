package my.coursesearch.catalog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import my.coursesearch.exception.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the JSON array written by the course scraper.
 */
public class JsonFileCourseSource implements CourseSource {

	private static final Logger logger = LoggerFactory.getLogger(JsonFileCourseSource.class);

	private static final TypeReference<List<CourseRecord>> RECORDS_TYPE = new TypeReference<>() {
	};

	private final Path file;
	private final ObjectMapper objectMapper;

	public JsonFileCourseSource(Path file, ObjectMapper objectMapper) {
		this.file = file;
		this.objectMapper = objectMapper;
	}

	@Override
	public List<CourseRecord> loadCourses() {
		if (!Files.isRegularFile(file)) {
			throw new ConfigException("Course data file not found: " + file.toAbsolutePath());
		}
		logger.info("Loading course data from {}", file);
		try {
			List<CourseRecord> records = objectMapper.readValue(file.toFile(), RECORDS_TYPE);
			return records == null ? List.of() : records;
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to read course data from " + file, e);
		}
	}
}
