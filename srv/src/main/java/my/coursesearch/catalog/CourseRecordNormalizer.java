package my.coursesearch.catalog;

import java.util.ArrayList;
import java.util.List;
import my.coursesearch.exception.ValidationException;
import org.springframework.stereotype.Component;

/**
 * Turns a {@link CourseRecord} into a labelled, line-oriented text document. The
 * output depends only on the record, so rebuilding an index from the same data
 * yields identical chunks.
 */
@Component
public class CourseRecordNormalizer {

	static final String CURRICULUM_DELIMITER = " | ";

	public NormalizedDocument normalize(CourseRecord record) {
		if (record == null) {
			throw new ValidationException("Course record must not be null");
		}
		String url = require(record.url(), "url", record);
		String title = require(record.title(), "title", record);
		String description = require(record.description(), "description", record);
		String instructor = require(record.instructor(), "instructor", record);
		String price = require(record.price(), "price", record);

		List<String> lines = new ArrayList<>(6);
		lines.add("Title: " + title);
		lines.add("Description: " + description);
		lines.add("Instructor: " + instructor);
		lines.add("Price: " + price);
		lines.add("Curriculum: " + String.join(CURRICULUM_DELIMITER, record.curriculum()));
		lines.add("URL: " + url);

		return new NormalizedDocument(String.join("\n", lines), new CourseMetadata(title, url, price, instructor));
	}

	private String require(String value, String field, CourseRecord record) {
		if (value == null) {
			throw new ValidationException("Course record is missing required field '%s' (url=%s)"
					.formatted(field, record.url()));
		}
		return value;
	}
}
