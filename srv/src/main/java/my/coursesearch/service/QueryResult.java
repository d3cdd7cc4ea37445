package my.coursesearch.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import my.coursesearch.catalog.CourseMetadata;

/**
 * Response returned for every query. {@code matches} is never null.
 */
public record QueryResult(
		@JsonProperty("Search Result") String answer,
		@JsonProperty("Similar Courses") List<CourseMetadata> matches) {

	public QueryResult {
		answer = answer == null ? "" : answer;
		matches = matches == null ? List.of() : List.copyOf(matches);
	}
}
