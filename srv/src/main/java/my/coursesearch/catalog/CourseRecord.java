package my.coursesearch.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * A course as delivered by a {@link CourseSource}. Only {@code curriculum} may be
 * absent; every other field is required by {@link CourseRecordNormalizer}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CourseRecord(
		String title,
		String description,
		String instructor,
		String price,
		List<String> curriculum,
		String url) {

	public CourseRecord {
		curriculum = curriculum == null ? List.of() : List.copyOf(curriculum);
	}
}
