package my.coursesearch.rag;

import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Accepts a query when it mentions any course-related keyword, case-insensitively
 * and anywhere in the text ("coursework" matches "course"). This is a coarse
 * heuristic and says nothing about whether the catalogue can actually answer.
 */
@Component
public class KeywordQueryClassifier implements QueryClassifier {

	static final List<String> COURSE_KEYWORDS = List.of("course", "learn", "tutorial", "class", "training",
			"education");

	@Override
	public boolean isInDomain(String query) {
		if (query == null || query.isBlank()) {
			return false;
		}
		String normalized = query.toLowerCase(Locale.ROOT);
		return COURSE_KEYWORDS.stream().anyMatch(normalized::contains);
	}
}
