package my.coursesearch.handlers;

import java.util.List;
import my.coursesearch.catalog.CourseMetadata;
import my.coursesearch.rag.SimilarCoursesFinder;
import my.coursesearch.service.CourseSearchService;
import my.coursesearch.service.QueryResult;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class CourseSearchHandler {

	private final CourseSearchService searchService;
	private final SimilarCoursesFinder similarCoursesFinder;

	public CourseSearchHandler(CourseSearchService searchService, SimilarCoursesFinder similarCoursesFinder) {
		this.searchService = searchService;
		this.similarCoursesFinder = similarCoursesFinder;
	}

	@GetMapping("/search")
	public ResponseEntity<QueryResult> search(@RequestParam("query") String query) {
		return ResponseEntity.ok(searchService.answer(query));
	}

	@GetMapping("/similar")
	public ResponseEntity<List<CourseMetadata>> similar(@RequestParam("text") String text,
			@RequestParam(value = "n", defaultValue = "3") int n) {
		return ResponseEntity.ok(similarCoursesFinder.findSimilar(text, n));
	}
}
