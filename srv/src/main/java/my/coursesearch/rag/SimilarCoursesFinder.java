package my.coursesearch.rag;

import java.util.List;
import my.coursesearch.catalog.CourseMetadata;
import my.coursesearch.index.ChunkMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Plain similarity lookup: no query gate and no generation. One entry per
 * matching chunk, in ranking order, so a course can appear more than once when
 * several of its chunks match.
 */
@Service
public class SimilarCoursesFinder {

	private static final Logger logger = LoggerFactory.getLogger(SimilarCoursesFinder.class);

	public static final int DEFAULT_LIMIT = 3;

	private final CourseRetrievalService retrievalService;

	public SimilarCoursesFinder(CourseRetrievalService retrievalService) {
		this.retrievalService = retrievalService;
	}

	public List<CourseMetadata> findSimilar(String text) {
		return findSimilar(text, DEFAULT_LIMIT);
	}

	public List<CourseMetadata> findSimilar(String text, int n) {
		logger.info("Finding courses similar to: {}", text);
		return toCourses(retrievalService.similaritySearch(text, n));
	}

	public static List<CourseMetadata> toCourses(List<ChunkMatch> matches) {
		return matches.stream()
				.map(match -> match.chunk().metadata())
				.toList();
	}
}
