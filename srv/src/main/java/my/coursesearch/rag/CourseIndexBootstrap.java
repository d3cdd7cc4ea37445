package my.coursesearch.rag;

import java.nio.file.Path;
import my.coursesearch.exception.IncompatibleIndexException;
import my.coursesearch.exception.IndexNotFoundException;
import my.coursesearch.index.ActiveCourseIndex;
import my.coursesearch.repository.CourseIndexRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Makes an index available before the first query: loads the persisted one, or
 * builds a fresh one when none exists, it no longer matches the embedding model,
 * or {@code course-search.rebuild-on-startup} is set.
 */
@Component
public class CourseIndexBootstrap implements ApplicationRunner {

	private static final Logger logger = LoggerFactory.getLogger(CourseIndexBootstrap.class);

	private final CourseSearchProperties properties;
	private final CourseIndexRepository indexRepository;
	private final CourseEmbeddingService embeddingService;
	private final ActiveCourseIndex activeIndex;
	private final RagAiClient aiClient;

	public CourseIndexBootstrap(CourseSearchProperties properties, CourseIndexRepository indexRepository,
			CourseEmbeddingService embeddingService, ActiveCourseIndex activeIndex, RagAiClient aiClient) {
		this.properties = properties;
		this.indexRepository = indexRepository;
		this.embeddingService = embeddingService;
		this.activeIndex = activeIndex;
		this.aiClient = aiClient;
	}

	@Override
	public void run(ApplicationArguments args) {
		if (properties.isRebuildOnStartup()) {
			logger.info("Rebuilding course index on startup");
			embeddingService.rebuildAll();
			return;
		}
		Path location = Path.of(properties.getIndexLocation());
		try {
			activeIndex.install(indexRepository.load(location, aiClient.embeddingModelName()));
		} catch (IndexNotFoundException e) {
			logger.info("{}; building a new one", e.getMessage());
			embeddingService.rebuildAll();
		} catch (IncompatibleIndexException e) {
			logger.warn("Persisted course index is not usable ({}); rebuilding", e.getMessage());
			embeddingService.rebuildAll();
		}
	}
}
