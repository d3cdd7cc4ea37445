package my.coursesearch.service;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import dev.langchain4j.data.message.ChatMessage;
import my.coursesearch.index.ActiveCourseIndex;
import my.coursesearch.index.ChunkMatch;
import my.coursesearch.index.VectorIndex;
import my.coursesearch.rag.CourseRetrievalService;
import my.coursesearch.rag.CourseSearchProperties;
import my.coursesearch.rag.QueryClassifier;
import my.coursesearch.rag.RagAiClient;
import my.coursesearch.rag.RagPromptBuilder;
import my.coursesearch.rag.SimilarCoursesFinder;

/**
 * Answers catalogue questions: gate the query, retrieve the top-k chunks, and let
 * the chat model answer from them.
 * <p>
 * Failures of the embedding or chat backend never reach the caller; they are
 * logged and turned into a fixed apology with no matches. Querying before an
 * index is installed is a programming error and is not caught.
 */
@Service
public class CourseSearchService {

	private static final Logger logger = LoggerFactory.getLogger(CourseSearchService.class);

	public static final String REJECTION_MESSAGE = "Please enter a query related to courses.";
	public static final String ERROR_MESSAGE = "An error occurred while processing your query.";

	private final ActiveCourseIndex activeIndex;
	private final QueryClassifier classifier;
	private final CourseRetrievalService retrievalService;
	private final RagPromptBuilder promptBuilder;
	private final RagAiClient aiClient;
	private final CourseSearchProperties properties;

	public CourseSearchService(ActiveCourseIndex activeIndex, QueryClassifier classifier,
			CourseRetrievalService retrievalService, RagPromptBuilder promptBuilder, RagAiClient aiClient,
			CourseSearchProperties properties) {
		this.activeIndex = activeIndex;
		this.classifier = classifier;
		this.retrievalService = retrievalService;
		this.promptBuilder = promptBuilder;
		this.aiClient = aiClient;
		this.properties = properties;
	}

	/**
	 * @throws my.coursesearch.exception.NotInitializedException if no index is installed.
	 */
	public QueryResult answer(String query) {
		VectorIndex index = activeIndex.current();

		if (!classifier.isInDomain(query)) {
			logger.debug("Query rejected as out of domain: {}", query);
			return new QueryResult(REJECTION_MESSAGE, List.of());
		}

		logger.info("Searching for: {}", query);
		try {
			// 1. Retrieve the most similar chunks
			float[] vector = retrievalService.embedForQuery(query);
			List<ChunkMatch> matches = index.search(vector, properties.getTopK());

			// 2. Answer from all of them in one call
			List<ChatMessage> messages = promptBuilder.buildMessages(query, matches);
			String reply = aiClient.chat(messages);

			return new QueryResult(reply, SimilarCoursesFinder.toCourses(matches));
		} catch (RuntimeException e) {
			logger.error("Error during search for '{}'", query, e);
			return new QueryResult(ERROR_MESSAGE, List.of());
		}
	}
}
