package my.coursesearch.rag;

import java.util.List;
import my.coursesearch.index.ActiveCourseIndex;
import my.coursesearch.index.ChunkMatch;
import org.springframework.stereotype.Service;

@Service
public class CourseRetrievalService {

	private final RagAiClient aiClient;
	private final ActiveCourseIndex activeIndex;

	public CourseRetrievalService(RagAiClient aiClient, ActiveCourseIndex activeIndex) {
		this.aiClient = aiClient;
		this.activeIndex = activeIndex;
	}

	public float[] embedForQuery(String text) {
		return aiClient.embed(text);
	}

	/**
	 * @return at most {@code k} chunks, most similar first.
	 * @throws my.coursesearch.exception.NotInitializedException if no index is installed.
	 */
	public List<ChunkMatch> similaritySearch(String text, int k) {
		var index = activeIndex.current();
		return index.search(embedForQuery(text), k);
	}
}
