package my.coursesearch.rag;

import java.util.List;

import dev.langchain4j.data.message.ChatMessage;

/**
 * Abstraction for RAG-related AI operations (embeddings + chat).
 * <p>
 * Embedding calls are pure for a fixed model: identical text yields an identical
 * vector. Backend failures surface as
 * {@link my.coursesearch.exception.EmbeddingException} and
 * {@link my.coursesearch.exception.GenerationException}; nothing is retried here.
 * <p>
 * Backed by LangChain4j via {@link LangChainAiClient}.
 */
public interface RagAiClient {

	float[] embed(String text);

	/**
	 * @return one vector per input text, in input order.
	 */
	List<float[]> embed(List<String> texts);

	String chat(List<ChatMessage> messages);

	/**
	 * @return identifier of the embedding model, stored with persisted indexes.
	 */
	String embeddingModelName();
}
