package my.coursesearch.rag;

import java.util.ArrayList;
import java.util.List;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import my.coursesearch.exception.EmbeddingException;
import my.coursesearch.exception.GenerationException;

/**
 * {@link RagAiClient} on top of LangChain4j chat and embedding models. Which
 * backends sit behind the two models is decided in {@link RagConfiguration}.
 */
public class LangChainAiClient implements RagAiClient {

	private final ChatLanguageModel chatModel;
	private final EmbeddingModel embeddingModel;
	private final AiUsageTracker usageTracker;
	private final String chatModelName;
	private final String embeddingModelName;

	public LangChainAiClient(ChatLanguageModel chatModel, String chatModelName,
			EmbeddingModel embeddingModel, String embeddingModelName, AiUsageTracker usageTracker) {
		this.chatModel = chatModel;
		this.chatModelName = chatModelName;
		this.embeddingModel = embeddingModel;
		this.embeddingModelName = embeddingModelName;
		this.usageTracker = usageTracker;
	}

	@Override
	public float[] embed(String text) {
		if (text == null) {
			throw new EmbeddingException("Cannot embed null text");
		}
		Response<Embedding> response;
		try {
			response = embeddingModel.embed(text);
		} catch (RuntimeException e) {
			throw new EmbeddingException("Embedding model '%s' failed".formatted(embeddingModelName), e);
		}
		trackUsage(embeddingModelName, response);
		if (response == null || response.content() == null) {
			throw new EmbeddingException("Embedding model '%s' returned no vector".formatted(embeddingModelName));
		}
		return response.content().vector();
	}

	@Override
	public List<float[]> embed(List<String> texts) {
		if (texts == null || texts.isEmpty()) {
			return List.of();
		}
		List<TextSegment> segments = texts.stream().map(TextSegment::from).toList();
		Response<List<Embedding>> response;
		try {
			response = embeddingModel.embedAll(segments);
		} catch (RuntimeException e) {
			throw new EmbeddingException("Batch embedding of %d texts failed on model '%s'"
					.formatted(texts.size(), embeddingModelName), e);
		}
		trackUsage(embeddingModelName, response);
		List<Embedding> embeddings = response == null ? null : response.content();
		if (embeddings == null || embeddings.size() != texts.size()) {
			throw new EmbeddingException("Mismatch in embedding count. Expected %d, got %d"
					.formatted(texts.size(), embeddings == null ? 0 : embeddings.size()));
		}
		List<float[]> vectors = new ArrayList<>(embeddings.size());
		for (Embedding embedding : embeddings) {
			vectors.add(embedding.vector());
		}
		return vectors;
	}

	@Override
	public String chat(List<ChatMessage> messages) {
		Response<AiMessage> response;
		try {
			response = chatModel.generate(messages);
		} catch (RuntimeException e) {
			throw new GenerationException("Chat model '%s' failed".formatted(chatModelName), e);
		}
		trackUsage(chatModelName, response);
		if (response == null || response.content() == null) {
			throw new GenerationException("Chat model '%s' returned no message".formatted(chatModelName));
		}
		String text = response.content().text();
		return text == null ? "" : text;
	}

	@Override
	public String embeddingModelName() {
		return embeddingModelName;
	}

	private void trackUsage(String modelName, Response<?> response) {
		if (usageTracker == null || response == null) {
			return;
		}
		usageTracker.recordUsage(modelName, response.tokenUsage());
	}
}
