package my.coursesearch.rag;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.output.TokenUsage;
import my.coursesearch.exception.EmbeddingException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LangChainAiClientTest {

    @Test
    void embedsInInputOrderAndTracksUsage() {
        AiUsageTracker tracker = new AiUsageTracker();
        EmbeddingModel model = segments -> Response.from(
                segments.stream().map(s -> Embedding.from(new float[] { s.text().length(), 1f })).toList(),
                new TokenUsage(segments.size(), 0));
        LangChainAiClient client = new LangChainAiClient(null, "chat", model, "emb", tracker);

        List<float[]> vectors = client.embed(List.of("a", "bbb"));

        assertArrayEquals(new float[] { 1f, 1f }, vectors.get(0));
        assertArrayEquals(new float[] { 3f, 1f }, vectors.get(1));
        assertEquals(2, tracker.getUsageByModel().get("emb").inputTokens());
        assertArrayEquals(new float[] { 2f, 1f }, client.embed("cc"));
        assertEquals("emb", client.embeddingModelName());
    }

    @Test
    void backendFailuresSurfaceAsEmbeddingException() {
        EmbeddingModel broken = segments -> {
            throw new IllegalStateException("quota exceeded");
        };
        LangChainAiClient client = new LangChainAiClient(null, "chat", broken, "emb", null);

        EmbeddingException ex = assertThrows(EmbeddingException.class, () -> client.embed(List.of("a")));
        assertInstanceOf(IllegalStateException.class, ex.getCause());
        assertThrows(EmbeddingException.class, () -> client.embed("a"));
    }

    @Test
    void wrongNumberOfVectorsIsAnError() {
        EmbeddingModel shortChanging = segments -> Response.from(List.of(Embedding.from(new float[] { 1f })));
        LangChainAiClient client = new LangChainAiClient(null, "chat", shortChanging, "emb", null);

        assertThrows(EmbeddingException.class, () -> client.embed(List.of("a", "b")));
        assertEquals(List.of(), client.embed(List.of()));
    }
}
