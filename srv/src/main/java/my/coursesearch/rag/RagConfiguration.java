package my.coursesearch.rag;

import java.nio.file.Path;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import my.coursesearch.catalog.CourseSource;
import my.coursesearch.catalog.JsonFileCourseSource;
import my.coursesearch.exception.ConfigException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RagConfiguration {

    private final CourseSearchProperties properties;
    private final OpenAIProperties openAIProperties;
    private final GeminiProperties geminiProperties;
    private final AiUsageTracker usageTracker;

    public RagConfiguration(CourseSearchProperties properties, OpenAIProperties openAIProperties,
            GeminiProperties geminiProperties, AiUsageTracker usageTracker) {
        this.properties = properties;
        this.openAIProperties = openAIProperties;
        this.geminiProperties = geminiProperties;
        this.usageTracker = usageTracker;
    }

    @Bean
    public RagAiClient ragAiClient() {
        String provider = properties.getGenerationProvider();
        ChatLanguageModel chatModel;
        String chatModelName;
        if (CourseSearchProperties.PROVIDER_GEMINI.equalsIgnoreCase(provider)) {
            chatModelName = geminiProperties.getChatModel();
            chatModel = GoogleAiGeminiChatModel.builder()
                    .apiKey(requireKey(geminiProperties.getApiKey(), "gemini.api-key"))
                    .modelName(chatModelName)
                    .temperature(0.0)
                    .build();
        } else if (CourseSearchProperties.PROVIDER_OPENAI.equalsIgnoreCase(provider)) {
            chatModelName = openAIProperties.getChatModel();
            chatModel = OpenAiChatModel.builder()
                    .apiKey(requireKey(openAIProperties.getApiKey(), "openai.api-key"))
                    .baseUrl(openAIProperties.getBaseUrl())
                    .modelName(chatModelName)
                    .temperature(0.0)
                    .build();
        } else {
            throw new ConfigException("Unknown generation provider '%s'".formatted(provider));
        }

        String embeddingProvider = properties.getEmbeddingProvider();
        EmbeddingModel embeddingModel;
        String embeddingModelName;
        if (CourseSearchProperties.EMBEDDING_ALL_MINILM.equalsIgnoreCase(embeddingProvider)) {
            embeddingModelName = CourseSearchProperties.EMBEDDING_ALL_MINILM;
            embeddingModel = new AllMiniLmL6V2EmbeddingModel();
        } else if (CourseSearchProperties.PROVIDER_OPENAI.equalsIgnoreCase(embeddingProvider)) {
            embeddingModelName = openAIProperties.getEmbeddingModel();
            embeddingModel = OpenAiEmbeddingModel.builder()
                    .apiKey(requireKey(openAIProperties.getApiKey(), "openai.api-key"))
                    .baseUrl(openAIProperties.getBaseUrl())
                    .modelName(embeddingModelName)
                    .build();
        } else {
            throw new ConfigException("Unknown embedding provider '%s'".formatted(embeddingProvider));
        }

        return new LangChainAiClient(chatModel, chatModelName, embeddingModel, embeddingModelName, usageTracker);
    }

    @Bean
    public CourseTextChunker courseTextChunker() {
        return new CourseTextChunker(properties.getChunkSize(), properties.getChunkOverlap());
    }

    @Bean
    public CourseSource courseSource(ObjectMapper objectMapper) {
        return new JsonFileCourseSource(Path.of(properties.getDataFile()), objectMapper);
    }

    private static String requireKey(String value, String property) {
        if (value == null || value.isBlank()) {
            throw new ConfigException("Missing required credential '%s'".formatted(property));
        }
        return value;
    }
}
