package my.coursesearch.rag;

import java.time.Instant;

/**
 * Represents a single AI model invocation and the tokens it consumed.
 */
public record AiUsageRecord(String modelName, Instant timestamp, int inputTokens, int outputTokens, int totalTokens) {
}
