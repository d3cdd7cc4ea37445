package my.coursesearch.rag;

import dev.langchain4j.model.output.TokenUsage;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Collects token usage per AI model over a bounded window of recent calls.
 */
@Component
public class AiUsageTracker {

	private static final Logger logger = LoggerFactory.getLogger(AiUsageTracker.class);

	static final int MAX_RECORDS = 200;

	private final ConcurrentLinkedDeque<AiUsageRecord> history = new ConcurrentLinkedDeque<>();

	public void recordUsage(String modelName, TokenUsage usage) {
		if (usage == null || modelName == null || modelName.isBlank()) {
			return;
		}
		int input = usage.inputTokenCount() == null ? 0 : usage.inputTokenCount();
		int output = usage.outputTokenCount() == null ? 0 : usage.outputTokenCount();
		int total = usage.totalTokenCount() == null ? input + output : usage.totalTokenCount();

		history.addFirst(new AiUsageRecord(modelName, Instant.now(), input, output, total));
		while (history.size() > MAX_RECORDS) {
			history.pollLast();
		}
		logger.debug("AI model '{}' consumed {} tokens (input={}, output={})", modelName, total, input, output);
	}

	/**
	 * @return most recent usage records, latest first.
	 */
	public List<AiUsageRecord> getRecentRecords() {
		return List.copyOf(history);
	}

	/**
	 * @return per-model call count and token sums over the current window, keyed by model name.
	 */
	public Map<String, ModelUsage> getUsageByModel() {
		Map<String, ModelUsage> usage = new TreeMap<>();
		for (AiUsageRecord record : history) {
			usage.merge(record.modelName(),
					new ModelUsage(1, record.inputTokens(), record.outputTokens(), record.totalTokens()),
					ModelUsage::plus);
		}
		return usage;
	}

	public record ModelUsage(int calls, long inputTokens, long outputTokens, long totalTokens) {

		ModelUsage plus(ModelUsage other) {
			return new ModelUsage(calls + other.calls, inputTokens + other.inputTokens,
					outputTokens + other.outputTokens, totalTokens + other.totalTokens);
		}
	}
}
