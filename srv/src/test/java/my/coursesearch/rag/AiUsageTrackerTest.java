package my.coursesearch.rag;

import dev.langchain4j.model.output.TokenUsage;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AiUsageTrackerTest {

    @Test
    void keepsLatestFirstAndTotalsPerModel() {
        AiUsageTracker tracker = new AiUsageTracker();
        tracker.recordUsage("gpt-4o-mini", new TokenUsage(10, 5));
        tracker.recordUsage("text-embedding-3-small", new TokenUsage(7, 0));
        tracker.recordUsage("gpt-4o-mini", new TokenUsage(3, 2));
        tracker.recordUsage("", new TokenUsage(1, 1));
        tracker.recordUsage("gpt-4o-mini", null);

        assertEquals(3, tracker.getRecentRecords().size());
        assertEquals(5, tracker.getRecentRecords().get(0).totalTokens());
        Map<String, AiUsageTracker.ModelUsage> byModel = tracker.getUsageByModel();
        assertEquals(new AiUsageTracker.ModelUsage(2, 13, 7, 20), byModel.get("gpt-4o-mini"));
        assertEquals(new AiUsageTracker.ModelUsage(1, 7, 0, 7), byModel.get("text-embedding-3-small"));
        assertEquals(2, byModel.size());
    }

    @Test
    void historyIsBounded() {
        AiUsageTracker tracker = new AiUsageTracker();
        for (int i = 0; i < 250; i++) {
            tracker.recordUsage("m", new TokenUsage(1, 1));
        }
        assertEquals(AiUsageTracker.MAX_RECORDS, tracker.getRecentRecords().size());
        assertEquals(AiUsageTracker.MAX_RECORDS, tracker.getUsageByModel().get("m").calls());
    }
}
