package my.coursesearch.handlers;

import java.util.List;
import java.util.Map;
import my.coursesearch.index.VectorIndex;
import my.coursesearch.rag.AiUsageRecord;
import my.coursesearch.rag.AiUsageTracker;
import my.coursesearch.rag.CourseEmbeddingService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator endpoints for the indexing job and AI usage.
 */
@RestController
@RequestMapping("/admin")
class AdminIndexHandler {

	private final CourseEmbeddingService embeddingService;
	private final AiUsageTracker usageTracker;

	AdminIndexHandler(CourseEmbeddingService embeddingService, AiUsageTracker usageTracker) {
		this.embeddingService = embeddingService;
		this.usageTracker = usageTracker;
	}

	@PostMapping("/index/rebuild")
	public ResponseEntity<RebuildSummary> rebuildIndex() {
		VectorIndex index = embeddingService.rebuildAll();
		return ResponseEntity.ok(new RebuildSummary(index.size(), index.getDimension(), index.getEmbeddingModel()));
	}

	@GetMapping("/ai-usage")
	public ResponseEntity<AiUsageSummary> aiUsage() {
		return ResponseEntity.ok(new AiUsageSummary(usageTracker.getUsageByModel(),
				usageTracker.getRecentRecords()));
	}

	public record RebuildSummary(int entries, int dimension, String embeddingModel) {
	}

	public record AiUsageSummary(Map<String, AiUsageTracker.ModelUsage> byModel, List<AiUsageRecord> recent) {
	}
}
