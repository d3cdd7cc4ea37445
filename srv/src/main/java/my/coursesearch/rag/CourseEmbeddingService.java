package my.coursesearch.rag;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import my.coursesearch.catalog.CourseRecord;
import my.coursesearch.catalog.CourseRecordNormalizer;
import my.coursesearch.catalog.CourseSource;
import my.coursesearch.catalog.NormalizedDocument;
import my.coursesearch.exception.EmbeddingException;
import my.coursesearch.index.ActiveCourseIndex;
import my.coursesearch.index.IndexEntry;
import my.coursesearch.index.VectorIndex;
import my.coursesearch.repository.CourseIndexRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Offline indexing job: normalize, chunk, embed, build, persist, then publish.
 * <p>
 * Any invalid record or embedding failure aborts the whole rebuild; the
 * previously active index stays in place.
 */
@Component
public class CourseEmbeddingService {

	private static final Logger logger = LoggerFactory.getLogger(CourseEmbeddingService.class);

	private final CourseSource courseSource;
	private final CourseRecordNormalizer normalizer;
	private final CourseTextChunker chunker;
	private final RagAiClient aiClient;
	private final CourseIndexRepository indexRepository;
	private final ActiveCourseIndex activeIndex;
	private final CourseSearchProperties properties;

	public CourseEmbeddingService(CourseSource courseSource, CourseRecordNormalizer normalizer,
			CourseTextChunker chunker, RagAiClient aiClient, CourseIndexRepository indexRepository,
			ActiveCourseIndex activeIndex, CourseSearchProperties properties) {
		this.courseSource = courseSource;
		this.normalizer = normalizer;
		this.chunker = chunker;
		this.aiClient = aiClient;
		this.indexRepository = indexRepository;
		this.activeIndex = activeIndex;
		this.properties = properties;
	}

	public synchronized VectorIndex rebuildAll() {
		List<CourseRecord> records = courseSource.loadCourses();
		logger.info("Loaded {} course records", records.size());

		List<NormalizedDocument> documents = normalizeAndDeduplicate(records);
		logger.info("Normalized {} course documents", documents.size());

		List<CourseTextChunk> chunks = new ArrayList<>();
		for (NormalizedDocument document : documents) {
			chunks.addAll(chunker.chunk(document));
		}
		logger.info("Split into {} chunks", chunks.size());

		List<float[]> vectors = embedChunks(chunks);
		List<IndexEntry> entries = new ArrayList<>(chunks.size());
		for (int i = 0; i < chunks.size(); i++) {
			entries.add(new IndexEntry(vectors.get(i), chunks.get(i)));
		}

		VectorIndex index = VectorIndex.build(aiClient.embeddingModelName(), entries);
		indexRepository.persist(index, Path.of(properties.getIndexLocation()));
		activeIndex.install(index);
		return index;
	}

	/**
	 * Keeps the first record seen for each url; later duplicates are dropped with a warning.
	 */
	List<NormalizedDocument> normalizeAndDeduplicate(List<CourseRecord> records) {
		Map<String, NormalizedDocument> byUrl = new LinkedHashMap<>();
		for (CourseRecord record : records) {
			NormalizedDocument document = normalizer.normalize(record);
			NormalizedDocument existing = byUrl.putIfAbsent(document.documentId(), document);
			if (existing != null) {
				logger.warn("Dropping duplicate course record for url {} (keeping '{}', dropping '{}')",
						document.documentId(), existing.metadata().title(), document.metadata().title());
			}
		}
		return List.copyOf(byUrl.values());
	}

	private List<float[]> embedChunks(List<CourseTextChunk> chunks) {
		if (chunks.isEmpty()) {
			return List.of();
		}
		int batchSize = Math.max(1, properties.getEmbeddingBatchSize());
		int threads = Math.max(1, properties.getEmbeddingConcurrency());
		ExecutorService executor = Executors.newFixedThreadPool(threads);
		try {
			List<Future<List<float[]>>> batches = new ArrayList<>();
			for (int i = 0; i < chunks.size(); i += batchSize) {
				int end = Math.min(chunks.size(), i + batchSize);
				List<String> batchTexts = chunks.subList(i, end).stream().map(CourseTextChunk::text).toList();
				batches.add(executor.submit(() -> embedBatch(batchTexts)));
			}

			List<float[]> vectors = new ArrayList<>(chunks.size());
			for (Future<List<float[]>> batch : batches) {
				vectors.addAll(await(batch));
			}
			return vectors;
		} finally {
			executor.shutdownNow();
		}
	}

	private List<float[]> embedBatch(List<String> texts) {
		List<float[]> vectors = aiClient.embed(texts);
		if (vectors.size() != texts.size()) {
			throw new EmbeddingException("Mismatch in embedding count. Expected %d, got %d"
					.formatted(texts.size(), vectors.size()));
		}
		return vectors;
	}

	private List<float[]> await(Future<List<float[]>> batch) {
		try {
			return batch.get();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new EmbeddingException("Interrupted while embedding chunks", e);
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException) {
				throw (RuntimeException) cause;
			}
			throw new EmbeddingException("Batch embedding failed", cause);
		}
	}
}
