package my.coursesearch.rag;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Pipeline settings bound from {@code course-search.*}.
 */
@Component
@ConfigurationProperties(prefix = "course-search")
public class CourseSearchProperties {

	public static final String EMBEDDING_ALL_MINILM = "all-minilm-l6-v2";
	public static final String PROVIDER_OPENAI = "openai";
	public static final String PROVIDER_GEMINI = "gemini";

	/** JSON array of scraped course records. */
	private String dataFile = "data/courses_data.json";

	/** Directory holding the persisted vector index. */
	private String indexLocation = "data/vectorstore";

	private int chunkSize = CourseTextChunker.DEFAULT_CHUNK_SIZE;
	private int chunkOverlap = CourseTextChunker.DEFAULT_CHUNK_OVERLAP;
	private int topK = 3;

	/** {@code all-minilm-l6-v2} (in-process) or {@code openai}. */
	private String embeddingProvider = EMBEDDING_ALL_MINILM;

	/** {@code openai} or {@code gemini}. */
	private String generationProvider = PROVIDER_OPENAI;

	private int embeddingBatchSize = 64;
	private int embeddingConcurrency = 4;

	/** Rebuild from the data file on every start instead of loading the persisted index. */
	private boolean rebuildOnStartup;

	public String getDataFile() {
		return dataFile;
	}

	public void setDataFile(String dataFile) {
		this.dataFile = dataFile;
	}

	public String getIndexLocation() {
		return indexLocation;
	}

	public void setIndexLocation(String indexLocation) {
		this.indexLocation = indexLocation;
	}

	public int getChunkSize() {
		return chunkSize;
	}

	public void setChunkSize(int chunkSize) {
		this.chunkSize = chunkSize;
	}

	public int getChunkOverlap() {
		return chunkOverlap;
	}

	public void setChunkOverlap(int chunkOverlap) {
		this.chunkOverlap = chunkOverlap;
	}

	public int getTopK() {
		return topK;
	}

	public void setTopK(int topK) {
		this.topK = topK;
	}

	public String getEmbeddingProvider() {
		return embeddingProvider;
	}

	public void setEmbeddingProvider(String embeddingProvider) {
		this.embeddingProvider = embeddingProvider;
	}

	public String getGenerationProvider() {
		return generationProvider;
	}

	public void setGenerationProvider(String generationProvider) {
		this.generationProvider = generationProvider;
	}

	public int getEmbeddingBatchSize() {
		return embeddingBatchSize;
	}

	public void setEmbeddingBatchSize(int embeddingBatchSize) {
		this.embeddingBatchSize = embeddingBatchSize;
	}

	public int getEmbeddingConcurrency() {
		return embeddingConcurrency;
	}

	public void setEmbeddingConcurrency(int embeddingConcurrency) {
		this.embeddingConcurrency = embeddingConcurrency;
	}

	public boolean isRebuildOnStartup() {
		return rebuildOnStartup;
	}

	public void setRebuildOnStartup(boolean rebuildOnStartup) {
		this.rebuildOnStartup = rebuildOnStartup;
	}
}
