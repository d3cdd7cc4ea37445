package my.coursesearch.rag;

import java.util.ArrayList;
import java.util.List;
import my.coursesearch.catalog.NormalizedDocument;
import my.coursesearch.exception.ConfigException;

/**
 * Splits normalized course documents into overlapping character windows.
 * <p>
 * Each window ends at the best available break inside its back half: a paragraph
 * break first, then a line or sentence end, then whitespace, and only if none of
 * those exist a hard cut at the maximum size. The next window starts exactly
 * {@code chunkOverlap} characters before the previous one ended.
 */
public class CourseTextChunker {

	public static final int DEFAULT_CHUNK_SIZE = 500;
	public static final int DEFAULT_CHUNK_OVERLAP = 50;

	private static final String[] SENTENCE_BREAKS = { "\n", ". ", "! ", "? " };

	private final int chunkSize;
	private final int chunkOverlap;

	public CourseTextChunker() {
		this(DEFAULT_CHUNK_SIZE, DEFAULT_CHUNK_OVERLAP);
	}

	public CourseTextChunker(int chunkSize, int chunkOverlap) {
		if (chunkSize <= 0) {
			throw new ConfigException("Chunk size must be positive, got " + chunkSize);
		}
		if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
			throw new ConfigException("Chunk overlap must be in [0, %d), got %d".formatted(chunkSize, chunkOverlap));
		}
		this.chunkSize = chunkSize;
		this.chunkOverlap = chunkOverlap;
	}

	public List<CourseTextChunk> chunk(NormalizedDocument document) {
		if (document == null || document.text() == null || document.text().isEmpty()) {
			return List.of();
		}
		List<CourseTextChunk> chunks = new ArrayList<>();
		int index = 0;
		for (int[] window : split(document.text())) {
			chunks.add(new CourseTextChunk(
					document.documentId(),
					index++,
					document.text().substring(window[0], window[1]),
					document.metadata()));
		}
		return chunks;
	}

	public int getChunkSize() {
		return chunkSize;
	}

	public int getChunkOverlap() {
		return chunkOverlap;
	}

	private List<int[]> split(String text) {
		List<int[]> windows = new ArrayList<>();
		int start = 0;
		while (true) {
			int limit = Math.min(text.length(), start + chunkSize);
			if (limit == text.length()) {
				windows.add(new int[] { start, limit });
				return windows;
			}
			int end = findBoundary(text, start, limit);
			windows.add(new int[] { start, end });
			start = end - chunkOverlap;
		}
	}

	/**
	 * @return an end offset in {@code (start + chunkOverlap, limit]}, so the next
	 *         window always starts after the current one.
	 */
	private int findBoundary(String text, int start, int limit) {
		int floor = start + Math.max(chunkOverlap + 1, chunkSize / 2);
		if (floor > limit) {
			return limit;
		}
		String window = text.substring(0, limit);

		int paragraph = window.lastIndexOf("\n\n");
		if (paragraph >= 0 && paragraph + 2 >= floor) {
			return paragraph + 2;
		}

		int sentence = -1;
		for (String separator : SENTENCE_BREAKS) {
			int at = window.lastIndexOf(separator);
			if (at >= 0) {
				sentence = Math.max(sentence, at + separator.length());
			}
		}
		if (sentence >= floor) {
			return sentence;
		}

		for (int i = limit; i >= floor; i--) {
			if (Character.isWhitespace(text.charAt(i - 1))) {
				return i;
			}
		}
		return limit;
	}
}
