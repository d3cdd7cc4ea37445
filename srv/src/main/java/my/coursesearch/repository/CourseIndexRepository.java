package my.coursesearch.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import my.coursesearch.exception.IncompatibleIndexException;
import my.coursesearch.exception.IndexNotFoundException;
import my.coursesearch.index.IndexEntry;
import my.coursesearch.index.VectorIndex;
import my.coursesearch.rag.CourseTextChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * Persists and loads course vector indexes.
 * <p>
 * An index lives in a directory as a single self-describing JSON file. Writes go
 * to a temporary file in the same directory that is then moved over the previous
 * file, so a reader sees either the old index or the new one.
 */
@Repository
public class CourseIndexRepository {

	private static final Logger logger = LoggerFactory.getLogger(CourseIndexRepository.class);

	static final String INDEX_FILE = "course-index.json";
	static final int FORMAT_VERSION = 1;

	private final ObjectMapper objectMapper;

	public CourseIndexRepository(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	public void persist(VectorIndex index, Path location) {
		List<StoredEntry> entries = new ArrayList<>(index.size());
		for (IndexEntry entry : index.getEntries()) {
			entries.add(new StoredEntry(entry.vector(), entry.chunk()));
		}
		StoredIndex stored = new StoredIndex(FORMAT_VERSION, index.getEmbeddingModel(), index.getDimension(),
				index.getCreatedAt().toString(), entries);

		Path target = location.resolve(INDEX_FILE);
		Path temp = null;
		try {
			Files.createDirectories(location);
			temp = Files.createTempFile(location, INDEX_FILE, ".tmp");
			objectMapper.writeValue(temp.toFile(), stored);
			moveIntoPlace(temp, target);
		} catch (IOException e) {
			deleteQuietly(temp);
			throw new UncheckedIOException("Failed to persist course index to " + location, e);
		}
		logger.info("Persisted course index with {} entries to {}", index.size(), target);
	}

	/**
	 * Loads an index and checks it was built with {@code expectedEmbeddingModel}.
	 *
	 * @throws IndexNotFoundException if nothing was ever persisted at {@code location}.
	 * @throws IncompatibleIndexException if format, model or dimensions do not match.
	 */
	public VectorIndex load(Path location, String expectedEmbeddingModel) {
		VectorIndex index = load(location);
		if (expectedEmbeddingModel != null && !expectedEmbeddingModel.equals(index.getEmbeddingModel())) {
			throw new IncompatibleIndexException("Index at %s was built with embedding model '%s', expected '%s'"
					.formatted(location, index.getEmbeddingModel(), expectedEmbeddingModel));
		}
		return index;
	}

	public VectorIndex load(Path location) {
		Path file = location.resolve(INDEX_FILE);
		if (!Files.isRegularFile(file)) {
			throw new IndexNotFoundException("No course index found at " + location);
		}
		StoredIndex stored;
		try {
			stored = objectMapper.readValue(file.toFile(), StoredIndex.class);
		} catch (IOException e) {
			throw new IncompatibleIndexException("Unreadable course index at " + file, e);
		}
		if (stored.formatVersion() != FORMAT_VERSION) {
			throw new IncompatibleIndexException("Unsupported index format version %d at %s"
					.formatted(stored.formatVersion(), file));
		}

		List<StoredEntry> storedEntries = stored.entries() == null ? List.of() : stored.entries();
		List<IndexEntry> entries = new ArrayList<>(storedEntries.size());
		for (StoredEntry entry : storedEntries) {
			int length = entry.vector() == null ? 0 : entry.vector().length;
			if (length != stored.dimension()) {
				throw new IncompatibleIndexException("Entry dimension %d does not match declared dimension %d in %s"
						.formatted(length, stored.dimension(), file));
			}
			entries.add(new IndexEntry(entry.vector(), entry.chunk()));
		}

		VectorIndex index = VectorIndex.build(stored.embeddingModel(), entries, parseInstant(stored.createdAt()));
		logger.info("Loaded course index with {} entries from {}", index.size(), file);
		return index;
	}

	public boolean exists(Path location) {
		return Files.isRegularFile(location.resolve(INDEX_FILE));
	}

	private void moveIntoPlace(Path temp, Path target) throws IOException {
		try {
			Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
		} catch (AtomicMoveNotSupportedException e) {
			logger.warn("Atomic move not supported for {}, falling back to plain replace", target);
			Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
		}
	}

	private void deleteQuietly(Path temp) {
		if (temp == null) {
			return;
		}
		try {
			Files.deleteIfExists(temp);
		} catch (IOException e) {
			logger.warn("Could not remove temporary index file {}", temp, e);
		}
	}

	private Instant parseInstant(String raw) {
		if (raw == null) {
			return Instant.EPOCH;
		}
		try {
			return Instant.parse(raw);
		} catch (DateTimeParseException e) {
			throw new IncompatibleIndexException("Invalid createdAt '%s' in course index".formatted(raw), e);
		}
	}

	public record StoredIndex(int formatVersion, String embeddingModel, int dimension, String createdAt,
			List<StoredEntry> entries) {
	}

	/**
	 * Serialization shape only; never compared, so the array-identity {@code equals} does not matter.
	 */
	public record StoredEntry(float[] vector, CourseTextChunk chunk) {
	}
}
