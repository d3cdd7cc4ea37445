package my.coursesearch.index;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import my.coursesearch.exception.IncompatibleIndexException;

/**
 * Immutable exact nearest-neighbour index over chunk embeddings.
 * <p>
 * Similarity is cosine similarity. Results are ordered by descending score, and
 * equal scores keep insertion order, so identical inputs always produce identical
 * rankings. A new index is built from scratch whenever the catalogue changes;
 * entries are never added or removed in place.
 */
public final class VectorIndex {

	private static final Comparator<Scored> RANKING = Comparator
			.comparingDouble(Scored::score).reversed()
			.thenComparingInt(Scored::position);

	private final String embeddingModel;
	private final int dimension;
	private final Instant createdAt;
	private final List<IndexEntry> entries;
	private final float[][] vectors;

	private VectorIndex(String embeddingModel, int dimension, Instant createdAt, List<IndexEntry> entries,
			float[][] vectors) {
		this.embeddingModel = embeddingModel;
		this.dimension = dimension;
		this.createdAt = createdAt;
		this.entries = entries;
		this.vectors = vectors;
	}

	public static VectorIndex build(String embeddingModel, List<IndexEntry> entries) {
		return build(embeddingModel, entries, Instant.now());
	}

	/**
	 * @throws IncompatibleIndexException if the entries do not share one non-zero dimension.
	 */
	public static VectorIndex build(String embeddingModel, List<IndexEntry> entries, Instant createdAt) {
		List<IndexEntry> copy = new ArrayList<>(entries == null ? 0 : entries.size());
		float[][] vectors = new float[entries == null ? 0 : entries.size()][];
		int dimension = 0;
		if (entries != null) {
			for (IndexEntry entry : entries) {
				float[] vector = entry.vector();
				if (vector == null || vector.length == 0) {
					throw new IncompatibleIndexException("Empty vector for chunk %d of %s"
							.formatted(entry.chunk().index(), entry.chunk().sourceDocumentId()));
				}
				if (dimension == 0) {
					dimension = vector.length;
				} else if (vector.length != dimension) {
					throw new IncompatibleIndexException("Vector dimension %d does not match index dimension %d"
							.formatted(vector.length, dimension));
				}
				vectors[copy.size()] = vector;
				copy.add(new IndexEntry(vector, entry.chunk()));
			}
		}
		return new VectorIndex(embeddingModel, dimension, createdAt, List.copyOf(copy), vectors);
	}

	public List<ChunkMatch> search(float[] queryVector, int k) {
		if (entries.isEmpty() || k <= 0) {
			return List.of();
		}
		if (queryVector == null || queryVector.length != dimension) {
			throw new IncompatibleIndexException("Query vector dimension %d does not match index dimension %d"
					.formatted(queryVector == null ? 0 : queryVector.length, dimension));
		}
		double queryNorm = norm(queryVector);
		List<Scored> scored = new ArrayList<>(entries.size());
		for (int i = 0; i < entries.size(); i++) {
			scored.add(new Scored(i, cosine(queryVector, queryNorm, vectors[i])));
		}
		return scored.stream()
				.sorted(RANKING)
				.limit(k)
				.map(s -> new ChunkMatch(entries.get(s.position()).chunk(), s.score()))
				.toList();
	}

	public String getEmbeddingModel() {
		return embeddingModel;
	}

	/**
	 * @return vector length shared by all entries, or 0 for an empty index.
	 */
	public int getDimension() {
		return dimension;
	}

	public Instant getCreatedAt() {
		return createdAt;
	}

	/**
	 * @return the entries in insertion order; their vectors are copies.
	 */
	public List<IndexEntry> getEntries() {
		return entries;
	}

	public int size() {
		return entries.size();
	}

	private static double cosine(float[] query, double queryNorm, float[] candidate) {
		double candidateNorm = norm(candidate);
		if (queryNorm == 0.0 || candidateNorm == 0.0) {
			return 0.0;
		}
		double dot = 0.0;
		for (int i = 0; i < query.length; i++) {
			dot += (double) query[i] * candidate[i];
		}
		return dot / (queryNorm * candidateNorm);
	}

	private static double norm(float[] vector) {
		double sum = 0.0;
		for (float value : vector) {
			sum += (double) value * value;
		}
		return Math.sqrt(sum);
	}

	private record Scored(int position, double score) {
	}
}
