package my.coursesearch.index;

import java.util.Arrays;
import java.util.Objects;
import my.coursesearch.rag.CourseTextChunk;

/**
 * A chunk together with its embedding. The vector is copied on the way in and on
 * the way out, so an entry cannot be changed after construction.
 */
public record IndexEntry(float[] vector, CourseTextChunk chunk) {

	public IndexEntry {
		vector = vector == null ? null : vector.clone();
	}

	@Override
	public float[] vector() {
		return vector == null ? null : vector.clone();
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof IndexEntry)) {
			return false;
		}
		IndexEntry that = (IndexEntry) other;
		return Arrays.equals(vector, that.vector) && Objects.equals(chunk, that.chunk);
	}

	@Override
	public int hashCode() {
		return 31 * Arrays.hashCode(vector) + Objects.hashCode(chunk);
	}

	@Override
	public String toString() {
		return "IndexEntry[vector=" + Arrays.toString(vector) + ", chunk=" + chunk + "]";
	}
}
