package my.coursesearch.index;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import my.coursesearch.exception.NotInitializedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Publishes the index that queries run against. A rebuilt index becomes visible
 * in a single swap, after it has been fully built and persisted.
 */
@Component
public class ActiveCourseIndex {

	private static final Logger logger = LoggerFactory.getLogger(ActiveCourseIndex.class);

	private final AtomicReference<VectorIndex> current = new AtomicReference<>();

	/**
	 * @throws NotInitializedException if no index has been installed yet.
	 */
	public VectorIndex current() {
		VectorIndex index = current.get();
		if (index == null) {
			throw new NotInitializedException("Course index has not been loaded or built yet");
		}
		return index;
	}

	public Optional<VectorIndex> find() {
		return Optional.ofNullable(current.get());
	}

	public void install(VectorIndex index) {
		VectorIndex previous = current.getAndSet(Objects.requireNonNull(index, "index"));
		logger.info("Installed course index with {} entries (replaced {})", index.size(),
				previous == null ? "nothing" : previous.size() + " entries");
	}
}
