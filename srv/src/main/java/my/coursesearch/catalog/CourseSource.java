package my.coursesearch.catalog;

import java.util.List;

/**
 * Producer of raw course records, e.g. a scraper export or a catalogue feed.
 */
public interface CourseSource {

	List<CourseRecord> loadCourses();
}
