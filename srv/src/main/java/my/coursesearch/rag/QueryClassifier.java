package my.coursesearch.rag;

/**
 * Decides whether a query is worth running retrieval and generation for.
 */
public interface QueryClassifier {

	boolean isInDomain(String query);
}
