package my.coursesearch.rag;

import my.coursesearch.catalog.CourseRecord;
import my.coursesearch.exception.EmbeddingException;
import my.coursesearch.exception.ValidationException;
import my.coursesearch.index.VectorIndex;
import my.coursesearch.support.CourseFixtures;
import my.coursesearch.support.HashingAiClient;
import my.coursesearch.support.TestPipeline;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CourseEmbeddingServiceTest {
    @TempDir
    Path tempDir;

    @Test
    void buildsPersistsAndInstallsIndex() {
        TestPipeline pipeline = new TestPipeline(
                List.of(CourseFixtures.pythonForDataScience(), CourseFixtures.deepLearningFundamentals()),
                new HashingAiClient(), tempDir);

        VectorIndex index = pipeline.embeddingService.rebuildAll();

        assertEquals(2, index.size());
        assertEquals(HashingAiClient.MODEL_NAME, index.getEmbeddingModel());
        assertSame(index, pipeline.activeIndex.current());
        assertEquals(2, pipeline.indexRepository.load(tempDir).size());
    }

    @Test
    void keepsChunkToCourseAssociationAcrossConcurrentBatches() {
        List<CourseRecord> records = List.of(
                course("Course A", "https://x/a"),
                course("Course B", "https://x/b"),
                course("Course C", "https://x/c"));
        HashingAiClient client = new HashingAiClient();
        TestPipeline pipeline = new TestPipeline(records, client, tempDir);

        VectorIndex index = pipeline.embeddingService.rebuildAll();

        assertTrue(index.size() > records.size(), "long descriptions should span several chunks");
        index.getEntries().forEach(entry -> {
            assertArrayEquals(client.embed(entry.chunk().text()), entry.vector());
            assertEquals(entry.chunk().sourceDocumentId(), entry.chunk().metadata().url());
        });
        assertEquals(List.of("https://x/a", "https://x/b", "https://x/c"), index.getEntries().stream()
                .map(e -> e.chunk().sourceDocumentId()).distinct().collect(Collectors.toList()));
    }

    @Test
    void dropsLaterDuplicatesByUrl() {
        CourseRecord first = CourseFixtures.pythonForDataScience();
        CourseRecord duplicate = new CourseRecord("Python for Data Science (copy)", "Another description", "Someone",
                "$10", List.of(), first.url());
        TestPipeline pipeline = new TestPipeline(List.of(first, duplicate), new HashingAiClient(), tempDir);

        VectorIndex index = pipeline.embeddingService.rebuildAll();

        assertEquals(1, index.size());
        assertEquals("Python for Data Science", index.getEntries().get(0).chunk().metadata().title());
    }

    @Test
    void invalidRecordFailsTheBuildAndKeepsPreviousIndex() {
        HashingAiClient client = new HashingAiClient();
        TestPipeline pipeline = new TestPipeline(List.of(CourseFixtures.pythonForDataScience()), client, tempDir);
        VectorIndex previous = pipeline.embeddingService.rebuildAll();

        TestPipeline broken = new TestPipeline(
                List.of(new CourseRecord("T", null, "I", "Free", List.of(), "https://x/broken")), client, tempDir);
        broken.activeIndex.install(previous);

        assertThrows(ValidationException.class, broken.embeddingService::rebuildAll);
        assertSame(previous, broken.activeIndex.current());
        assertEquals(1, broken.indexRepository.load(tempDir).size());
    }

    @Test
    void embeddingFailureIsFatalToTheBuild() {
        HashingAiClient failing = new HashingAiClient() {
            @Override
            public List<float[]> embed(List<String> texts) {
                throw new EmbeddingException("backend down");
            }
        };
        TestPipeline pipeline = new TestPipeline(List.of(CourseFixtures.pythonForDataScience()), failing, tempDir);

        assertThrows(EmbeddingException.class, pipeline.embeddingService::rebuildAll);
        assertTrue(pipeline.activeIndex.find().isEmpty());
        assertFalse(pipeline.indexRepository.exists(tempDir));
    }

    private static CourseRecord course(String title, String url) {
        String description = (title + " covers practical machine learning. ").repeat(30);
        return new CourseRecord(title, description, "Instructor", "Free", List.of("Intro", "Project"), url);
    }
}
