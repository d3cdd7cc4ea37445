package my.coursesearch.rag;

import my.coursesearch.index.VectorIndex;
import my.coursesearch.support.CourseFixtures;
import my.coursesearch.support.HashingAiClient;
import my.coursesearch.support.TestPipeline;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CourseIndexBootstrapTest {
    @TempDir
    Path tempDir;

    @Test
    void buildsWhenNothingIsPersisted() {
        TestPipeline pipeline = pipeline(new HashingAiClient());

        bootstrap(pipeline).run(new DefaultApplicationArguments());

        assertEquals(2, pipeline.activeIndex.current().size());
        assertTrue(pipeline.indexRepository.exists(tempDir));
    }

    @Test
    void loadsPersistedIndexInsteadOfRebuilding() {
        TestPipeline first = pipeline(new HashingAiClient());
        VectorIndex built = first.embeddingService.rebuildAll();

        TestPipeline restarted = pipeline(new HashingAiClient());
        bootstrap(restarted).run(new DefaultApplicationArguments());

        assertEquals(built.getCreatedAt(), restarted.activeIndex.current().getCreatedAt());
    }

    @Test
    void rebuildsWhenPersistedIndexUsesAnotherModel() {
        HashingAiClient otherModel = new HashingAiClient(32) {
            @Override
            public String embeddingModelName() {
                return "other-model";
            }
        };
        pipeline(otherModel).embeddingService.rebuildAll();

        TestPipeline restarted = pipeline(new HashingAiClient());
        bootstrap(restarted).run(new DefaultApplicationArguments());

        assertEquals(HashingAiClient.MODEL_NAME, restarted.activeIndex.current().getEmbeddingModel());
        assertEquals(HashingAiClient.MODEL_NAME, restarted.indexRepository.load(tempDir).getEmbeddingModel());
    }

    @Test
    void rebuildOnStartupIgnoresPersistedIndex() {
        VectorIndex built = pipeline(new HashingAiClient()).embeddingService.rebuildAll();

        TestPipeline restarted = pipeline(new HashingAiClient());
        restarted.properties.setRebuildOnStartup(true);
        bootstrap(restarted).run(new DefaultApplicationArguments());

        assertNotSame(built, restarted.activeIndex.current());
        assertFalse(restarted.activeIndex.current().getCreatedAt().isBefore(built.getCreatedAt()));
    }

    private TestPipeline pipeline(HashingAiClient client) {
        return new TestPipeline(
                List.of(CourseFixtures.pythonForDataScience(), CourseFixtures.deepLearningFundamentals()),
                client, tempDir);
    }

    private CourseIndexBootstrap bootstrap(TestPipeline pipeline) {
        return new CourseIndexBootstrap(pipeline.properties, pipeline.indexRepository, pipeline.embeddingService,
                pipeline.activeIndex, pipeline.aiClient);
    }
}
