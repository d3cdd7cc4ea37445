package my.coursesearch.catalog;

import my.coursesearch.exception.ValidationException;
import my.coursesearch.support.CourseFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CourseRecordNormalizerTest {
    private final CourseRecordNormalizer normalizer = new CourseRecordNormalizer();

    @Test
    void serializesLabelledFieldsInFixedOrder() {
        NormalizedDocument doc = normalizer.normalize(CourseFixtures.deepLearningFundamentals());

        assertEquals("""
                Title: Deep Learning Fundamentals
                Description: Neural networks, backpropagation and convolutional architectures explained from first principles.
                Instructor: Ankit Choudhary
                Price: $49
                Curriculum: Perceptrons | Backpropagation | CNNs
                URL: https://courses.example.com/courses/deep-learning-fundamentals""", doc.text());
        assertEquals(new CourseMetadata("Deep Learning Fundamentals",
                "https://courses.example.com/courses/deep-learning-fundamentals", "$49", "Ankit Choudhary"), doc.metadata());
    }

    @Test
    void normalizingTwiceGivesIdenticalText() {
        CourseRecord record = CourseFixtures.pythonForDataScience();
        assertEquals(normalizer.normalize(record).text(), normalizer.normalize(record).text());
    }

    @Test
    void emptyOrMissingCurriculumIsNotAnError() {
        CourseRecord record = new CourseRecord("T", "D", "I", "Free", null, "https://x/1");
        NormalizedDocument doc = normalizer.normalize(record);
        assertTrue(doc.text().contains("\nCurriculum: \n"));
        assertEquals(doc.text(), normalizer.normalize(new CourseRecord("T", "D", "I", "Free", List.of(), "https://x/1")).text());
    }

    @Test
    void rejectsRecordMissingRequiredField() {
        CourseRecord noInstructor = new CourseRecord("T", "D", null, "Free", List.of(), "https://x/1");
        ValidationException ex = assertThrows(ValidationException.class, () -> normalizer.normalize(noInstructor));
        assertTrue(ex.getMessage().contains("instructor"));

        assertThrows(ValidationException.class,
                () -> normalizer.normalize(new CourseRecord("T", "D", "I", "Free", List.of(), null)));
        assertThrows(ValidationException.class, () -> normalizer.normalize(null));
    }
}
