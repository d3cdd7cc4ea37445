package my.coursesearch.support;

import java.util.List;
import my.coursesearch.catalog.CourseRecord;

public final class CourseFixtures {

	private CourseFixtures() {
	}

	public static CourseRecord pythonForDataScience() {
		return new CourseRecord(
				"Python for Data Science",
				"Use Python with pandas and NumPy to clean, explore and visualise data science datasets.",
				"Kunal Jain",
				"Free",
				List.of("Python basics", "Pandas dataframes", "Data visualisation"),
				"https://courses.example.com/courses/python-for-data-science");
	}

	public static CourseRecord deepLearningFundamentals() {
		return new CourseRecord(
				"Deep Learning Fundamentals",
				"Neural networks, backpropagation and convolutional architectures explained from first principles.",
				"Ankit Choudhary",
				"$49",
				List.of("Perceptrons", "Backpropagation", "CNNs"),
				"https://courses.example.com/courses/deep-learning-fundamentals");
	}
}
