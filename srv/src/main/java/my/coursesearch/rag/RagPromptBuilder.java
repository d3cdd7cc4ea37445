package my.coursesearch.rag;

import java.util.ArrayList;
import java.util.List;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.input.Prompt;
import my.coursesearch.index.ChunkMatch;

import org.springframework.stereotype.Component;

/**
 * Builds a single "stuffed" prompt: every retrieved chunk goes into one context
 * block followed by the question.
 */
@Component
public class RagPromptBuilder {

	private static final Prompt SYSTEM_PROMPT = Prompt
			.from("""
					You are a helpful assistant for an online course catalogue.
					Use only the pieces of context provided with the question to answer it.
					If the context does not contain the answer, say that you don't know; do not make up courses, prices or instructors.
					Keep your response short and concise.
					""");

	public List<ChatMessage> buildMessages(String question, List<ChunkMatch> context) {
		List<ChatMessage> messages = new ArrayList<>(2);
		messages.add(SYSTEM_PROMPT.toSystemMessage());

		StringBuilder userMessage = new StringBuilder();
		userMessage.append("CONTEXT:\n");
		if (context != null) {
			for (ChunkMatch match : context) {
				userMessage.append(match.chunk().text()).append("\n\n");
			}
		}
		userMessage.append("QUESTION: ").append(question);

		messages.add(UserMessage.from(userMessage.toString()));
		return messages;
	}
}
