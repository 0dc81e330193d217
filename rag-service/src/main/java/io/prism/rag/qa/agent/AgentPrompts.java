package io.prism.rag.qa.agent;

import io.prism.rag.qa.agent.intent.IntentClassification;

import java.time.LocalDate;

/**
 * Prompt text used by {@link ReActAgent}.
 */
public final class AgentPrompts {

    public static final String CITATION_MARKER = "[[citation:";

    public static final String FINAL_ANSWER_PREFIX = "Final Answer:";

    public static final String CONTINUE = "Please continue with a tool call or use the 'finish' tool to provide your answer.";

    public static final String NO_INFORMATION = "I couldn't find enough information to answer this question.";

    static final String SYNTHESIZE = """
            You have run out of steps. Using only the tool results above, write the best answer you can \
            to the original question. Cite the results you rely on with [[citation:N]]. If the results \
            do not cover part of the question, say so briefly.""";

    private AgentPrompts() {
    }

    public static String system(LocalDate today) {
        return """
                You are Prism, a research assistant that answers questions using tools.
                Current date: %s.

                HOW TO WORK:
                1. Think about what information you need, then call one tool at a time.
                2. Break compound questions apart. To compare Tesla and SpaceX, search for Tesla and \
                SpaceX separately rather than in one query.
                3. Use document_search for the user's uploaded documents and web_search for recent or \
                public information.
                4. When you have enough information, call the finish tool with the complete answer.

                CITATIONS:
                - Every search result carries a "citation" number.
                - Cite facts inline with [[citation:N]] right after the sentence that uses them, for \
                example: Revenue grew 12%% [[citation:3]].
                - Only cite numbers that appeared in tool results. Never invent citations.

                AVOID LOOPS:
                - Do not repeat a search with the same query.
                - If two searches return nothing useful, answer with what you have and say what is missing.""".formatted(today);
    }

    public static String task(String query, String userId, IntentClassification classification) {
        StringBuilder task = new StringBuilder()
                .append("User ID: ").append(userId).append('\n')
                .append("Question: ").append(query);
        if (classification != null && classification.isMultiStep()) {
            task.append("\n\nThis question needs several pieces of information. Search for each entity or ")
                    .append("sub-question separately before answering.");
        }
        return task.toString();
    }
}
