package io.prism.rag.qa.agent;

public enum TerminationReason {
    /** The model called {@code finish} or gave a complete plain-text answer. */
    FINISHED,
    /** {@code max_steps} ran out; the answer was synthesized from the observations. */
    STEP_LIMIT_REACHED,
    /** The intent router answered without entering the loop. */
    DIRECT_ANSWER
}
