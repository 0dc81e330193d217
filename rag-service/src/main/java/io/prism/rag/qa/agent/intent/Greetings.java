package io.prism.rag.qa.agent.intent;

import io.prism.rag.retrieval.Tokenizer;

import java.util.Locale;

/**
 * Canned replies for queries the router sends straight to an answer.
 */
public final class Greetings {

    static final String INTRODUCTION = "I'm Prism, a research assistant. I can search your uploaded documents "
            + "and the web, then answer with citations to the passages I used. What would you like to know?";

    private Greetings() {
    }

    public static String reply(String query) {
        String normalized = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith("thank") || normalized.startsWith("谢谢")) {
            return Tokenizer.isCjkText(normalized) ? "不客气！还有什么可以帮您的吗？" : "You're welcome! Anything else I can help with?";
        }
        if (Tokenizer.isCjkText(normalized)) {
            return "你好！我是 Prism，可以检索您上传的文档和网络信息，并在回答中标注引用来源。请问有什么可以帮您？";
        }
        return "Hello! " + INTRODUCTION;
    }
}
