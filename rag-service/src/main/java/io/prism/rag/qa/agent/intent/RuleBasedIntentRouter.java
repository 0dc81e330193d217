package io.prism.rag.qa.agent.intent;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Keyword classifier. Also the fallback of {@link LlmIntentRouter}.
 */
public class RuleBasedIntentRouter implements IntentRouter {

    private static final Pattern GREETING = Pattern.compile(
            "^(hi|hello|hey|good (morning|afternoon|evening)|thanks|thank you|who are you|what are you"
                    + "|what can you do|你好|您好|谢谢|你是谁)[\\s!?.,！？。]*$");

    private static final Pattern COMPARISON = Pattern.compile(
            "\\b(compare|comparison|versus|vs\\.?|difference between|differences between)\\b|对比|比较|区别");

    private static final Pattern AGGREGATION = Pattern.compile("\\b(list all|summari[sz]e all|each of)\\b|所有|列出");

    private static final List<String> REAL_TIME = List.of(
            "today", "latest", "current", "news", "right now", "this week", "stock price", "weather",
            "最新", "今天", "新闻");

    @Override
    public IntentClassification classify(String query) {
        String normalized = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);

        if (normalized.isEmpty() || GREETING.matcher(normalized).matches()) {
            return new IntentClassification(Intent.DIRECT_ANSWER, 0.95d, "greeting or identity question");
        }
        if (COMPARISON.matcher(normalized).find() || AGGREGATION.matcher(normalized).find()) {
            return new IntentClassification(Intent.COMPLEX_REASONING, 0.85d, "comparison or aggregation");
        }
        if (REAL_TIME.stream().anyMatch(normalized::contains)) {
            return new IntentClassification(Intent.WEB_SEARCH, 0.8d, "asks for current information");
        }
        return new IntentClassification(Intent.DOCUMENT_QA, 0.7d, "default document question");
    }
}
