package io.prism.rag.qa.agent.intent;

public record IntentClassification(Intent intent, double confidence, String reasoning) {

    public boolean isMultiStep() {
        return intent == Intent.COMPLEX_REASONING;
    }
}
