package io.prism.rag.retrieval;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Turns text into BM25 index terms.
 *
 * <p>Runs of letters and digits in space-delimited scripts become case-folded words. Runs of
 * CJK ideographs, kana and hangul have no word boundaries, so each run is emitted as its single
 * characters followed by its overlapping character bigrams. The same text always yields the same
 * term sequence, which keeps BM25 scores reproducible between indexing and querying.</p>
 */
public final class Tokenizer {

    private static final int MIN_WORD_LENGTH = 1;

    private Tokenizer() {
    }

    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptyList();
        }

        String normalized = Normalizer.normalize(text, Normalizer.Form.NFKC);
        List<String> terms = new ArrayList<>();
        StringBuilder word = new StringBuilder();
        StringBuilder cjkRun = new StringBuilder();

        int i = 0;
        while (i < normalized.length()) {
            int codePoint = normalized.codePointAt(i);
            i += Character.charCount(codePoint);

            if (isCjk(codePoint)) {
                flushWord(word, terms);
                cjkRun.appendCodePoint(codePoint);
            } else if (Character.isLetterOrDigit(codePoint)) {
                flushCjk(cjkRun, terms);
                word.appendCodePoint(codePoint);
            } else {
                flushWord(word, terms);
                flushCjk(cjkRun, terms);
            }
        }
        flushWord(word, terms);
        flushCjk(cjkRun, terms);
        return terms;
    }

    /**
     * Returns {@code true} when at least a third of the letters in the text belong to scripts
     * without whitespace word boundaries.
     */
    public static boolean isCjkText(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        int letters = 0;
        int cjk = 0;
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            i += Character.charCount(codePoint);
            if (isCjk(codePoint)) {
                cjk++;
                letters++;
            } else if (Character.isLetter(codePoint)) {
                letters++;
            }
        }
        return letters > 0 && cjk * 3 >= letters;
    }

    static boolean isCjk(int codePoint) {
        Character.UnicodeScript script = Character.UnicodeScript.of(codePoint);
        return script == Character.UnicodeScript.HAN
                || script == Character.UnicodeScript.HIRAGANA
                || script == Character.UnicodeScript.KATAKANA
                || script == Character.UnicodeScript.HANGUL;
    }

    private static void flushWord(StringBuilder word, List<String> terms) {
        if (word.length() >= MIN_WORD_LENGTH) {
            terms.add(word.toString().toLowerCase(Locale.ROOT));
        }
        word.setLength(0);
    }

    private static void flushCjk(StringBuilder run, List<String> terms) {
        if (run.length() == 0) {
            return;
        }
        int[] codePoints = run.codePoints().toArray();
        for (int codePoint : codePoints) {
            terms.add(new String(Character.toChars(codePoint)));
        }
        for (int j = 0; j + 1 < codePoints.length; j++) {
            terms.add(new String(codePoints, j, 2));
        }
        run.setLength(0);
    }
}
