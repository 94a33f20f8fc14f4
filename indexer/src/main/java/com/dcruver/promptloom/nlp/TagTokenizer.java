package com.dcruver.promptloom.nlp;

import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Splits text into tags.
 *
 * A token is a maximal run of letters or digits; every other character separates tokens.
 * Tokens are lower-cased, stop words are dropped, and the optional lemmatizer reduces what
 * remains to its base form. A token whose base form is a stop word is dropped too. Counts are accumulated per call.
 */
@Slf4j
public class TagTokenizer {

    private static final AtomicBoolean LEMMATIZER_FAILURE_LOGGED = new AtomicBoolean();

    private final TokenLemmatizer lemmatizer;

    public TagTokenizer() {
        this(null);
    }

    public TagTokenizer(TokenLemmatizer lemmatizer) {
        this.lemmatizer = lemmatizer;
    }

    /**
     * Tokenize the segments and count each token.
     *
     * @return token to occurrence count, in first-seen order; never null
     */
    public Map<String, Integer> tokenize(Iterable<String> segments, Set<String> stopWords) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        if (segments == null) {
            return counts;
        }
        for (String segment : segments) {
            addTokens(counts, segment, stopWords);
        }
        return counts;
    }

    private void addTokens(Map<String, Integer> counts, String segment, Set<String> stopWords) {
        if (segment == null || segment.isBlank()) {
            return;
        }

        int tokenStart = -1;
        int i = 0;
        while (i <= segment.length()) {
            int codePoint = i < segment.length() ? segment.codePointAt(i) : -1;
            boolean tokenChar = codePoint >= 0 && Character.isLetterOrDigit(codePoint);

            if (tokenChar) {
                if (tokenStart < 0) {
                    tokenStart = i;
                }
            } else if (tokenStart >= 0) {
                String token = segment.substring(tokenStart, i).toLowerCase(Locale.ROOT);
                tokenStart = -1;

                if (!isStopWord(token, stopWords)) {
                    String lemma = lemmatize(token);
                    // "others" is dropped along with "other"
                    if (!isStopWord(lemma, stopWords)) {
                        counts.merge(lemma, 1, Integer::sum);
                    }
                }
            }

            i += codePoint >= 0 ? Character.charCount(codePoint) : 1;
        }
    }

    private static boolean isStopWord(String token, Set<String> stopWords) {
        return stopWords != null && stopWords.contains(token);
    }

    private String lemmatize(String token) {
        if (lemmatizer == null) {
            return token;
        }
        try {
            String lemma = lemmatizer.lemmatize(token);
            return lemma == null || lemma.isBlank() ? token : lemma;
        } catch (RuntimeException e) {
            if (LEMMATIZER_FAILURE_LOGGED.compareAndSet(false, true)) {
                log.warn("Lemmatizer failed on '{}', using raw tokens where it fails: {}", token, e.getMessage());
            }
            return token;
        }
    }
}
