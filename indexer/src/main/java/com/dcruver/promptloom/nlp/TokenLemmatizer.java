package com.dcruver.promptloom.nlp;

/**
 * Reduces a lower-cased token to its dictionary base form.
 */
@FunctionalInterface
public interface TokenLemmatizer {

    /**
     * @param token lower-cased token, never empty
     * @return base form; may throw on malformed input, callers fall back to the raw token
     */
    String lemmatize(String token);
}
