package com.dcruver.promptloom.nlp;

import org.apache.lucene.analysis.en.EnglishMinimalStemmer;

/**
 * Plural-to-singular lemmatizer built on Lucene's minimal English stemmer
 * ("shoulders" to "shoulder", "bodies" to "body"). It leaves everything else alone,
 * which keeps tags readable where a full Porter stem would not.
 */
public class EnglishPluralLemmatizer implements TokenLemmatizer {

    private final EnglishMinimalStemmer stemmer = new EnglishMinimalStemmer();

    @Override
    public String lemmatize(String token) {
        char[] buffer = token.toCharArray();
        int length = stemmer.stem(buffer, buffer.length);
        return new String(buffer, 0, length);
    }
}
