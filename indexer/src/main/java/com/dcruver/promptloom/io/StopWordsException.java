package com.dcruver.promptloom.io;

/**
 * The stop-words document could not be created or parsed.
 */
public class StopWordsException extends RuntimeException {

    public StopWordsException(String message) {
        super(message);
    }

    public StopWordsException(String message, Throwable cause) {
        super(message, cause);
    }
}
