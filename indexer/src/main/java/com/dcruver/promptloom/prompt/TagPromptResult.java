package com.dcruver.promptloom.prompt;

import lombok.Value;

import java.util.List;

/**
 * Prompt built from a file selection, plus a message for every file that contributed nothing.
 */
@Value
public class TagPromptResult {
    String prompt;
    List<String> messages;

    public boolean isEmpty() {
        return prompt.isBlank();
    }
}
