package com.dcruver.promptloom.prompt;

import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * New {@link Random} per seed; one shared generator when no seed is given.
 */
@Component
public class SystemRandomSource implements RandomSource {

    private final Random shared = new Random();

    @Override
    public Random create(Integer seed) {
        return seed != null ? new Random(seed) : shared;
    }
}
