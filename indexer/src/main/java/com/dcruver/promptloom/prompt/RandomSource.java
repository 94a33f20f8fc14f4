package com.dcruver.promptloom.prompt;

import java.util.Random;

/**
 * Supplies the random generator used to pick prompt entries.
 */
public interface RandomSource {

    /**
     * @param seed fixed seed, or {@code null} for an unseeded generator
     * @return a generator that repeats its picks for the same non-null seed
     */
    Random create(Integer seed);
}
