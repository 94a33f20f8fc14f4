package com.dcruver.promptloom.app;

import com.dcruver.promptloom.config.TagIndexProperties;
import com.dcruver.promptloom.nlp.EnglishPluralLemmatizer;
import com.dcruver.promptloom.nlp.TagTokenizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Beans shared by the indexer and the search service.
 */
@Configuration
@Slf4j
public class TagIndexConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public TagTokenizer tagTokenizer(TagIndexProperties properties) {
        if (properties.isLemmatize()) {
            log.info("Tag tokenizer reduces plurals to their singular form");
            return new TagTokenizer(new EnglishPluralLemmatizer());
        }
        return new TagTokenizer();
    }

    /**
     * Runs background syncs and search refreshes.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService indexingExecutor() {
        return Executors.newFixedThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, "tag-index-worker");
            thread.setDaemon(true);
            return thread;
        });
    }
}
