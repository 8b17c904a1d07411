package com.spindle.core.config;

import com.spindle.core.worker.InitialValueSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring {@link Configuration} for worker collaborators that are not components themselves.
 */
@Configuration
public class WorkerConfig {

    private static final Logger log = LoggerFactory.getLogger(WorkerConfig.class);

    /**
     * Random initial counter values, seeded once per process. A fixed
     * {@code spindle.workers.random-seed} makes the sequence repeatable.
     */
    @Bean
    public InitialValueSource initialValueSource(SpindleProperties properties) {
        Long configured = properties.getRandomSeed();
        long seed = configured != null ? configured : System.nanoTime();
        log.info("Seeding worker initial values with {}{}", seed, configured != null ? " (configured)" : "");
        return InitialValueSource.seeded(seed);
    }
}
