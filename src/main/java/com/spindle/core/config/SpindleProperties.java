package com.spindle.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "spindle")
public class SpindleProperties {

    private Workers workers = new Workers();

    // -- Worker accessors (delegate to nested) --
    public Duration getTickPeriod() { return workers.tickPeriod; }
    public Duration getStartDelay() { return workers.startDelay; }
    public Long getRandomSeed() { return workers.randomSeed; }

    /**
     * Number of workers the initializer starts when no {@code --threads} flag is given.
     * Falls back to the number of available processors.
     */
    public int resolveWorkerCount() {
        if (workers.count != null) {
            return workers.count;
        }
        return Runtime.getRuntime().availableProcessors();
    }

    public Workers getWorkers() { return workers; }
    public void setWorkers(Workers workers) { this.workers = workers; }

    public static class Workers {
        private Integer count;
        private Duration startDelay = Duration.ofSeconds(1);
        private Duration tickPeriod = Duration.ofSeconds(1);
        private Long randomSeed;

        public Integer getCount() { return count; }
        public void setCount(Integer count) { this.count = count; }
        public Duration getStartDelay() { return startDelay; }
        public void setStartDelay(Duration startDelay) { this.startDelay = startDelay; }
        public Duration getTickPeriod() { return tickPeriod; }
        public void setTickPeriod(Duration tickPeriod) { this.tickPeriod = tickPeriod; }
        public Long getRandomSeed() { return randomSeed; }
        public void setRandomSeed(Long randomSeed) { this.randomSeed = randomSeed; }
    }
}
