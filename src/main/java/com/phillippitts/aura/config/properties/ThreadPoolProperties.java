package com.phillippitts.aura.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>Sizes the evidence executor that runs the search and image-analysis branches of a run.
 * Each run submits at most four tasks, so the default max of 64 threads serves sixteen runs at
 * once. The queue capacity defaults to 0: a queued branch would wait behind other runs' blocking
 * calls and miss its own evidence deadline.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private EvidencePoolProperties evidence = new EvidencePoolProperties();

    public EvidencePoolProperties getEvidence() {
        return evidence;
    }

    public void setEvidence(EvidencePoolProperties evidence) {
        this.evidence = evidence;
    }

    /**
     * Evidence executor pool configuration.
     */
    public static class EvidencePoolProperties {
        private int corePoolSize = 8;
        private int maxPoolSize = 64;
        private int queueCapacity = 0;
        private int keepAliveSeconds = 60;
        private int awaitTerminationSeconds = 30;
        private String threadNamePrefix = "evidence-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public int getAwaitTerminationSeconds() {
            return awaitTerminationSeconds;
        }

        public void setAwaitTerminationSeconds(int awaitTerminationSeconds) {
            this.awaitTerminationSeconds = awaitTerminationSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
