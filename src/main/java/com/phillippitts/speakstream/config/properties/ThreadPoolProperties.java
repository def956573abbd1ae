package com.phillippitts.speakstream.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the session worker pool.
 *
 * <p>Every live session runs its work serially on this shared pool; different sessions run in
 * parallel up to {@code max-pool-size}.
 */
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private SessionPoolProperties session = new SessionPoolProperties();

    public SessionPoolProperties getSession() {
        return session;
    }

    public void setSession(SessionPoolProperties session) {
        this.session = session;
    }

    /**
     * Session executor pool configuration.
     */
    public static class SessionPoolProperties {
        private int corePoolSize = 8;
        private int maxPoolSize = 32;
        private int queueCapacity = 1000;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "session-pool-";

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

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
