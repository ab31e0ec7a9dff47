package relay.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the realtime relay.
 *
 * @see RelayAutoConfiguration
 */
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

    /**
     * Database table name for outbox events.
     */
    private String tableName = "realtime_outbox_event";

    private final Dispatcher dispatcher = new Dispatcher();
    private final Retry retry = new Retry();
    private final Websocket websocket = new Websocket();
    private final Jwt jwt = new Jwt();
    private final Metrics metrics = new Metrics();
    private final Message message = new Message();

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public Retry getRetry() {
        return retry;
    }

    public Websocket getWebsocket() {
        return websocket;
    }

    public Jwt getJwt() {
        return jwt;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public Message getMessage() {
        return message;
    }

    public static class Dispatcher {
        /**
         * Whether the dispatcher thread starts with the application context.
         */
        private boolean enabled = true;
        private int batchSize = 100;
        private long intervalMs = 1000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }
    }

    public static class Retry {
        private long baseDelayMs = 500;
        private long maxDelayMs = 30_000;

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class Websocket {
        /**
         * Endpoint path clients connect to.
         */
        private String path = "/ws";
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
        private int maxFrameBytes = 4096;
        private int maxIdsPerSubscribe = 100;
        private int maxSubscriptions = 200;
        private int rateLimitCommands = 30;
        private Duration rateLimitWindow = Duration.ofSeconds(10);
        private Duration idleTimeout = Duration.ofSeconds(60);
        private Duration heartbeatInterval = Duration.ofSeconds(25);
        private Duration handshakeTimeout = Duration.ofSeconds(10);
        /**
         * Upper bound on a single blocked send before the socket is given up.
         */
        private Duration sendTimeLimit = Duration.ofSeconds(10);
        private int sendBufferSizeBytes = 512 * 1024;

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public List<String> getAllowedOrigins() {
            return allowedOrigins;
        }

        public void setAllowedOrigins(List<String> allowedOrigins) {
            this.allowedOrigins = allowedOrigins;
        }

        public int getMaxFrameBytes() {
            return maxFrameBytes;
        }

        public void setMaxFrameBytes(int maxFrameBytes) {
            this.maxFrameBytes = maxFrameBytes;
        }

        public int getMaxIdsPerSubscribe() {
            return maxIdsPerSubscribe;
        }

        public void setMaxIdsPerSubscribe(int maxIdsPerSubscribe) {
            this.maxIdsPerSubscribe = maxIdsPerSubscribe;
        }

        public int getMaxSubscriptions() {
            return maxSubscriptions;
        }

        public void setMaxSubscriptions(int maxSubscriptions) {
            this.maxSubscriptions = maxSubscriptions;
        }

        public int getRateLimitCommands() {
            return rateLimitCommands;
        }

        public void setRateLimitCommands(int rateLimitCommands) {
            this.rateLimitCommands = rateLimitCommands;
        }

        public Duration getRateLimitWindow() {
            return rateLimitWindow;
        }

        public void setRateLimitWindow(Duration rateLimitWindow) {
            this.rateLimitWindow = rateLimitWindow;
        }

        public Duration getIdleTimeout() {
            return idleTimeout;
        }

        public void setIdleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
        }

        public Duration getHeartbeatInterval() {
            return heartbeatInterval;
        }

        public void setHeartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
        }

        public Duration getHandshakeTimeout() {
            return handshakeTimeout;
        }

        public void setHandshakeTimeout(Duration handshakeTimeout) {
            this.handshakeTimeout = handshakeTimeout;
        }

        public Duration getSendTimeLimit() {
            return sendTimeLimit;
        }

        public void setSendTimeLimit(Duration sendTimeLimit) {
            this.sendTimeLimit = sendTimeLimit;
        }

        public int getSendBufferSizeBytes() {
            return sendBufferSizeBytes;
        }

        public void setSendBufferSizeBytes(int sendBufferSizeBytes) {
            this.sendBufferSizeBytes = sendBufferSizeBytes;
        }
    }

    public static class Jwt {
        /**
         * HMAC-SHA secret for access tokens; at least 32 bytes. No verifier is created when unset.
         */
        private String secret;

        public String getSecret() {
            return secret;
        }

        public void setSecret(String secret) {
            this.secret = secret;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "relay";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }

    public static class Message {
        private int maxContentLength = 2000;

        public int getMaxContentLength() {
            return maxContentLength;
        }

        public void setMaxContentLength(int maxContentLength) {
            this.maxContentLength = maxContentLength;
        }
    }
}
