package com.example.omnichat.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "omnichat")
public class OmnichatProperties {

    @NestedConfigurationProperty
    private final Redis redis = new Redis();

    @NestedConfigurationProperty
    private final Kafka kafka = new Kafka();

    @NestedConfigurationProperty
    private final Presence presence = new Presence();

    @NestedConfigurationProperty
    private final AutoReply autoReply = new AutoReply();

    @NestedConfigurationProperty
    private final Channels channels = new Channels();

    @NestedConfigurationProperty
    private final Crypto crypto = new Crypto();

    @NestedConfigurationProperty
    private final Conversation conversation = new Conversation();

    public Redis getRedis() {
        return redis;
    }

    public Kafka getKafka() {
        return kafka;
    }

    public Presence getPresence() {
        return presence;
    }

    public AutoReply getAutoReply() {
        return autoReply;
    }

    public Channels getChannels() {
        return channels;
    }

    public Crypto getCrypto() {
        return crypto;
    }

    public Conversation getConversation() {
        return conversation;
    }

    @Validated
    public static class Redis {

        /**
         * Prefix applied to every Redis key and topic owned by the relay.
         */
        @NotBlank
        private String keyPrefix = "omnichat";

        /**
         * Lease of the per-identity resolver lock. A holder that dies releases the key after this long.
         */
        private Duration lockLease = Duration.ofSeconds(10);

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public Duration getLockLease() {
            return lockLease;
        }

        public void setLockLease(Duration lockLease) {
            this.lockLease = lockLease;
        }
    }

    @Validated
    public static class Kafka {

        /**
         * Topic carrying normalised inbound channel messages between the webhooks and the processor.
         */
        @NotBlank
        private String inboundTopic = "omnichat.inbound";

        private int partitions = 12;

        /**
         * Delivery attempts after the first failure before the record is given up.
         */
        @Min(0)
        private int retryAttempts = 3;

        private Duration retryInitialInterval = Duration.ofSeconds(1);

        private double retryMultiplier = 2.0;

        private Duration retryMaxInterval = Duration.ofSeconds(10);

        public String getInboundTopic() {
            return inboundTopic;
        }

        public void setInboundTopic(String inboundTopic) {
            this.inboundTopic = inboundTopic;
        }

        public int getPartitions() {
            return partitions;
        }

        public void setPartitions(int partitions) {
            this.partitions = partitions;
        }

        public int getRetryAttempts() {
            return retryAttempts;
        }

        public void setRetryAttempts(int retryAttempts) {
            this.retryAttempts = retryAttempts;
        }

        public Duration getRetryInitialInterval() {
            return retryInitialInterval;
        }

        public void setRetryInitialInterval(Duration retryInitialInterval) {
            this.retryInitialInterval = retryInitialInterval;
        }

        public double getRetryMultiplier() {
            return retryMultiplier;
        }

        public void setRetryMultiplier(double retryMultiplier) {
            this.retryMultiplier = retryMultiplier;
        }

        public Duration getRetryMaxInterval() {
            return retryMaxInterval;
        }

        public void setRetryMaxInterval(Duration retryMaxInterval) {
            this.retryMaxInterval = retryMaxInterval;
        }
    }

    @Validated
    public static class Presence {

        /**
         * Interval at which widget clients are expected to send a heartbeat.
         */
        private Duration heartbeatInterval = Duration.ofSeconds(30);

        /**
         * Silence after which a widget customer is considered offline. Twice the heartbeat interval.
         */
        private Duration timeout = Duration.ofSeconds(60);

        /**
         * How often stale presence records are swept.
         */
        private Duration sweepInterval = Duration.ofSeconds(10);

        public Duration getHeartbeatInterval() {
            return heartbeatInterval;
        }

        public void setHeartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Duration getSweepInterval() {
            return sweepInterval;
        }

        public void setSweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
        }
    }

    @Validated
    public static class AutoReply {

        /**
         * URL of the reply-generation service. Auto-replies are skipped when empty.
         */
        private String endpoint;

        /**
         * Hard limit for a single generation, including the HTTP round trip.
         */
        private Duration timeout = Duration.ofSeconds(15);

        /**
         * Number of most recent messages handed to the generator as conversation memory.
         */
        @Min(1)
        private int historyWindow = 20;

        private int corePoolSize = 4;

        private int maxPoolSize = 16;

        private int queueCapacity = 200;

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getHistoryWindow() {
            return historyWindow;
        }

        public void setHistoryWindow(int historyWindow) {
            this.historyWindow = historyWindow;
        }

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
    }

    public static class Channels {

        private final Meta meta = new Meta();

        private final AppSecret facebook = new AppSecret();

        private final AppSecret instagram = new AppSecret();

        private final Telegram telegram = new Telegram();

        public Meta getMeta() {
            return meta;
        }

        public AppSecret getFacebook() {
            return facebook;
        }

        public AppSecret getInstagram() {
            return instagram;
        }

        public Telegram getTelegram() {
            return telegram;
        }
    }

    public static class Meta {

        /**
         * Token echoed back during the Meta webhook subscription handshake.
         */
        private String verifyToken;

        /**
         * Accept unsigned Meta webhooks. Local development only.
         */
        private boolean skipSignatureVerification;

        private String graphBaseUrl = "https://graph.facebook.com";

        private String graphVersion = "v19.0";

        public String getVerifyToken() {
            return verifyToken;
        }

        public void setVerifyToken(String verifyToken) {
            this.verifyToken = verifyToken;
        }

        public boolean isSkipSignatureVerification() {
            return skipSignatureVerification;
        }

        public void setSkipSignatureVerification(boolean skipSignatureVerification) {
            this.skipSignatureVerification = skipSignatureVerification;
        }

        public String getGraphBaseUrl() {
            return graphBaseUrl;
        }

        public void setGraphBaseUrl(String graphBaseUrl) {
            this.graphBaseUrl = graphBaseUrl;
        }

        public String getGraphVersion() {
            return graphVersion;
        }

        public void setGraphVersion(String graphVersion) {
            this.graphVersion = graphVersion;
        }
    }

    public static class AppSecret {

        private String appSecret;

        public String getAppSecret() {
            return appSecret;
        }

        public void setAppSecret(String appSecret) {
            this.appSecret = appSecret;
        }
    }

    public static class Telegram {

        private String apiBaseUrl = "https://api.telegram.org";

        public String getApiBaseUrl() {
            return apiBaseUrl;
        }

        public void setApiBaseUrl(String apiBaseUrl) {
            this.apiBaseUrl = apiBaseUrl;
        }
    }

    @Validated
    public static class Crypto {

        /**
         * Base64 encoded 256-bit AES key protecting connection credentials at rest.
         */
        @NotBlank
        private String key;

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }
    }

    @Validated
    public static class Conversation {

        @Min(1)
        private int defaultPageSize = 30;

        @Min(1)
        private int maxPageSize = 100;

        public int getDefaultPageSize() {
            return defaultPageSize;
        }

        public void setDefaultPageSize(int defaultPageSize) {
            this.defaultPageSize = defaultPageSize;
        }

        public int getMaxPageSize() {
            return maxPageSize;
        }

        public void setMaxPageSize(int maxPageSize) {
            this.maxPageSize = maxPageSize;
        }

        public int clampPageSize(Integer requested) {
            if (requested == null || requested <= 0) {
                return defaultPageSize;
            }
            return Math.min(requested, maxPageSize);
        }
    }
}
