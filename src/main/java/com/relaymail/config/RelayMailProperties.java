package com.relaymail.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * RelayMail configuration properties
 */
@Data
@Component
@ConfigurationProperties(prefix = "relaymail")
public class RelayMailProperties {

    private String serverName = "localhost";

    private Imap imap = new Imap();
    private Pop3 pop3 = new Pop3();
    private Mx mx = new Mx();
    private Smtp smtp = new Smtp();
    private Auth auth = new Auth();
    private RateLimit rateLimit = new RateLimit();
    private BackgroundQueue backgroundQueue = new BackgroundQueue();
    private Outbound outbound = new Outbound();
    private Tls tls = new Tls();

    @Data
    public static class Imap {
        private boolean enabled = true;
        private int port = 143;
        private int sslPort = 993;
        private long timeout = 1800000L; // 30 minutes
        private int maxLineLength = 65536; // frame limit, command limit is enforced by the parser
        private int maxConnectionsPerUser = 5;
        private int maxMessagesPerSession = 2000;
        private int handlerThreads = 16;
    }

    @Data
    public static class Pop3 {
        private boolean enabled = true;
        private int port = 110;
        private int sslPort = 995;
        private long timeout = 600000L; // 10 minutes
        private int maxLineLength = 8192;
        private int maxConnectionsPerUser = 5;
        private int maxMessagesPerSession = 1000;
        private int handlerThreads = 8;
    }

    /**
     * Inbound SMTP acceptance policy (open relay prevention)
     */
    @Data
    public static class Mx {
        private boolean enabled = false;
        private int port = 25;
        private List<String> hostedDomains = new ArrayList<>();
        private boolean validateRecipients = false;
    }

    @Data
    public static class Smtp {
        private long maxMessageSizeBytes = 26214400L; // 25MB
        private long maxAttachmentSizeBytes = 10485760L; // 10MB
    }

    @Data
    public static class Auth {
        /**
         * Secret mixed into credential cache keys. A random per-instance key is used when empty.
         */
        private String cacheKeySalt;
        private Duration cacheTtl = Duration.ofSeconds(30);
        private long cacheMaxSize = 10000L;
    }

    @Data
    public static class RateLimit {
        private int maxFailedAttempts = 5;
        private Duration lockoutWindow = Duration.ofMinutes(15);
        private Duration baseBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(30);
    }

    @Data
    public static class BackgroundQueue {
        private int capacity = 10000;
        private Duration shutdownTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Outbound {
        private boolean enabled = false;
        private String relayHost;
        private int relayPort = 587;
        private String relayUsername;
        private String relayPassword;
        private boolean relayUseTls = true;
        private int maxConcurrency = 5;
        private int maxRetries = 10;
        private long retryBaseDelaySeconds = 60L;
        private long maxRetryDelaySeconds = 3600L;
        private long queuePollingIntervalSeconds = 15L;
        private int smtpTimeoutSeconds = 30;
        private String senderDomain = "localhost";

        public boolean hasRelayHost() {
            return relayHost != null && !relayHost.isBlank();
        }
    }

    @Data
    public static class Tls {
        private boolean enabled = false;
        private String keystorePath = "config/keystore.p12";
        private String keystoreType = "PKCS12";
        private String keystorePassword = "changeit";
        private String keyPassword = "changeit";
    }
}
