package com.defimonitor.config;

import com.defimonitor.exception.ConfigurationException;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "app")
@Data
public class AppProps {
    private Map<String, Protocol> protocols = new LinkedHashMap<>();
    private Thresholds thresholds = new Thresholds();
    private Detection detection = new Detection();
    private Slack slack = new Slack();
    private DefiLlama defillama = new DefiLlama();
    private Pipeline pipeline = new Pipeline();
    private Storage storage = new Storage();

    public Protocol require(String protocolId) {
        Protocol p = (protocols != null) ? protocols.get(protocolId) : null;
        if (p == null) throw new ConfigurationException("Unknown protocol: " + protocolId);
        return p;
    }

    /**
     * Static metadata of one monitored protocol. The map key in {@code app.protocols} is the protocol id.
     */
    @Data
    public static class Protocol {
        private String name;
        private String defillamaSlug;
        /** "lending" enables the utilization rule; anything else (dex, yield, ...) does not. */
        private String type;
        private String chain;

        /** Placeholders for the on-chain reads: stored as-is on every ingested snapshot. */
        private BigDecimal apy7d;
        private BigDecimal utilizationRate;

        public boolean isLending() {
            return "lending".equalsIgnoreCase(type);
        }
    }

    @Data
    public static class Thresholds {
        private double tvlDrop24hPercent = 20.0;
        private double apyMinPercent = 2.0;
        private double utilizationMaxPercent = 95.0;
    }

    @Data
    public static class Detection {
        private Duration dedupWindow = Duration.ofHours(1);
        private Duration tvlLookback = Duration.ofHours(24);
    }

    @Data
    public static class Slack {
        private String webhookUrl;
        private long timeoutMs = 10_000;

        public boolean isEnabled() {
            return webhookUrl != null && !webhookUrl.isBlank();
        }
    }

    @Data
    public static class DefiLlama {
        private String baseUrl = "https://api.llama.fi";
        private long timeoutMs = 30_000;
        private int maxRetries = 3;
        private Duration retryDelay = Duration.ofSeconds(2);
    }

    /** MongoDB driver bounds; the driver's own socket read timeout is unbounded. */
    @Data
    public static class Storage {
        private int timeoutMs = 10_000;
        private int serverSelectionTimeoutMs = 5_000;
    }

    @Data
    public static class Pipeline {
        private boolean enabled = true;
        private String cron = "0 0/15 * * * ?";
    }
}
