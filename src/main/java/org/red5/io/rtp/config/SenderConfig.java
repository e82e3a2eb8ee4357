package org.red5.io.rtp.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.red5.io.rtp.protocol.RtpConstants;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tuning of the RTP sender, bound from JSON. Missing properties keep their defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SenderConfig {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final int DEFAULT_CACHE_SIZE = 200;

    /**
     * Capacity of the frame queue.
     */
    @JsonProperty("cacheSize")
    private int cacheSize = DEFAULT_CACHE_SIZE;

    /**
     * How long the transmission loop waits for a frame before checking for stop.
     */
    @JsonProperty("pollTimeoutMillis")
    private long pollTimeoutMillis = 1000;

    /**
     * Bitrate sampling period.
     */
    @JsonProperty("bitrateIntervalMillis")
    private long bitrateIntervalMillis = 1000;

    @JsonProperty("logsEnabled")
    private boolean logsEnabled = true;

    @JsonProperty("bitrateExponentialFactor")
    private float bitrateExponentialFactor = 1f;

    @JsonProperty("mtu")
    private int mtu = RtpConstants.MTU;

    /**
     * Upper bound for a flush to complete before the transport is considered broken.
     */
    @JsonProperty("writeTimeoutMillis")
    private long writeTimeoutMillis = 3000;

    public SenderConfig() {
    }

    public static SenderConfig defaults() {
        return new SenderConfig();
    }

    public static SenderConfig fromJson(String json) throws JsonProcessingException {
        return MAPPER.readValue(json, SenderConfig.class).validate();
    }

    public static SenderConfig load(InputStream in) throws IOException {
        return MAPPER.readValue(in, SenderConfig.class).validate();
    }

    public static SenderConfig load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    public String toJson() throws JsonProcessingException {
        return MAPPER.writeValueAsString(this);
    }

    /**
     * Check ranges, returning this instance.
     *
     * @throws IllegalArgumentException on the first invalid value
     */
    public SenderConfig validate() {
        if (cacheSize <= 0) {
            throw new IllegalArgumentException("cacheSize must be > 0: " + cacheSize);
        }
        if (pollTimeoutMillis <= 0) {
            throw new IllegalArgumentException("pollTimeoutMillis must be > 0: " + pollTimeoutMillis);
        }
        if (bitrateIntervalMillis <= 0) {
            throw new IllegalArgumentException("bitrateIntervalMillis must be > 0: " + bitrateIntervalMillis);
        }
        if (!(bitrateExponentialFactor > 0f && bitrateExponentialFactor <= 1f)) {
            throw new IllegalArgumentException("bitrateExponentialFactor must be in (0, 1]: " + bitrateExponentialFactor);
        }
        if (mtu <= RtpConstants.IP_UDP_HEADER_LENGTH + RtpConstants.RTP_HEADER_LENGTH) {
            throw new IllegalArgumentException("mtu too small: " + mtu);
        }
        if (writeTimeoutMillis <= 0) {
            throw new IllegalArgumentException("writeTimeoutMillis must be > 0: " + writeTimeoutMillis);
        }
        return this;
    }

    public int getCacheSize() {
        return cacheSize;
    }

    public SenderConfig setCacheSize(int cacheSize) {
        this.cacheSize = cacheSize;
        return this;
    }

    public long getPollTimeoutMillis() {
        return pollTimeoutMillis;
    }

    public SenderConfig setPollTimeoutMillis(long pollTimeoutMillis) {
        this.pollTimeoutMillis = pollTimeoutMillis;
        return this;
    }

    public long getBitrateIntervalMillis() {
        return bitrateIntervalMillis;
    }

    public SenderConfig setBitrateIntervalMillis(long bitrateIntervalMillis) {
        this.bitrateIntervalMillis = bitrateIntervalMillis;
        return this;
    }

    public boolean isLogsEnabled() {
        return logsEnabled;
    }

    public SenderConfig setLogsEnabled(boolean logsEnabled) {
        this.logsEnabled = logsEnabled;
        return this;
    }

    public float getBitrateExponentialFactor() {
        return bitrateExponentialFactor;
    }

    public SenderConfig setBitrateExponentialFactor(float bitrateExponentialFactor) {
        this.bitrateExponentialFactor = bitrateExponentialFactor;
        return this;
    }

    public int getMtu() {
        return mtu;
    }

    public SenderConfig setMtu(int mtu) {
        this.mtu = mtu;
        return this;
    }

    public long getWriteTimeoutMillis() {
        return writeTimeoutMillis;
    }

    public SenderConfig setWriteTimeoutMillis(long writeTimeoutMillis) {
        this.writeTimeoutMillis = writeTimeoutMillis;
        return this;
    }

    @Override
    public String toString() {
        return "SenderConfig{" +
                "cacheSize=" + cacheSize +
                ", pollTimeoutMillis=" + pollTimeoutMillis +
                ", bitrateIntervalMillis=" + bitrateIntervalMillis +
                ", logsEnabled=" + logsEnabled +
                ", bitrateExponentialFactor=" + bitrateExponentialFactor +
                ", mtu=" + mtu +
                ", writeTimeoutMillis=" + writeTimeoutMillis +
                '}';
    }
}
