package org.red5.io.rtp.sender;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Point in time view of the sender diagnostics.
 */
public record SenderStatistics(
        @JsonProperty("running") boolean running,
        @JsonProperty("cacheSize") int cacheSize,
        @JsonProperty("itemsInCache") int itemsInCache,
        @JsonProperty("sentVideoFrames") long sentVideoFrames,
        @JsonProperty("sentAudioFrames") long sentAudioFrames,
        @JsonProperty("droppedVideoFrames") long droppedVideoFrames,
        @JsonProperty("droppedAudioFrames") long droppedAudioFrames,
        @JsonProperty("bitrate") long bitrate
) {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize statistics", e);
        }
    }
}
