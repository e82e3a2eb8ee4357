package org.red5.io.rtp.sender;

import org.red5.io.rtp.model.MediaType;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Sent and dropped frame totals per media kind. Drops are counted on the producer thread, sends on the
 * transmission thread.
 */
final class FrameCounters {
    private final AtomicLong audioFramesSent = new AtomicLong();
    private final AtomicLong videoFramesSent = new AtomicLong();
    private final AtomicLong droppedAudioFrames = new AtomicLong();
    private final AtomicLong droppedVideoFrames = new AtomicLong();

    void sent(MediaType type) {
        (type == MediaType.VIDEO ? videoFramesSent : audioFramesSent).incrementAndGet();
    }

    void dropped(MediaType type) {
        (type == MediaType.VIDEO ? droppedVideoFrames : droppedAudioFrames).incrementAndGet();
    }

    long getAudioFramesSent() {
        return audioFramesSent.get();
    }

    long getVideoFramesSent() {
        return videoFramesSent.get();
    }

    long getDroppedAudioFrames() {
        return droppedAudioFrames.get();
    }

    long getDroppedVideoFrames() {
        return droppedVideoFrames.get();
    }

    void resetSentAudio() {
        audioFramesSent.set(0);
    }

    void resetSentVideo() {
        videoFramesSent.set(0);
    }

    void resetDroppedAudio() {
        droppedAudioFrames.set(0);
    }

    void resetDroppedVideo() {
        droppedVideoFrames.set(0);
    }

    void resetAll() {
        resetSentAudio();
        resetSentVideo();
        resetDroppedAudio();
        resetDroppedVideo();
    }
}
