package org.red5.io.rtp.sender;

import org.red5.io.rtp.bitrate.BitrateListener;

/**
 * Receives session level notifications from the sender.
 * <p>
 * Callbacks run on the sender's own threads; implementations that need another thread (a UI thread, an
 * event loop) must hand the call over themselves.
 */
public interface ConnectionChecker extends BitrateListener {

    /**
     * The session can't continue, called at most once per session. The sender has already stopped
     * sending; call {@code stop()} then {@code start()} to resume.
     */
    void onConnectionFailed(String reason);

    @Override
    default void onNewBitrate(long bitrate) {
    }
}
