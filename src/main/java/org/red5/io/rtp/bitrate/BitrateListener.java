package org.red5.io.rtp.bitrate;

@FunctionalInterface
public interface BitrateListener {

    void onNewBitrate(long bitrate);
}
