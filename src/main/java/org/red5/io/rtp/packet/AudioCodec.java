package org.red5.io.rtp.packet;

public enum AudioCodec {
    AAC,
    G711,
    OPUS
}
