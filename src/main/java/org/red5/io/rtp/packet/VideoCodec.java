package org.red5.io.rtp.packet;

public enum VideoCodec {
    H264,
    H265,
    AV1
}
