package org.red5.io.rtp.model;

import io.netty.buffer.ByteBuf;

import java.util.Objects;

/**
 * One encoded access unit handed to the sender by the encoder.
 */
public class MediaFrame {
    private final MediaType type;
    private final ByteBuf payload;
    private final FrameInfo info;

    public MediaFrame(MediaType type, ByteBuf payload, FrameInfo info) {
        this.type = Objects.requireNonNull(type, "type");
        this.payload = Objects.requireNonNull(payload, "payload");
        this.info = Objects.requireNonNull(info, "info");
    }

    public static MediaFrame video(ByteBuf payload, long timestamp, boolean isKeyFrame) {
        return new MediaFrame(MediaType.VIDEO, payload, new FrameInfo(0, payload.readableBytes(), timestamp, isKeyFrame));
    }

    public static MediaFrame audio(ByteBuf payload, long timestamp) {
        return new MediaFrame(MediaType.AUDIO, payload, FrameInfo.of(payload.readableBytes(), timestamp));
    }

    public MediaType getType() {
        return type;
    }

    public ByteBuf getPayload() {
        return payload;
    }

    public FrameInfo getInfo() {
        return info;
    }

    /**
     * Drop the sender's reference to the payload.
     */
    public void release() {
        if (payload.refCnt() > 0) {
            payload.release();
        }
    }

    @Override
    public String toString() {
        return "MediaFrame{" +
                "type=" + type +
                ", timestamp=" + info.timestamp() +
                ", keyFrame=" + info.isKeyFrame() +
                ", payloadSize=" + payload.readableBytes() +
                '}';
    }
}
