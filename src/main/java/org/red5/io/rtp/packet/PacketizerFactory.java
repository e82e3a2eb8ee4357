package org.red5.io.rtp.packet;

/**
 * Selects the packetizer variant for the configured codecs.
 */
public interface PacketizerFactory {

    Packetizer createVideoPacketizer(VideoCodec codec);

    Packetizer createAudioPacketizer(AudioCodec codec);
}
