package org.red5.io.rtp.packet;

import org.red5.io.rtp.model.MediaType;
import org.red5.io.rtp.protocol.RtpConstants;

/**
 * Returns a {@link FragmentingPacketizer} for every codec. Codec specific payload formats (FU-A, AU headers,
 * OBU aggregation) are plugged in by providing another {@link PacketizerFactory}.
 */
public class GenericPacketizerFactory implements PacketizerFactory {

    private final int mtu;

    public GenericPacketizerFactory() {
        this(RtpConstants.MTU);
    }

    public GenericPacketizerFactory(int mtu) {
        this.mtu = mtu;
    }

    @Override
    public Packetizer createVideoPacketizer(VideoCodec codec) {
        return new FragmentingPacketizer(MediaType.VIDEO, RtpConstants.PAYLOAD_TYPE_VIDEO,
                RtpConstants.CLOCK_VIDEO_FREQUENCY, mtu);
    }

    @Override
    public Packetizer createAudioPacketizer(AudioCodec codec) {
        int payloadType = codec == AudioCodec.G711 ? RtpConstants.PAYLOAD_TYPE_G711 : RtpConstants.PAYLOAD_TYPE_AUDIO;
        // G.711 runs at 8 kHz, the real rate is set by configure()
        return new FragmentingPacketizer(MediaType.AUDIO, payloadType, 8000L, mtu);
    }
}
