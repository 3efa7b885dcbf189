package com.questrail.h264meta.transport.netty;

import com.questrail.h264meta.SeiMetadataInjector;
import com.questrail.h264meta.api.EncodedFrame;
import com.questrail.h264meta.api.MetadataRecord;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageEncoder;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * SeiInjectingEncoder
 * =============================================================================
 * Outbound Netty handler that turns {@link EncodedFrame}s into {@code ByteBuf}
 * access units, injecting metadata SEI on the way.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure pipeline adapter</strong>. Cadence, framing and
 * placement all live in {@link SeiMetadataInjector}; this handler only asks
 * the supplier for the current metadata and wraps the result.
 *
 * <p>The supplier is called once per frame on the channel's event loop,
 * including for frames that end up passing through unchanged.</p>
 */
public final class SeiInjectingEncoder extends MessageToMessageEncoder<EncodedFrame>
{
    private final SeiMetadataInjector injector;
    private final Supplier<MetadataRecord> metadataSource;

    public SeiInjectingEncoder(SeiMetadataInjector injector, Supplier<MetadataRecord> metadataSource)
    {
        super(EncodedFrame.class);
        this.injector = Objects.requireNonNull(injector, "injector");
        this.metadataSource = Objects.requireNonNull(metadataSource, "metadataSource");
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, EncodedFrame frame, List<Object> out)
    {
        MetadataRecord metadata = metadataSource.get();
        EncodedFrame result = injector.inject(frame, metadata == null ? MetadataRecord.empty() : metadata);
        out.add(Unpooled.wrappedBuffer(result.data()));
    }
}
