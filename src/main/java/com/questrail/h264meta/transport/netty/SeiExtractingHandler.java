package com.questrail.h264meta.transport.netty;

import com.questrail.h264meta.MetadataCollector;
import com.questrail.h264meta.MetadataListener;
import com.questrail.h264meta.api.MetadataRecord;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;

import java.util.Objects;

/**
 * SeiExtractingHandler
 * =============================================================================
 * Inbound Netty handler that watches {@code ByteBuf} access units for metadata
 * SEI.
 *
 * <p>Each buffer's readable bytes are copied into a plain {@code byte[]}
 * (Netty containment rule) and handed to a {@link MetadataCollector}. Records
 * seen for the first time are delivered to the {@link MetadataListener}. The
 * buffer itself is forwarded untouched, reader index included, and released
 * by whoever consumes it downstream.</p>
 *
 * <p>Messages that are not {@code ByteBuf}s are forwarded without inspection.</p>
 */
public final class SeiExtractingHandler extends ChannelInboundHandlerAdapter
{
    private final MetadataCollector collector;
    private final MetadataListener listener;

    public SeiExtractingHandler(MetadataCollector collector, MetadataListener listener)
    {
        this.collector = Objects.requireNonNull(collector, "collector");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    public MetadataCollector collector()
    {
        return collector;
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg)
    {
        if (msg instanceof ByteBuf content) {
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);

            for (MetadataRecord record : collector.accept(bytes)) {
                listener.onMetadata(record);
            }
        }
        ctx.fireChannelRead(msg);
    }
}
