package com.questrail.h264meta.codec;

import com.questrail.h264meta.internal.nal.FramingMode;
import com.questrail.h264meta.internal.sei.SeiMessage;

import java.util.List;

/**
 * SeiNalDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for the SEI NAL units of a buffer.
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Finding SEI NAL units (type 6)</li>
 *   <li>Removing emulation prevention</li>
 *   <li>Splitting the RBSP into {@link SeiMessage} instances</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for UUID filtering or
 * interpreting the message body.</p>
 *
 * <p>Malformed input never raises. When a message header or body runs past
 * the end of its NAL unit the remaining messages of that unit are dropped and
 * decoding continues with the next unit.</p>
 */
public interface SeiNalDecoder
{
    /**
     * Decodes every SEI message of every SEI NAL unit in {@code data}, in
     * bitstream order.
     *
     * @param data    raw buffer from the host
     * @param framing how NAL units are delimited in {@code data}
     * @return decoded messages; empty if there are none
     */
    List<SeiMessage> decode(byte[] data, FramingMode framing);
}
