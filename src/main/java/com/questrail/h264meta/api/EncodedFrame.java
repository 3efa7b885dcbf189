package com.questrail.h264meta.api;

import java.util.Objects;

/**
 * EncodedFrame
 * -----------------------------------------------------------------------------
 * One encoded access unit as delivered by the media pipeline host, together
 * with the buffer attributes the host associates with it.
 *
 * <p>The SEI codec only ever changes {@link #data()}. When a frame is
 * rewritten, every other attribute is carried over unchanged by
 * {@link #withData(byte[])}.</p>
 *
 * <p>The data array is <em>not</em> copied: frames are handed through a
 * pipeline and pass-through must preserve buffer identity.</p>
 *
 * @param data          access unit bytes
 * @param keyframe      true if the host did not flag the buffer as a delta unit
 * @param ptsNanos      presentation timestamp, or {@link #NO_TIMESTAMP}
 * @param dtsNanos      decode timestamp, or {@link #NO_TIMESTAMP}
 * @param durationNanos frame duration, or {@link #NO_TIMESTAMP}
 */
public record EncodedFrame(
        byte[] data,
        boolean keyframe,
        long ptsNanos,
        long dtsNanos,
        long durationNanos
) {
    public static final long NO_TIMESTAMP = -1L;

    public EncodedFrame {
        Objects.requireNonNull(data, "data");
    }

    public static EncodedFrame of(byte[] data, boolean keyframe) {
        return new EncodedFrame(data, keyframe, NO_TIMESTAMP, NO_TIMESTAMP, NO_TIMESTAMP);
    }

    /**
     * Returns a frame with new bytes and all other attributes copied verbatim.
     */
    public EncodedFrame withData(byte[] newData) {
        return new EncodedFrame(newData, keyframe, ptsNanos, dtsNanos, durationNanos);
    }

    @Override
    public String toString() {
        return "EncodedFrame[" +
                "length=" + data.length +
                ", keyframe=" + keyframe +
                ", pts=" + ptsNanos +
                ", dts=" + dtsNanos +
                ", duration=" + durationNanos +
                ']';
    }
}
