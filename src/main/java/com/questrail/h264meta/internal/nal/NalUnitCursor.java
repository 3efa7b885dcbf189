package com.questrail.h264meta.internal.nal;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * NalUnitCursor
 * -----------------------------------------------------------------------------
 * Forward-only iterator over the NAL units of one buffer.
 *
 * <p>Units are located lazily as {@link #hasNext()} is called. Once the end of
 * the buffer, or the first truncated unit, is reached the cursor becomes
 * exhausted and stays that way.</p>
 *
 * <p>Not thread-safe. A cursor is a per-call object.</p>
 */
public final class NalUnitCursor implements Iterator<NalUnit>
{
    private final byte[] data;
    private final FramingMode framingMode;

    private int position;
    private NalUnit pending;
    private boolean exhausted;

    NalUnitCursor(byte[] data, FramingMode framingMode)
    {
        if (framingMode == FramingMode.AUTO) {
            throw new IllegalArgumentException("Cursor requires a resolved framing mode");
        }
        this.data = data;
        this.framingMode = framingMode;
    }

    /**
     * The concrete framing this cursor is scanning with.
     */
    public FramingMode framingMode()
    {
        return framingMode;
    }

    /**
     * True once no further units can be produced.
     */
    public boolean isExhausted()
    {
        return !hasNext();
    }

    @Override
    public boolean hasNext()
    {
        if (pending != null) {
            return true;
        }
        if (exhausted) {
            return false;
        }

        pending = (framingMode == FramingMode.LENGTH_PREFIXED)
                ? nextLengthPrefixed()
                : nextAnnexB();

        if (pending == null) {
            exhausted = true;
            return false;
        }
        return true;
    }

    @Override
    public NalUnit next()
    {
        if (!hasNext()) {
            throw new NoSuchElementException("NAL cursor exhausted");
        }
        NalUnit unit = pending;
        pending = null;
        return unit;
    }

    /**
     * Drains the remaining units into a list.
     */
    public List<NalUnit> toList()
    {
        List<NalUnit> units = new ArrayList<>();
        while (hasNext()) {
            units.add(next());
        }
        return units;
    }

    private NalUnit nextAnnexB()
    {
        final int triple = NalUnitScanner.findStartCode(data, position);
        if (triple < 0) {
            return null;
        }

        int start = triple;
        int startCodeLength = 3;
        if (triple > position && data[triple - 1] == 0) {
            start = triple - 1;
            startCodeLength = 4;
        }

        final int header = triple + 3;
        if (header >= data.length) {
            // Start code with nothing after it.
            return null;
        }

        // An empty unit is followed directly by the next start code, so the
        // search includes the header position itself.
        final int nextTriple = NalUnitScanner.findStartCode(data, header);
        final int end;
        if (nextTriple < 0) {
            end = data.length;
        }
        else if (nextTriple - 1 >= header && data[nextTriple - 1] == 0) {
            end = nextTriple - 1;
        }
        else {
            end = nextTriple;
        }

        position = end;
        return new NalUnit(start, header, end, startCodeLength, data[header] & 0x1F);
    }

    private NalUnit nextLengthPrefixed()
    {
        if (position + 4 > data.length) {
            return null;
        }

        final long length = NalUnitScanner.readUint32(data, position);
        if (length <= 0 || position + 4 + length > data.length) {
            // Zero length or a unit running past the buffer: stop here.
            return null;
        }

        final int start = position;
        final int header = start + 4;
        final int end = (int) (header + length);

        position = end;
        return new NalUnit(start, header, end, 4, data[header] & 0x1F);
    }
}
