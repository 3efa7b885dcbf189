package com.questrail.h264meta.internal.insert;

import com.questrail.h264meta.internal.nal.NalUnit;
import com.questrail.h264meta.internal.nal.NalUnitType;

import java.util.List;
import java.util.Objects;

/**
 * InsertionPointPolicy
 * -----------------------------------------------------------------------------
 * Chooses the byte offset at which an SEI NAL unit is spliced into an access
 * unit.
 *
 * <p>The SEI must follow any access unit delimiter, parameter sets and earlier
 * SEI units, and must precede the first coded slice:</p>
 * <pre>
 *   [AUD] [SPS] [PPS] [SEI...] | new SEI | [slice] ...
 * </pre>
 *
 * <p>Other NAL types (end of sequence, filler, reserved) neither move the
 * candidate nor stop the walk. With no slice in the buffer the SEI goes after
 * the last header unit, or at offset 0 if there is none.</p>
 */
public final class InsertionPointPolicy
{
    private InsertionPointPolicy() {}

    public static int findInsertionPoint(List<NalUnit> units)
    {
        Objects.requireNonNull(units, "units");

        int candidate = 0;
        for (NalUnit unit : units) {
            if (unit.isVcl()) {
                return unit.startOffset();
            }
            if (NalUnitType.isHeader(unit.nalType())) {
                candidate = unit.endOffset();
            }
        }
        return candidate;
    }
}
