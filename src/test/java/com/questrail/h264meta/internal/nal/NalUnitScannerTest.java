package com.questrail.h264meta.internal.nal;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.NoSuchElementException;

import static com.questrail.h264meta.Bytes.concat;
import static com.questrail.h264meta.Bytes.hex;
import static com.questrail.h264meta.Bytes.lengthPrefixed;
import static com.questrail.h264meta.Bytes.sliceOfLength;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link NalUnitScanner} and {@link NalUnitCursor}.
 */
final class NalUnitScannerTest
{
    // ---------------------------------------------------------------------
    // Annex-B
    // ---------------------------------------------------------------------

    @Test
    void findsUnitsWithThreeAndFourByteStartCodes() {
        byte[] data = hex("00 00 00 01 09 F0"
                + "00 00 01 67 42"
                + "00 00 00 01 65 88 84");

        List<NalUnit> units = NalUnitScanner.scanAll(data, FramingMode.ANNEX_B);

        assertEquals(List.of(
                new NalUnit(0, 4, 6, 4, NalUnitType.AUD),
                new NalUnit(6, 9, 11, 3, NalUnitType.SPS),
                new NalUnit(11, 15, 18, 4, NalUnitType.IDR_SLICE)
        ), units);
    }

    @Test
    void nalTypeIsLowFiveBitsOfHeader() {
        // 0x65 = nal_ref_idc 3, type 5; 0x41 = nal_ref_idc 2, type 1
        List<NalUnit> units = NalUnitScanner.scanAll(hex("00 00 01 65 AA 00 00 01 41 BB"), FramingMode.ANNEX_B);
        assertEquals(5, units.get(0).nalType());
        assertEquals(1, units.get(1).nalType());
        assertTrue(units.get(1).isVcl());
    }

    @Test
    void leadingBytesBeforeFirstStartCodeAreSkipped() {
        List<NalUnit> units = NalUnitScanner.scanAll(hex("AA BB 00 00 01 09 F0"), FramingMode.ANNEX_B);
        assertEquals(List.of(new NalUnit(2, 5, 7, 3, NalUnitType.AUD)), units);
    }

    @Test
    void bufferWithoutStartCodeHasNoUnits() {
        assertTrue(NalUnitScanner.scanAll(hex("01 02 03 04 05"), FramingMode.ANNEX_B).isEmpty());
    }

    @Test
    void startCodeAtEndOfBufferEndsScan() {
        List<NalUnit> units = NalUnitScanner.scanAll(hex("00 00 01 09 F0 00 00 01"), FramingMode.ANNEX_B);
        assertEquals(1, units.size());
        assertEquals(5, units.get(0).endOffset());
    }

    @Test
    void emptyUnitDoesNotSwallowTheNextUnit() {
        List<NalUnit> units = NalUnitScanner.scanAll(hex("00 00 01 00 00 01 65 88"), FramingMode.ANNEX_B);

        assertEquals(List.of(
                new NalUnit(0, 3, 3, 3, 0),
                new NalUnit(3, 6, 8, 3, NalUnitType.IDR_SLICE)
        ), units);
    }

    @Test
    void emptyUnitBeforeFourByteStartCode() {
        List<NalUnit> units = NalUnitScanner.scanAll(hex("00 00 01 00 00 00 01 65 88"), FramingMode.ANNEX_B);

        assertEquals(List.of(
                new NalUnit(0, 3, 3, 3, 0),
                new NalUnit(3, 7, 9, 4, NalUnitType.IDR_SLICE)
        ), units);
    }

    @Test
    void rbspOffsetFollowsHeaderByte() {
        NalUnit unit = NalUnitScanner.scanAll(hex("00 00 01 06 05 10"), FramingMode.ANNEX_B).get(0);
        assertEquals(4, unit.rbspOffset());
        assertEquals(6, unit.length());
    }

    // ---------------------------------------------------------------------
    // Length-prefixed
    // ---------------------------------------------------------------------

    @Test
    void findsLengthPrefixedUnits() {
        byte[] data = hex("00000002 09 F0 00000003 65 88 84");

        List<NalUnit> units = NalUnitScanner.scanAll(data, FramingMode.LENGTH_PREFIXED);

        assertEquals(List.of(
                new NalUnit(0, 4, 6, 4, NalUnitType.AUD),
                new NalUnit(6, 10, 13, 4, NalUnitType.IDR_SLICE)
        ), units);
    }

    @Test
    void lengthRunningPastBufferEndsScan() {
        byte[] data = hex("00000002 09 F0 00000009 65 88");
        assertEquals(1, NalUnitScanner.scanAll(data, FramingMode.LENGTH_PREFIXED).size());
    }

    @Test
    void zeroLengthEndsScan() {
        byte[] data = hex("00000000 00000002 09 F0");
        assertTrue(NalUnitScanner.scanAll(data, FramingMode.LENGTH_PREFIXED).isEmpty());
    }

    // ---------------------------------------------------------------------
    // AUTO
    // ---------------------------------------------------------------------

    @Test
    void autoDetectsLengthPrefixedBuffer() {
        byte[] data = hex("00000002 09 F0 00000003 65 88 84");
        assertEquals(FramingMode.LENGTH_PREFIXED, NalUnitScanner.resolve(data, FramingMode.AUTO));
        assertEquals(2, NalUnitScanner.scan(data).toList().size());
    }

    @Test
    void autoPrefersAnnexBWhenBufferOpensWithStartCode() {
        // Read as a length these four bytes would be 1.
        byte[] data = hex("00 00 00 01 09 F0 00 00 00 01 65 88");
        assertEquals(FramingMode.ANNEX_B, NalUnitScanner.resolve(data, FramingMode.AUTO));
        assertEquals(FramingMode.ANNEX_B, NalUnitScanner.resolve(hex("00 00 01 09 F0"), FramingMode.AUTO));
    }

    @Test
    void autoReadsThreeByteStartCodePrefixAsLengthWhenItConsumesBuffer() {
        // A 300 byte unit has the length field 00 00 01 2C.
        byte[] data = lengthPrefixed(sliceOfLength(300));

        assertEquals(FramingMode.LENGTH_PREFIXED, NalUnitScanner.resolve(data, FramingMode.AUTO));
        assertEquals(List.of(new NalUnit(0, 4, 304, 4, NalUnitType.NON_IDR_SLICE)),
                NalUnitScanner.scan(data).toList());
    }

    @Test
    void autoReadsSeveralLengthPrefixedUnitsOpeningWithThreeByteStartCodePrefix() {
        byte[] data = concat(lengthPrefixed(sliceOfLength(256)), hex("00000003 65 88 84"));
        assertEquals(FramingMode.LENGTH_PREFIXED, NalUnitScanner.resolve(data, FramingMode.AUTO));
    }

    @Test
    void autoKeepsAnnexBWhenLengthReadingLeavesBytesOver() {
        byte[] data = concat(lengthPrefixed(sliceOfLength(300)), hex("AA"));
        assertEquals(FramingMode.ANNEX_B, NalUnitScanner.resolve(data, FramingMode.AUTO));
    }

    @Test
    void autoFallsBackToAnnexBWhenLengthDoesNotFit() {
        assertEquals(FramingMode.ANNEX_B, NalUnitScanner.resolve(hex("FF 00 00 01 09 F0"), FramingMode.AUTO));
        assertEquals(FramingMode.ANNEX_B, NalUnitScanner.resolve(hex("00 00"), FramingMode.AUTO));
    }

    @Test
    void explicitModeIsNotOverridden() {
        byte[] data = hex("00 00 00 01 09 F0");
        assertEquals(FramingMode.LENGTH_PREFIXED, NalUnitScanner.resolve(data, FramingMode.LENGTH_PREFIXED));
    }

    // ---------------------------------------------------------------------
    // Cursor
    // ---------------------------------------------------------------------

    @Test
    void cursorStaysExhausted() {
        NalUnitCursor cursor = NalUnitScanner.scan(hex("00 00 01 09 F0"), FramingMode.ANNEX_B);

        assertEquals(FramingMode.ANNEX_B, cursor.framingMode());
        assertFalse(cursor.isExhausted());
        assertEquals(NalUnitType.AUD, cursor.next().nalType());
        assertTrue(cursor.isExhausted());
        assertFalse(cursor.hasNext());
        assertThrows(NoSuchElementException.class, cursor::next);
    }

    @Test
    void scanningAgainRestarts() {
        byte[] data = hex("00 00 01 09 F0 00 00 01 65 88");
        NalUnitCursor first = NalUnitScanner.scan(data, FramingMode.ANNEX_B);
        first.toList();

        assertTrue(first.isExhausted());
        assertEquals(2, NalUnitScanner.scan(data, FramingMode.ANNEX_B).toList().size());
    }
}
