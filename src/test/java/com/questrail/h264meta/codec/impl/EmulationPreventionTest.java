package com.questrail.h264meta.codec.impl;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static com.questrail.h264meta.Bytes.hex;
import static org.junit.jupiter.api.Assertions.*;

public class EmulationPreventionTest
{
    // ---------------------------------------------------------------------
    // Encode
    // ---------------------------------------------------------------------

    @Test
    void inputWithoutZeroRunsIsUnchanged() {
        byte[] input = hex("01 02 00 7F 00 04");
        assertArrayEquals(input, EmulationPrevention.encode(input));
    }

    @Test
    void escapesEachByteFromZeroToThreeAfterTwoZeros() {
        assertArrayEquals(hex("00 00 03 00"), EmulationPrevention.encode(hex("00 00 00")));
        assertArrayEquals(hex("00 00 03 01"), EmulationPrevention.encode(hex("00 00 01")));
        assertArrayEquals(hex("00 00 03 02"), EmulationPrevention.encode(hex("00 00 02")));
        assertArrayEquals(hex("00 00 03 03"), EmulationPrevention.encode(hex("00 00 03")));
    }

    @Test
    void doesNotEscapeByteAboveThree() {
        assertArrayEquals(hex("00 00 04"), EmulationPrevention.encode(hex("00 00 04")));
    }

    /**
     * The zero-run counter restarts after an escape, so a long run of zeros
     * gets one escape per two zeros.
     */
    @Test
    void longZeroRunGetsEscapeEveryTwoZeros() {
        byte[] encoded = EmulationPrevention.encode(hex("00 00 00 00 00 00"));
        assertArrayEquals(hex("00 00 03 00 00 03 00 00"), encoded);
    }

    @Test
    void trailingTwoZerosAreNotEscaped() {
        assertArrayEquals(hex("AA 00 00"), EmulationPrevention.encode(hex("AA 00 00")));
    }

    // ---------------------------------------------------------------------
    // Decode
    // ---------------------------------------------------------------------

    @Test
    void dropsEscapeAfterTwoZeros() {
        assertArrayEquals(hex("00 00 00"), EmulationPrevention.decode(hex("00 00 03 00")));
    }

    @Test
    void byteAfterEscapeIsDataEvenWhenItIsThree() {
        assertArrayEquals(hex("00 00 03"), EmulationPrevention.decode(hex("00 00 03 03")));
    }

    @Test
    void keepsThreeNotPrecededByTwoZeros() {
        byte[] input = hex("03 00 03 00 00");
        assertArrayEquals(input, EmulationPrevention.decode(input));
    }

    @Test
    void decodesSubRangeOnly() {
        byte[] ebsp = hex("FF FF 00 00 03 01 FF");
        assertArrayEquals(hex("00 00 01"), EmulationPrevention.decode(ebsp, 2, 6));
    }

    @Test
    void emptyInputRoundTrips() {
        assertArrayEquals(new byte[0], EmulationPrevention.encode(new byte[0]));
        assertArrayEquals(new byte[0], EmulationPrevention.decode(new byte[0]));
    }

    // ---------------------------------------------------------------------
    // Properties
    // ---------------------------------------------------------------------

    /**
     * Random buffers biased towards zeros: decode(encode(x)) == x, and the
     * encoded form never contains 00 00 0x with x in 0..3.
     */
    @Test
    void encodeThenDecodeIsIdentityAndOutputHasNoStartCodePrefix() {
        Random random = new Random(264);
        for (int n = 0; n < 200; n++) {
            byte[] rbsp = new byte[random.nextInt(64)];
            for (int i = 0; i < rbsp.length; i++) {
                rbsp[i] = (byte) (random.nextInt(3) == 0 ? random.nextInt(5) : 0);
            }

            byte[] ebsp = EmulationPrevention.encode(rbsp);
            assertArrayEquals(rbsp, EmulationPrevention.decode(ebsp));

            for (int i = 0; i + 2 < ebsp.length; i++) {
                boolean forbidden = ebsp[i] == 0 && ebsp[i + 1] == 0 && (ebsp[i + 2] & 0xFF) <= 2;
                assertFalse(forbidden, "forbidden pattern at " + i);
            }
        }
    }
}
