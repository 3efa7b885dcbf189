package com.questrail.h264meta.internal.nal;

/**
 * NalUnitType
 * -----------------------------------------------------------------------------
 * H.264 {@code nal_unit_type} values used by this library (ITU-T H.264 Table 7-1).
 *
 * <p>Only the types that matter for SEI placement are named. Everything else
 * is carried through untouched.</p>
 */
public final class NalUnitType
{
    /** Coded slice of a non-IDR picture. */
    public static final int NON_IDR_SLICE = 1;

    /** Coded slice of an IDR picture. */
    public static final int IDR_SLICE = 5;

    /** Supplemental enhancement information. */
    public static final int SEI = 6;

    /** Sequence parameter set. */
    public static final int SPS = 7;

    /** Picture parameter set. */
    public static final int PPS = 8;

    /** Access unit delimiter. */
    public static final int AUD = 9;

    private NalUnitType() {}

    /**
     * Returns true for coded-slice types that start the VCL part of an access unit.
     */
    public static boolean isVcl(int nalType)
    {
        return nalType == NON_IDR_SLICE || nalType == IDR_SLICE;
    }

    /**
     * Returns true for the non-VCL types that must stay ahead of an injected SEI.
     */
    public static boolean isHeader(int nalType)
    {
        return nalType == AUD || nalType == SEI || nalType == SPS || nalType == PPS;
    }

    static String name(int nalType)
    {
        return switch (nalType) {
            case NON_IDR_SLICE -> "non-IDR slice";
            case IDR_SLICE -> "IDR slice";
            case SEI -> "SEI";
            case SPS -> "SPS";
            case PPS -> "PPS";
            case AUD -> "AUD";
            default -> "other";
        };
    }
}
