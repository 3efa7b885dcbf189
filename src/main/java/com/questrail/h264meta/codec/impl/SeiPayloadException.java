package com.questrail.h264meta.codec.impl;

/**
 * Raised inside the codec when an SEI message header or body runs past the
 * end of the RBSP. Never leaves this package: the decoder drops the rest of
 * the affected NAL unit and moves on.
 */
final class SeiPayloadException extends Exception
{
    SeiPayloadException(String message)
    {
        super(message);
    }
}
