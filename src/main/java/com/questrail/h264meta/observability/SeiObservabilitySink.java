package com.questrail.h264meta.observability;

/**
 * Receives SEI injection and extraction observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks run on the caller's thread, inside the inject/extract call.
 * Implementations must be quick and must not throw.</p>
 */
public interface SeiObservabilitySink {
    /**
     * Called after an SEI NAL unit has been spliced into an access unit.
     * @param event the injection details
     */
    void onInjected(SeiInjectionEvent event);

    /**
     * Called for each metadata record recovered from a buffer.
     * @param event the extraction details
     */
    void onExtracted(SeiExtractionEvent event);

    /**
     * Called when an SEI message or NAL unit is skipped during extraction.
     * @param event the reason and diagnostic detail
     */
    void onPayloadDropped(SeiDropEvent event);
}
