package com.questrail.h264meta.observability;

/**
 * No-op implementation of SeiObservabilitySink.
 */
public final class NullObservabilitySink implements SeiObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onInjected(SeiInjectionEvent event) {}

    @Override
    public void onExtracted(SeiExtractionEvent event) {}

    @Override
    public void onPayloadDropped(SeiDropEvent event) {}
}
