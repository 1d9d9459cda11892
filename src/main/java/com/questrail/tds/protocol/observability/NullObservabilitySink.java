package com.questrail.tds.protocol.observability;

/**
 * No-op implementation of TdsObservabilitySink.
 */
public final class NullObservabilitySink implements TdsObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onTokenDecoded(TdsTokenEvent event) {}

    @Override
    public void onSuspended(TdsSuspensionEvent event) {}

    @Override
    public void onResumed(TdsResumeEvent event) {}

    @Override
    public void onError(TdsErrorEvent event) {}
}
