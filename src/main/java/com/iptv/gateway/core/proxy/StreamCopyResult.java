package com.iptv.gateway.core.proxy;

/**
 * Outcome of copying one upstream body to the caller.
 *
 * @param bytesCopied bytes written to the caller
 * @param status      how the copy ended
 * @param failure     cause for anything but {@link TerminalStatus#COMPLETED}, else null
 */
public record StreamCopyResult(
        long bytesCopied,
        TerminalStatus status,
        Throwable failure
) {}
