package com.questrail.muxbridge.protocol;

/**
 * A violation of the control protocol by the front end.
 *
 * <p>Protocol violations are session-fatal: the driver stops processing,
 * tears down every channel and the superuser peer, and writes nothing further
 * to the transport.</p>
 */
public final class ProtocolException extends RuntimeException
{
    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
