package com.questrail.muxbridge.codec;

import java.io.IOException;

/**
 * Malformed framing on the transport byte stream.
 *
 * <p>Framing defects cannot be resynchronised, so they always end the session
 * that observed them.</p>
 */
public class FramingException extends IOException
{
    public FramingException(String message) {
        super(message);
    }
}
