package com.questrail.muxbridge.codec;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * FrameDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for the multiplexing protocol.
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Reading exactly one frame's worth of bytes</li>
 *   <li>Validating the length header and the channel separator</li>
 *   <li>Constructing a {@link Frame} on success</li>
 * </ul>
 *
 * <p>It does not parse control payloads and never reads past the end of the
 * frame it returns, so the same stream can be handed to another reader
 * afterwards.</p>
 */
public interface FrameDecoder
{
    /**
     * Read the next frame from {@code in}.
     *
     * @param in source stream, positioned at a frame boundary
     * @return the frame, or {@link Optional#empty()} on clean end of stream
     * @throws FramingException if the bytes do not form a valid frame
     * @throws IOException if the stream fails
     */
    Optional<Frame> decode(InputStream in) throws IOException;
}
