package com.questrail.muxbridge.codec.impl;

import com.questrail.muxbridge.codec.Frame;
import com.questrail.muxbridge.codec.FrameEncoder;

import java.util.Objects;

/**
 * Concrete implementation of {@link FrameEncoder}.
 */
public final class DefaultFrameEncoder implements FrameEncoder
{
    @Override
    public byte[] encode(Frame frame)
    {
        return MuxFraming.join(Objects.requireNonNull(frame, "frame"));
    }
}
