package com.questrail.muxbridge.transport.stream;

import com.questrail.muxbridge.codec.Frame;
import com.questrail.muxbridge.codec.FramingException;
import com.questrail.muxbridge.test.RecordingTransportListener;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StreamFrameTransportTest
 * -----------------------------------------------------------------------------
 * Lifecycle and framing of {@link StreamFrameTransport} over in-memory streams.
 */
final class StreamFrameTransportTest
{
    private static ByteArrayInputStream input(String wire)
    {
        return new ByteArrayInputStream(wire.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void deliversFramesThenCleanEnd() throws Exception
    {
        RecordingTransportListener listener = new RecordingTransportListener();
        StreamFrameTransport transport = new StreamFrameTransport(
                input("4\nch\nx3\n\n{}"), new ByteArrayOutputStream(), "test");
        transport.setListener(listener);
        transport.start();

        assertTrue(listener.awaitUp());
        assertEquals("ch", listener.nextFrame().channel());
        assertTrue(listener.nextFrame().isControl());
        assertNull(listener.awaitDown());
    }

    @Test
    void truncatedInputIsReportedAsFailure() throws Exception
    {
        RecordingTransportListener listener = new RecordingTransportListener();
        StreamFrameTransport transport = new StreamFrameTransport(
                input("10\nch\n"), new ByteArrayOutputStream(), "test");
        transport.setListener(listener);
        transport.start();

        assertInstanceOf(FramingException.class, listener.awaitDown());
    }

    @Test
    void writesEncodedFrames()
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        StreamFrameTransport transport = new StreamFrameTransport(input(""), out, "test");

        transport.send(new Frame("a", "b".getBytes(StandardCharsets.UTF_8)));
        assertEquals("3\na\nb", out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void stopReportsDownOnceAndDropsLaterSends() throws Exception
    {
        PipedOutputStream feed = new PipedOutputStream();
        PipedInputStream in = new PipedInputStream(feed);
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        RecordingTransportListener listener = new RecordingTransportListener();
        StreamFrameTransport transport = new StreamFrameTransport(in, out, "test");
        transport.setListener(listener);
        transport.start();
        assertTrue(listener.awaitUp());

        transport.stop();
        assertNull(listener.awaitDown());

        transport.send(Frame.control("{}".getBytes(StandardCharsets.UTF_8)));
        assertEquals(0, out.size());
    }

    @Test
    void startRequiresListener()
    {
        StreamFrameTransport transport = new StreamFrameTransport(input(""), new ByteArrayOutputStream(), "test");
        assertThrows(IllegalStateException.class, transport::start);
    }
}
