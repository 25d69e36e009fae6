/**
 * Wire codec for the multiplexing protocol.
 *
 * <p>Every frame on the transport has the shape</p>
 *
 * <pre>
 *   &lt;decimal length&gt;\n&lt;channel id&gt;\n&lt;payload&gt;
 * </pre>
 *
 * <p>where the length counts the bytes of {@code <channel id>\n<payload>}. An
 * empty channel id marks a control frame carrying one JSON object.</p>
 *
 * <pre>
 *   byte stream
 *        → FrameDecoder       (length header, channel separator)
 *            → Frame          (channel id + opaque payload)
 *                → control router / channel registry
 * </pre>
 *
 * <p>Nothing in this package interprets JSON or knows about channels beyond
 * their ids. The Netty transport reuses {@link com.questrail.muxbridge.codec.impl.MuxFraming}
 * so both transports share one definition of the wire rules.</p>
 */
package com.questrail.muxbridge.codec;
