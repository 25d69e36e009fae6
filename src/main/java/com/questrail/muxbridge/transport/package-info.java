/**
 * Transport ports and adapters.
 *
 * <p>Transports move whole {@link com.questrail.muxbridge.codec.Frame}s and
 * report lifecycle changes. They carry no protocol meaning: they never look
 * inside control payloads and never originate traffic on their own.</p>
 */
package com.questrail.muxbridge.transport;
