/**
 * Default codec implementations.
 *
 * <p>{@link com.questrail.muxbridge.codec.impl.MuxFraming} holds the wire rules;
 * the decoder and encoder here apply them to blocking streams.</p>
 */
package com.questrail.muxbridge.codec.impl;
