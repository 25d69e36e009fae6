/**
 * Dispatch of front-end frames to channels and session-wide handlers.
 */
package com.questrail.muxbridge.router;
