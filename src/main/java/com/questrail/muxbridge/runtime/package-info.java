/**
 * Session composition, lifecycle and the command-line entry point.
 */
package com.questrail.muxbridge.runtime;
