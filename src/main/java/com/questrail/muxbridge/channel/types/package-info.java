/**
 * Local payload types with no external resources.
 */
package com.questrail.muxbridge.channel.types;
