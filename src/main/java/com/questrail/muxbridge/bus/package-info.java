/**
 * The internal object bus: exported objects described by explicit interface
 * tables, and the {@code dbus-json3} channel that exposes them to the front end.
 */
package com.questrail.muxbridge.bus;
