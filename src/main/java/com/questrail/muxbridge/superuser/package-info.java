/**
 * Superuser elevation: the {@code /superuser} state machine, spawned peers and
 * the channels routed into them.
 */
package com.questrail.muxbridge.superuser;
