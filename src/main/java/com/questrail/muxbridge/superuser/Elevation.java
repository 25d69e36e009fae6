package com.questrail.muxbridge.superuser;

/**
 * Whoever asked for the peer to be started, and how to talk back to them.
 */
interface Elevation
{
    /**
     * The peer asked for a credential.
     */
    void prompt(String cookie, String prompt, boolean echo);

    void succeeded();

    void failed(String message);

    /**
     * Cookie of the prompt awaiting an answer, or {@code null}.
     */
    String pendingCookie();

    void answered();
}
