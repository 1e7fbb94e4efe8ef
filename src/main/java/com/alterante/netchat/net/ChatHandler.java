package com.alterante.netchat.net;

import java.net.InetAddress;

/**
 * Consumer of inbound chat lines.
 */
@FunctionalInterface
public interface ChatHandler {

    /**
     * @param from     sender address
     * @param peerName sender's display name, or {@code UNKNOWN_HOST} if it is not in the peer table
     * @param text     the chat line
     */
    void onChat(InetAddress from, String peerName, String text);
}
