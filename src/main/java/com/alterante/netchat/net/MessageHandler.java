package com.alterante.netchat.net;

import com.alterante.netchat.protocol.Message;

import java.net.InetAddress;

/**
 * Receives decoded messages from a peer's session listeners.
 */
@FunctionalInterface
public interface MessageHandler {

    void handle(InetAddress from, Message message);
}
