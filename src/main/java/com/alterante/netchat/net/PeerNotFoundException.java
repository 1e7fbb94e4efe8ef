package com.alterante.netchat.net;

/**
 * Thrown when no known peer has the requested display name.
 */
public class PeerNotFoundException extends Exception {

    public PeerNotFoundException(String name) {
        super("Peer with name \"" + name + "\" not found");
    }
}
