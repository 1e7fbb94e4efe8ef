package com.alterante.netchat.net;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetAddress;
import java.util.Arrays;

/**
 * Network I/O used by the node: a connectionless channel (unicast and
 * broadcast datagrams) and a connection-oriented channel carrying one message
 * per connection. Both share the node's port.
 *
 * Receive calls block for at most the given timeout so that callers can
 * re-check their running flag.
 */
public interface Transport extends Closeable {

    /** Bytes received from a remote address. */
    record Inbound(InetAddress from, byte[] data) {
        public Inbound {
            data = Arrays.copyOf(data, data.length);
        }

        @Override
        public byte[] data() { return Arrays.copyOf(data, data.length); }

        public int length() { return data.length; }
    }

    /** Send one datagram to {@code to}. */
    void sendDatagram(InetAddress to, byte[] data) throws IOException;

    /** Send one datagram to the subnet broadcast address. */
    void broadcast(byte[] data) throws IOException;

    /**
     * Open a connection to {@code to}, write {@code data} and close it.
     *
     * @throws IOException if the peer is unreachable or refuses the connection
     */
    void sendStream(InetAddress to, byte[] data) throws IOException;

    /**
     * Wait up to {@code timeoutMs} for a datagram.
     * @return the datagram, or null on timeout
     */
    Inbound receiveDatagram(int timeoutMs) throws IOException;

    /**
     * Wait up to {@code timeoutMs} for an inbound connection and read its message.
     * @return the message, or null on timeout
     */
    Inbound acceptStream(int timeoutMs) throws IOException;

    /** Whether {@code address} belongs to this node. */
    boolean isLocal(InetAddress address);

    /** The address this node reports as its own. */
    InetAddress localAddress();

    @Override
    void close();
}
