package com.alterante.netchat.net;

import com.alterante.netchat.protocol.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns one {@link PeerSession} per known peer. A session is started on first
 * contact and stopped when the peer is pruned or the node shuts down.
 */
public class SessionSupervisor {

    private static final Logger log = LoggerFactory.getLogger(SessionSupervisor.class);

    private final MessageHandler handler;
    private final Map<InetAddress, PeerSession> sessions = new ConcurrentHashMap<>();
    private volatile boolean shutdown;

    public SessionSupervisor(MessageHandler handler) {
        this.handler = handler;
    }

    /** Start the peer's listeners unless they are already running. */
    public void ensure(InetAddress peer) {
        if (shutdown) return;
        sessions.computeIfAbsent(peer, p -> {
            log.info("Starting listeners for {}", p.getHostAddress());
            PeerSession session = new PeerSession(p, handler);
            session.start();
            return session;
        });
    }

    /** Stop the peer's listeners. */
    public void retire(InetAddress peer) {
        PeerSession session = sessions.remove(peer);
        if (session != null) {
            log.info("Retiring listeners for {}", peer.getHostAddress());
            session.stop();
        }
    }

    /** Hand a datagram message to its peer's session. Returns false if there is none or it is saturated. */
    public boolean routeDatagram(InetAddress from, Message message) {
        PeerSession session = sessions.get(from);
        return session != null && session.offerDatagram(message);
    }

    /** Hand a stream message to its peer's session. Returns false if there is none or it is saturated. */
    public boolean routeStream(InetAddress from, Message message) {
        PeerSession session = sessions.get(from);
        return session != null && session.offerStream(message);
    }

    public boolean hasSession(InetAddress peer) {
        return sessions.containsKey(peer);
    }

    public int size() {
        return sessions.size();
    }

    /** Stop every session; no new ones are started afterwards. */
    public void shutdown() {
        shutdown = true;
        for (InetAddress peer : sessions.keySet()) {
            retire(peer);
        }
    }
}
