package com.alterante.netchat.net;

import com.alterante.netchat.config.NodeConfig;
import com.alterante.netchat.discovery.Discovery;
import com.alterante.netchat.discovery.MembershipListener;
import com.alterante.netchat.discovery.PeerRecord;
import com.alterante.netchat.discovery.PeerTable;
import com.alterante.netchat.protocol.Message;
import com.alterante.netchat.protocol.MessageCodec;
import com.alterante.netchat.transfer.SendContext;
import com.alterante.netchat.transfer.TransferDaemon;
import com.alterante.netchat.transfer.TransferEngine;
import com.alterante.netchat.transfer.TransferListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Top-level orchestrator for one node.
 *
 * Wires discovery, the peer table, per-peer session listeners and the transfer
 * engine over a single {@link Transport}, and exposes the operations the
 * command shell needs.
 */
public class NetchatNode implements MembershipListener, MessageHandler {

    private static final Logger log = LoggerFactory.getLogger(NetchatNode.class);

    static final String UNKNOWN_HOST = "UNKNOWN_HOST";

    private final NodeConfig config;
    private final Transport transport;
    private final ChatHandler chatHandler;

    private final PeerTable peers = new PeerTable();
    private final Discovery discovery;
    private final SessionSupervisor sessions;
    private final InboundRouter router;
    private final TransferEngine engine;
    private final TransferDaemon daemon;

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean stopped = new AtomicBoolean();

    public NetchatNode(NodeConfig config, Transport transport, ChatHandler chatHandler,
                       TransferListener transferListener) {
        this.config = config;
        this.transport = transport;
        this.chatHandler = chatHandler;

        this.discovery = new Discovery(config.name(), config.broadcastPeriodMs(), config.pruningPeriodMs(),
                transport, peers, this);
        this.sessions = new SessionSupervisor(this);
        this.router = new InboundRouter(transport, discovery, sessions);
        this.engine = new TransferEngine(transport, config.batchSize(), config.receiveWindow(),
                config.packetTimeoutMs(), config.downloadDir(), transferListener);
        this.daemon = new TransferDaemon(engine, config.tickIntervalMs());
    }

    /** Start listening, the transfer daemon, and the beacon loop. */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("node already started");
        }
        router.start();
        daemon.start();
        discovery.start();
        log.info("Node '{}' up at {}", config.name(), transport.localAddress().getHostAddress());
    }

    /** Stop every loop and release the sockets. Safe to call more than once. */
    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) return;
        log.info("Terminating...");
        discovery.stop();
        router.stop();
        sessions.shutdown();
        daemon.stop();
        transport.close();
        log.info("Node '{}' stopped", config.name());
    }

    // --- Command surface ---

    /** Known peers ordered by address. */
    public List<PeerRecord> peers() {
        return peers.snapshot();
    }

    public String myName() {
        return config.name();
    }

    public InetAddress myAddress() {
        return transport.localAddress();
    }

    /** Send a discovery probe to an explicit address. */
    public void probe(InetAddress address) throws IOException {
        discovery.probe(address);
    }

    /** Send a chat line to the peer with display name {@code name}. */
    public void sendChat(String name, String text) throws IOException, PeerNotFoundException {
        PeerRecord peer = peers.findByName(name).orElseThrow(() -> new PeerNotFoundException(name));
        transport.sendStream(peer.address(), MessageCodec.encode(new Message.Chat(text)));
        log.debug("Sent chat to {} ({})", name, peer.address().getHostAddress());
    }

    /** Start sending {@code file} to the peer with display name {@code name}. */
    public SendContext sendFile(String name, Path file) throws IOException, PeerNotFoundException {
        PeerRecord peer = peers.findByName(name).orElseThrow(() -> new PeerNotFoundException(name));
        return engine.startSend(peer.address(), file, System.currentTimeMillis());
    }

    /** Outbound transfers in progress. */
    public List<SendContext> transfers() {
        return engine.activeSends();
    }

    // --- MembershipListener ---

    @Override
    public void peerContacted(PeerRecord peer) {
        sessions.ensure(peer.address());
    }

    @Override
    public void peerPruned(PeerRecord peer) {
        sessions.retire(peer.address());
        engine.abandon(peer.address());
    }

    // --- MessageHandler (session listeners) ---

    @Override
    public void handle(InetAddress from, Message message) {
        long now = System.currentTimeMillis();
        peers.touch(from, now);
        switch (message.type()) {
            case HELLO -> discovery.onHello(from, (Message.Hello) message, now);
            case HELLO_ACK -> discovery.onHelloAck(from, (Message.HelloAck) message, now);
            case CHAT -> {
                String name = peers.get(from).map(PeerRecord::name).orElse(UNKNOWN_HOST);
                chatHandler.onChat(from, name, ((Message.Chat) message).text());
            }
            case FILE_CHUNK -> engine.onChunk(from, (Message.FileChunk) message, now);
            case FILE_ACK -> engine.onAck(from, (Message.FileAck) message);
        }
    }

    public NodeConfig config() { return config; }
    public PeerTable peerTable() { return peers; }
    public Discovery discovery() { return discovery; }
    public TransferEngine engine() { return engine; }
    public SessionSupervisor sessions() { return sessions; }
}
