package com.alterante.netchat.discovery;

import com.alterante.netchat.net.Transport;
import com.alterante.netchat.protocol.Message;
import com.alterante.netchat.protocol.MessageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Peer discovery and liveness.
 *
 * Per remote node: Unknown → Hello received → HelloAck exchanged → Known,
 * and back to Unknown after {@code pruningPeriod} of silence.
 *
 * The beacon loop runs on its own thread and only touches the transport.
 * Hello/HelloAck handling and pruning are invoked by the inbound listeners.
 */
public class Discovery {

    private static final Logger log = LoggerFactory.getLogger(Discovery.class);

    private final String myName;
    private final long broadcastPeriodMs;
    private final long pruningPeriodMs;
    private final Transport transport;
    private final PeerTable peers;
    private final MembershipListener listener;

    private final CountDownLatch stopLatch = new CountDownLatch(1);
    private volatile boolean running;
    private Thread beaconThread;

    public Discovery(String myName, long broadcastPeriodMs, long pruningPeriodMs,
                     Transport transport, PeerTable peers, MembershipListener listener) {
        this.myName = myName;
        this.broadcastPeriodMs = broadcastPeriodMs;
        this.pruningPeriodMs = pruningPeriodMs;
        this.transport = transport;
        this.peers = peers;
        this.listener = listener;
    }

    /** Start the beacon loop. The first beacon goes out immediately. */
    public void start() {
        running = true;
        beaconThread = new Thread(this::beaconLoop, "discovery-beacon");
        beaconThread.setDaemon(true);
        beaconThread.start();
    }

    public void stop() {
        running = false;
        stopLatch.countDown();
        if (beaconThread != null) {
            try {
                beaconThread.join(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void beaconLoop() {
        try {
            while (running) {
                broadcastHello();
                if (stopLatch.await(broadcastPeriodMs, TimeUnit.MILLISECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.debug("Beacon loop exited");
    }

    /** Emit one broadcast beacon. Failures are logged; the next period retries. */
    public void broadcastHello() {
        try {
            log.info("Broadcasting hello as '{}'", myName);
            transport.broadcast(MessageCodec.encode(new Message.Hello(myName)));
        } catch (IOException e) {
            log.warn("Broadcast failed: {}", e.getMessage());
        }
    }

    /**
     * Send a Hello over the connection-oriented channel to an explicit address.
     *
     * @throws IOException if the address is unreachable
     */
    public void probe(InetAddress address) throws IOException {
        if (transport.isLocal(address)) {
            throw new IllegalArgumentException("refusing to probe own address " + address.getHostAddress());
        }
        log.info("Probing {}", address.getHostAddress());
        transport.sendStream(address, MessageCodec.encode(new Message.Hello(myName)));
    }

    /**
     * A beacon or probe arrived. Registers the sender and answers with HelloAck.
     */
    public void onHello(InetAddress from, Message.Hello hello, long nowMs) {
        if (transport.isLocal(from)) {
            return;
        }
        boolean isNew = peers.upsert(from, hello.name(), nowMs);
        log.info("{} ({}) said hello{}", hello.name(), from.getHostAddress(), isNew ? " [new peer]" : "");
        peers.get(from).ifPresent(listener::peerContacted);

        try {
            transport.sendStream(from, MessageCodec.encode(new Message.HelloAck(myName)));
        } catch (IOException e) {
            log.warn("Could not answer hello from {}: {}", from.getHostAddress(), e.getMessage());
        }
    }

    /** A response to one of our beacons or probes arrived. */
    public void onHelloAck(InetAddress from, Message.HelloAck ack, long nowMs) {
        if (transport.isLocal(from)) {
            return;
        }
        boolean isNew = peers.upsert(from, ack.name(), nowMs);
        log.info("{} ({}) answered hello{}", ack.name(), from.getHostAddress(), isNew ? " [new peer]" : "");
        peers.get(from).ifPresent(listener::peerContacted);
    }

    /**
     * Drop peers silent for longer than the pruning period.
     *
     * @return the pruned records
     */
    public List<PeerRecord> prune(long nowMs) {
        List<PeerRecord> pruned = peers.prune(nowMs, pruningPeriodMs);
        for (PeerRecord peer : pruned) {
            log.info("Pruning peer due to inactivity: {} ({})", peer.name(), peer.address().getHostAddress());
            listener.peerPruned(peer);
        }
        return pruned;
    }

    public String myName() { return myName; }
    public PeerTable peers() { return peers; }
}
