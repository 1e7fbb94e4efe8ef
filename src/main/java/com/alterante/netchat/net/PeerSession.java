package com.alterante.netchat.net;

import com.alterante.netchat.protocol.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * The two listeners of one known peer: one for connectionless traffic and one
 * for connection-oriented traffic. Each drains its own queue, fed by the
 * {@link InboundRouter}, and hands messages to the {@link MessageHandler}.
 *
 * Listeners poll with a short timeout so {@link #stop()} takes effect within
 * one poll interval.
 */
public class PeerSession {

    private static final Logger log = LoggerFactory.getLogger(PeerSession.class);

    static final int POLL_TIMEOUT_MS = 250;
    static final int QUEUE_CAPACITY = 1024;

    private final InetAddress peer;
    private final MessageHandler handler;
    private final BlockingQueue<Message> datagrams = new LinkedBlockingQueue<>(QUEUE_CAPACITY);
    private final BlockingQueue<Message> streams = new LinkedBlockingQueue<>(QUEUE_CAPACITY);

    private volatile boolean running;
    private Thread datagramListener;
    private Thread streamListener;

    public PeerSession(InetAddress peer, MessageHandler handler) {
        this.peer = peer;
        this.handler = handler;
    }

    public void start() {
        running = true;
        String ip = peer.getHostAddress();
        datagramListener = new Thread(() -> listen(datagrams), "peer-" + ip + "-dgram");
        streamListener = new Thread(() -> listen(streams), "peer-" + ip + "-stream");
        datagramListener.setDaemon(true);
        streamListener.setDaemon(true);
        datagramListener.start();
        streamListener.start();
        log.debug("Session listeners started for {}", ip);
    }

    public void stop() {
        running = false;
        join(datagramListener);
        join(streamListener);
        datagrams.clear();
        streams.clear();
        log.debug("Session listeners stopped for {}", peer.getHostAddress());
    }

    /** Queue a message that arrived as a datagram. Returns false if the queue is full. */
    public boolean offerDatagram(Message message) {
        return running && datagrams.offer(message);
    }

    /** Queue a message that arrived over a stream connection. Returns false if the queue is full. */
    public boolean offerStream(Message message) {
        return running && streams.offer(message);
    }

    private void listen(BlockingQueue<Message> queue) {
        while (running) {
            Message message;
            try {
                message = queue.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (message == null) continue;
            try {
                handler.handle(peer, message);
            } catch (RuntimeException e) {
                log.warn("Error handling {} from {}: {}", message.type(), peer.getHostAddress(), e.getMessage(), e);
            }
        }
    }

    private static void join(Thread thread) {
        if (thread == null || thread == Thread.currentThread()) return;
        try {
            thread.join(POLL_TIMEOUT_MS * 4L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public InetAddress peer() { return peer; }
    public boolean isRunning() { return running; }
}
