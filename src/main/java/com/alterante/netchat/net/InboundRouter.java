package com.alterante.netchat.net;

import com.alterante.netchat.discovery.Discovery;
import com.alterante.netchat.protocol.Message;
import com.alterante.netchat.protocol.MalformedMessageException;
import com.alterante.netchat.protocol.MessageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Reads the node's shared sockets and routes each decoded message.
 *
 * Hello and HelloAck go straight to {@link Discovery}; everything else goes to
 * the sending peer's {@link PeerSession}. Messages from addresses without a
 * session are dropped. The datagram loop also runs the pruning sweep once per
 * poll cycle.
 *
 * Both loops block for at most {@link #POLL_TIMEOUT_MS} per cycle. Decode and
 * transport errors are logged and never end a loop.
 */
public class InboundRouter {

    private static final Logger log = LoggerFactory.getLogger(InboundRouter.class);

    static final int POLL_TIMEOUT_MS = 250;

    private final Transport transport;
    private final Discovery discovery;
    private final SessionSupervisor sessions;
    private final CountDownLatch stopLatch = new CountDownLatch(1);

    private volatile boolean running;
    private Thread datagramThread;
    private Thread streamThread;

    public InboundRouter(Transport transport, Discovery discovery, SessionSupervisor sessions) {
        this.transport = transport;
        this.discovery = discovery;
        this.sessions = sessions;
    }

    public void start() {
        running = true;
        datagramThread = new Thread(this::datagramLoop, "inbound-datagram");
        streamThread = new Thread(this::streamLoop, "inbound-stream");
        datagramThread.setDaemon(true);
        streamThread.setDaemon(true);
        datagramThread.start();
        streamThread.start();
    }

    public void stop() {
        running = false;
        stopLatch.countDown();
        for (Thread t : new Thread[]{datagramThread, streamThread}) {
            if (t == null) continue;
            try {
                t.join(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public boolean isRunning() {
        return running;
    }

    private void datagramLoop() {
        while (running) {
            try {
                Transport.Inbound in = transport.receiveDatagram(POLL_TIMEOUT_MS);
                if (in != null) {
                    route(in, false);
                }
                discovery.prune(System.currentTimeMillis());
            } catch (IOException e) {
                if (!running) break;
                log.warn("Datagram receive error: {}", e.getMessage());
                pause();
            } catch (RuntimeException e) {
                log.warn("Unexpected error in datagram loop: {}", e.getMessage(), e);
            }
        }
        log.debug("Datagram loop exited");
    }

    private void streamLoop() {
        while (running) {
            try {
                Transport.Inbound in = transport.acceptStream(POLL_TIMEOUT_MS);
                if (in != null) {
                    route(in, true);
                }
            } catch (IOException e) {
                if (!running) break;
                log.warn("Stream receive error: {}", e.getMessage());
                pause();
            } catch (RuntimeException e) {
                log.warn("Unexpected error in stream loop: {}", e.getMessage(), e);
            }
        }
        log.debug("Stream loop exited");
    }

    /** Decode and dispatch one inbound message. */
    void route(Transport.Inbound in, boolean stream) {
        Message message;
        try {
            message = MessageCodec.decode(in.data(), in.length());
        } catch (MalformedMessageException e) {
            log.debug("Ignoring malformed message from {}: {}", in.from().getHostAddress(), e.getMessage());
            return;
        }

        long now = System.currentTimeMillis();
        switch (message.type()) {
            case HELLO -> discovery.onHello(in.from(), (Message.Hello) message, now);
            case HELLO_ACK -> discovery.onHelloAck(in.from(), (Message.HelloAck) message, now);
            default -> {
                boolean queued = stream
                        ? sessions.routeStream(in.from(), message)
                        : sessions.routeDatagram(in.from(), message);
                if (!queued) {
                    log.debug("No session for {}, dropping {}", in.from().getHostAddress(), message.type());
                }
            }
        }
    }

    /** Back off after a transport error without outliving a stop request. */
    private void pause() {
        try {
            stopLatch.await(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }
}
