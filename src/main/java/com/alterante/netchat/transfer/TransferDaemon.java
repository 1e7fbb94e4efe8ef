package com.alterante.netchat.transfer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Drives all outbound transfers at a steady interval, independent of chunk
 * size or round-trip time.
 */
public class TransferDaemon {

    private static final Logger log = LoggerFactory.getLogger(TransferDaemon.class);

    private final TransferEngine engine;
    private final long tickIntervalMs;
    private final CountDownLatch stopLatch = new CountDownLatch(1);

    private volatile boolean running;
    private Thread thread;
    private long totalTicks;

    public TransferDaemon(TransferEngine engine, long tickIntervalMs) {
        this.engine = engine;
        this.tickIntervalMs = tickIntervalMs;
    }

    public void start() {
        running = true;
        thread = new Thread(this::loop, "transfer-daemon");
        thread.setDaemon(true);
        thread.start();
    }

    public void stop() {
        running = false;
        stopLatch.countDown();
        if (thread != null) {
            try {
                thread.join(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void loop() {
        try {
            while (running) {
                try {
                    engine.tickAll(System.currentTimeMillis());
                    totalTicks++;
                } catch (RuntimeException e) {
                    log.warn("Unexpected error in transfer tick: {}", e.getMessage(), e);
                }
                if (stopLatch.await(tickIntervalMs, TimeUnit.MILLISECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.debug("Transfer daemon exited after {} ticks", totalTicks);
    }

    public boolean isRunning() {
        return running;
    }
}
