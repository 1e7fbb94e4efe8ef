package com.alterante.netchat.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Settings for one node, fixed at process start.
 *
 * @param name              display name announced in beacons
 * @param port              UDP and TCP port shared by all traffic
 * @param broadcastAddress  destination of discovery beacons
 * @param broadcastPeriodMs interval between beacons
 * @param pruningPeriodMs   silence after which a peer is forgotten
 * @param batchSize         bytes per file chunk
 * @param receiveWindow     credit assumed before the receiver has advertised one
 * @param packetTimeoutMs   age after which an unacknowledged chunk is re-sent
 * @param tickIntervalMs    transfer daemon period
 * @param downloadDir       where received files are written
 */
public record NodeConfig(
        String name,
        int port,
        String broadcastAddress,
        long broadcastPeriodMs,
        long pruningPeriodMs,
        int batchSize,
        int receiveWindow,
        long packetTimeoutMs,
        long tickIntervalMs,
        Path downloadDir) {

    public static final int DEFAULT_PORT = 12345;
    public static final String DEFAULT_BROADCAST_ADDRESS = "255.255.255.255";
    public static final long DEFAULT_BROADCAST_PERIOD_MS = 60_000;
    public static final long DEFAULT_PRUNING_PERIOD_MS = 120_000;
    public static final int DEFAULT_BATCH_SIZE = 1500;
    public static final int DEFAULT_RECEIVE_WINDOW = 32;
    public static final long DEFAULT_PACKET_TIMEOUT_MS = 1_000;
    public static final long DEFAULT_TICK_INTERVAL_MS = 100;
    public static final String DEFAULT_DOWNLOAD_DIR = "downloads";

    public NodeConfig {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(broadcastAddress, "broadcastAddress");
        Objects.requireNonNull(downloadDir, "downloadDir");
        if (name.isBlank()) throw new IllegalArgumentException("name must not be blank");
        if (port < 0 || port > 65535) throw new IllegalArgumentException("bad port: " + port);
        if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be positive");
        if (receiveWindow <= 0) throw new IllegalArgumentException("receiveWindow must be positive");
        if (packetTimeoutMs <= 0 || tickIntervalMs <= 0) {
            throw new IllegalArgumentException("timeouts must be positive");
        }
        if (broadcastPeriodMs <= 0 || pruningPeriodMs <= 0) {
            throw new IllegalArgumentException("periods must be positive");
        }
    }

    /** Configuration with every default except the display name. */
    public static NodeConfig defaults(String name) {
        return new NodeConfig(name, DEFAULT_PORT, DEFAULT_BROADCAST_ADDRESS,
                DEFAULT_BROADCAST_PERIOD_MS, DEFAULT_PRUNING_PERIOD_MS,
                DEFAULT_BATCH_SIZE, DEFAULT_RECEIVE_WINDOW,
                DEFAULT_PACKET_TIMEOUT_MS, DEFAULT_TICK_INTERVAL_MS,
                Path.of(DEFAULT_DOWNLOAD_DIR));
    }

    public NodeConfig withDownloadDir(Path dir) {
        return new NodeConfig(name, port, broadcastAddress, broadcastPeriodMs, pruningPeriodMs,
                batchSize, receiveWindow, packetTimeoutMs, tickIntervalMs, dir);
    }

    public NodeConfig withTiming(long packetTimeoutMs, long tickIntervalMs) {
        return new NodeConfig(name, port, broadcastAddress, broadcastPeriodMs, pruningPeriodMs,
                batchSize, receiveWindow, packetTimeoutMs, tickIntervalMs, downloadDir);
    }
}
