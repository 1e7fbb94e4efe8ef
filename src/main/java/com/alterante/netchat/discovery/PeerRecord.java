package com.alterante.netchat.discovery;

import java.net.InetAddress;

/**
 * A known remote node.
 *
 * @param address    network address, unique key in the {@link PeerTable}
 * @param name       display name from the latest beacon or response
 * @param lastSeenMs time of the latest traffic from this address
 */
public record PeerRecord(InetAddress address, String name, long lastSeenMs) {

    public PeerRecord touched(long nowMs) {
        return new PeerRecord(address, name, Math.max(lastSeenMs, nowMs));
    }

    public PeerRecord renamed(String newName, long nowMs) {
        return new PeerRecord(address, newName, Math.max(lastSeenMs, nowMs));
    }

    public boolean expired(long nowMs, long pruningPeriodMs) {
        return nowMs - lastSeenMs > pruningPeriodMs;
    }
}
