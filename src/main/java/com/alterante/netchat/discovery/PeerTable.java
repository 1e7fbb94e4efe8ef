package com.alterante.netchat.discovery;

import java.net.InetAddress;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-wide table of known peers keyed by address.
 *
 * Every read and update goes through the backing {@link ConcurrentHashMap};
 * compound updates use its atomic {@code compute} operations.
 */
public class PeerTable {

    private static final Comparator<PeerRecord> BY_ADDRESS =
            (a, b) -> Arrays.compareUnsigned(a.address().getAddress(), b.address().getAddress());

    private final Map<InetAddress, PeerRecord> peers = new ConcurrentHashMap<>();

    /**
     * Insert or refresh a peer.
     *
     * @return true if the address was not in the table before
     */
    public boolean upsert(InetAddress address, String name, long nowMs) {
        AtomicBoolean created = new AtomicBoolean();
        peers.compute(address, (addr, existing) -> {
            if (existing == null) {
                created.set(true);
                return new PeerRecord(addr, name, nowMs);
            }
            return existing.renamed(name, nowMs);
        });
        return created.get();
    }

    /**
     * Refresh the last-seen time of a known peer. Unknown addresses are ignored.
     *
     * @return true if the peer is known
     */
    public boolean touch(InetAddress address, long nowMs) {
        return peers.computeIfPresent(address, (addr, existing) -> existing.touched(nowMs)) != null;
    }

    public Optional<PeerRecord> get(InetAddress address) {
        return Optional.ofNullable(peers.get(address));
    }

    public boolean contains(InetAddress address) {
        return peers.containsKey(address);
    }

    /** First peer whose display name equals {@code name}. */
    public Optional<PeerRecord> findByName(String name) {
        return peers.values().stream()
                .filter(p -> p.name().equals(name))
                .min(BY_ADDRESS);
    }

    /** Snapshot ordered by address. */
    public List<PeerRecord> snapshot() {
        List<PeerRecord> list = new ArrayList<>(peers.values());
        list.sort(BY_ADDRESS);
        return list;
    }

    public int size() {
        return peers.size();
    }

    /**
     * Remove peers silent for longer than {@code pruningPeriodMs}.
     *
     * @return the removed records
     */
    public List<PeerRecord> prune(long nowMs, long pruningPeriodMs) {
        List<PeerRecord> removed = new ArrayList<>();
        for (PeerRecord candidate : peers.values()) {
            if (!candidate.expired(nowMs, pruningPeriodMs)) continue;
            // Only remove if it was not refreshed since we looked
            AtomicBoolean gone = new AtomicBoolean();
            peers.computeIfPresent(candidate.address(), (addr, current) -> {
                if (!current.expired(nowMs, pruningPeriodMs)) return current;
                gone.set(true);
                return null;
            });
            if (gone.get()) {
                removed.add(candidate);
            }
        }
        return removed;
    }
}
