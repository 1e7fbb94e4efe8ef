package com.alterante.netchat.transfer;

import java.net.InetAddress;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Sender-side state of one (peer, file) transfer.
 *
 * Chunks are loaded once. The control chunk (seq 0) is tracked separately: it
 * is re-sent until acknowledged and never counts against the window. Data
 * chunks are admitted only after the control chunk is acknowledged, so the
 * receiver has already opened a fresh context for them, and then in sequence
 * order while the number in flight is below the receiver's credit. In-flight
 * chunks older than the packet timeout are handed back for retransmission with
 * the same sequence.
 *
 * The window is enforced at admission only. An ack may lower the credit below
 * the number already in flight; those chunks stay in flight and nothing new is
 * admitted until the count drops below the credit again. A credit of 0 with
 * unsent chunks and nothing in flight still admits one chunk at a time, so a
 * stale zero never stalls the send.
 *
 * All state is guarded by the instance monitor: the transfer daemon ticks the
 * context while inbound acknowledgements update it from a listener thread.
 */
public class SendContext {

    private final InetAddress peer;
    private final String fileId;
    private final List<Chunk> chunks;
    private final long createdMs;

    private int nextSeq = 1;
    private final LinkedHashMap<Integer, Long> inFlight = new LinkedHashMap<>();
    private final Set<Integer> acknowledged = new HashSet<>();
    private int credit;

    private boolean controlAcked;
    private long controlSentMs = -1;

    private long packetsSent;
    private long retransmissions;

    SendContext(InetAddress peer, Path path, List<Chunk> chunks, int initialCredit, long nowMs) {
        this.peer = peer;
        this.fileId = path.getFileName().toString();
        this.chunks = List.copyOf(chunks);
        this.credit = initialCredit;
        this.createdMs = nowMs;
    }

    /**
     * In-flight chunks whose last send is at least {@code timeoutMs} old. Their
     * timestamps are refreshed to {@code nowMs}; the caller must re-send them.
     */
    public synchronized List<Chunk> retransmittable(long nowMs, long timeoutMs) {
        List<Chunk> due = new ArrayList<>();
        for (Map.Entry<Integer, Long> entry : inFlight.entrySet()) {
            if (nowMs - entry.getValue() >= timeoutMs) {
                due.add(chunk(entry.getKey()));
                entry.setValue(nowMs);
            }
        }
        retransmissions += due.size();
        packetsSent += due.size();
        return due;
    }

    /**
     * Next unsent chunk if the control chunk is acknowledged and the window has
     * room, moved into flight at {@code nowMs}.
     * @return the chunk to send, or null if the window is full or nothing is left
     */
    public synchronized Chunk admitNext(long nowMs) {
        if (!controlAcked || nextSeq > chunks.size()) {
            return null;
        }
        if (inFlight.size() >= Math.max(credit, 1)) {
            return null;
        }
        Chunk next = chunk(nextSeq++);
        inFlight.put(next.seq(), nowMs);
        packetsSent++;
        return next;
    }

    /**
     * Whether the control chunk should be (re)sent now. Marks it sent if so.
     */
    public synchronized boolean controlDue(long nowMs, long timeoutMs) {
        if (controlAcked) return false;
        if (controlSentMs >= 0 && nowMs - controlSentMs < timeoutMs) return false;
        if (controlSentMs >= 0) retransmissions++;
        controlSentMs = nowMs;
        packetsSent++;
        return true;
    }

    /**
     * Apply an acknowledgement. Idempotent for a repeated (seq, credit) pair.
     *
     * @return false if {@code seq} was never sent, so the ack is meaningless
     */
    public synchronized boolean onAck(int seq, int advertisedCredit) {
        if (seq == 0) {
            credit = advertisedCredit;
            controlAcked = true;
            return true;
        }
        if (seq < 1 || seq >= nextSeq) {
            return false;
        }
        credit = advertisedCredit;
        if (acknowledged.add(seq)) {
            inFlight.remove(seq);
        }
        return true;
    }

    /** All data chunks and the control chunk are acknowledged. */
    public synchronized boolean isComplete() {
        return controlAcked && acknowledged.size() == chunks.size();
    }

    private Chunk chunk(int seq) {
        return chunks.get(seq - 1);
    }

    public synchronized int inFlightCount() { return inFlight.size(); }
    public synchronized int acknowledgedCount() { return acknowledged.size(); }
    public synchronized int credit() { return credit; }
    public synchronized int nextSeq() { return nextSeq; }
    public synchronized boolean isInFlight(int seq) { return inFlight.containsKey(seq); }
    public synchronized boolean isAcknowledged(int seq) { return acknowledged.contains(seq); }
    public synchronized boolean controlAcked() { return controlAcked; }
    public synchronized long packetsSent() { return packetsSent; }
    public synchronized long retransmissions() { return retransmissions; }

    public InetAddress peer() { return peer; }
    public String fileId() { return fileId; }
    public int chunkCount() { return chunks.size(); }
    public long createdMs() { return createdMs; }

    @Override
    public synchronized String toString() {
        return String.format("SendContext[%s -> %s, acked=%d/%d, inFlight=%d, credit=%d]",
                fileId, peer.getHostAddress(), acknowledged.size(), chunks.size(), inFlight.size(), credit);
    }
}
