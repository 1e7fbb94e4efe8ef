package com.alterante.netchat.transfer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.TreeMap;

/**
 * Receiver-side state of one (peer, file) transfer.
 *
 * Chunks may arrive in any order, duplicated, and before the control chunk
 * announces the total count. Inserts are idempotent: the first payload stored
 * for a sequence number wins.
 */
public class ReceiveContext {

    public static final int UNKNOWN = -1;

    private final InetAddress peer;
    private final String fileId;
    private final long createdMs;

    private int chunkCount = UNKNOWN;
    private final TreeMap<Integer, byte[]> received = new TreeMap<>();

    ReceiveContext(InetAddress peer, String fileId, long nowMs) {
        this.peer = peer;
        this.fileId = fileId;
        this.createdMs = nowMs;
    }

    /**
     * Record the total chunk count from the control chunk. The first value wins;
     * chunks numbered beyond it are discarded.
     *
     * @return false if a different count was already known
     */
    public synchronized boolean setChunkCount(int count) {
        if (chunkCount != UNKNOWN) {
            return chunkCount == count;
        }
        chunkCount = count;
        received.tailMap(count, false).clear();
        return true;
    }

    /**
     * Store a data chunk unless that sequence number is already present.
     *
     * @return true if the chunk was new
     */
    public synchronized boolean store(int seq, byte[] payload) {
        if (seq < 1 || (chunkCount != UNKNOWN && seq > chunkCount)) {
            return false;
        }
        return received.putIfAbsent(seq, payload) == null;
    }

    /**
     * Credit to advertise: chunks still missing once the count is known,
     * otherwise {@code defaultWindow}.
     */
    public synchronized int credit(int defaultWindow) {
        return chunkCount == UNKNOWN ? defaultWindow : chunkCount - received.size();
    }

    public synchronized boolean isComplete() {
        return chunkCount != UNKNOWN && received.size() == chunkCount;
    }

    /**
     * Write the payloads in sequence order to {@code dest}, via a temporary file
     * in the same directory.
     */
    public synchronized void writeTo(Path dest) throws IOException {
        if (!isComplete()) {
            throw new IllegalStateException("transfer incomplete: " + received.size() + "/" + chunkCount);
        }
        Path dir = dest.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, ".netchat-", ".part");
        try {
            try (OutputStream out = Files.newOutputStream(tmp)) {
                for (Map.Entry<Integer, byte[]> entry : received.entrySet()) {
                    out.write(entry.getValue());
                }
            }
            Files.move(tmp, dest, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    public synchronized int receivedCount() { return received.size(); }
    public synchronized int chunkCount() { return chunkCount; }
    public synchronized boolean has(int seq) { return received.containsKey(seq); }

    public InetAddress peer() { return peer; }
    public String fileId() { return fileId; }
    public long createdMs() { return createdMs; }

    @Override
    public synchronized String toString() {
        return String.format("ReceiveContext[%s <- %s, received=%d/%s]", fileId, peer.getHostAddress(),
                received.size(), chunkCount == UNKNOWN ? "?" : String.valueOf(chunkCount));
    }
}
