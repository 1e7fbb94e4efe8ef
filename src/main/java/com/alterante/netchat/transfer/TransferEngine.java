package com.alterante.netchat.transfer;

import com.alterante.netchat.net.Transport;
import com.alterante.netchat.protocol.Message;
import com.alterante.netchat.protocol.MessageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sliding-window file transfer over the connectionless channel.
 *
 * Sender: {@link #startSend} loads the file and announces the chunk count;
 * {@link #tickAll} (driven by {@link TransferDaemon}) retransmits timed-out
 * chunks and admits new ones within the receiver's credit; {@link #onAck}
 * applies acknowledgements.
 *
 * Receiver: {@link #onChunk} stores chunks idempotently, acknowledges every
 * arrival over the connection-oriented channel, and assembles the file once
 * all chunks are present.
 *
 * Contexts are keyed by (peer, file name). Both maps are concurrent; each
 * context guards its own fields.
 */
public class TransferEngine {

    private static final Logger log = LoggerFactory.getLogger(TransferEngine.class);

    /** How long a finished inbound transfer is remembered so late data chunks are only re-acked. */
    public static final long COMPLETED_LINGER_MS = 30_000;

    /** Join key between a sender's and a receiver's contexts. */
    public record TransferKey(InetAddress peer, String fileId) {}

    private final Transport transport;
    private final int batchSize;
    private final int receiveWindow;
    private final long packetTimeoutMs;
    private final Path downloadDir;
    private final TransferListener listener;

    private final Map<TransferKey, SendContext> sends = new ConcurrentHashMap<>();
    private final Map<TransferKey, ReceiveContext> receives = new ConcurrentHashMap<>();
    private final Map<TransferKey, Long> completedReceives = new ConcurrentHashMap<>();

    public TransferEngine(Transport transport, int batchSize, int receiveWindow, long packetTimeoutMs,
                          Path downloadDir, TransferListener listener) {
        this.transport = transport;
        this.batchSize = batchSize;
        this.receiveWindow = receiveWindow;
        this.packetTimeoutMs = packetTimeoutMs;
        this.downloadDir = downloadDir;
        this.listener = listener != null ? listener : TransferListener.NONE;
    }

    // --- Sender ---

    /**
     * Begin sending {@code file} to {@code peer}. The control chunk goes out immediately;
     * data chunks follow on the daemon's ticks once it is acknowledged.
     *
     * @throws NoSuchFileException   if the file does not exist or is not a regular file
     * @throws AccessDeniedException if the file is not readable
     * @throws IOException           if reading the file fails
     * @throws IllegalStateException if a transfer of the same file to the same peer is running
     */
    public SendContext startSend(InetAddress peer, Path file, long nowMs) throws IOException {
        if (!Files.exists(file)) {
            throw new NoSuchFileException(file.toString());
        }
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString(), null, "not a regular file");
        }
        if (!Files.isReadable(file)) {
            throw new AccessDeniedException(file.toString());
        }

        List<Chunk> chunks = Chunk.split(file, batchSize);
        SendContext ctx = new SendContext(peer, file, chunks, receiveWindow, nowMs);
        TransferKey key = new TransferKey(peer, ctx.fileId());
        if (sends.putIfAbsent(key, ctx) != null) {
            throw new IllegalStateException("already sending " + ctx.fileId() + " to " + peer.getHostAddress());
        }

        log.info("Sending {} to {} ({} chunks of up to {} bytes)",
                ctx.fileId(), peer.getHostAddress(), ctx.chunkCount(), batchSize);
        if (ctx.controlDue(nowMs, packetTimeoutMs)) {
            sendControl(ctx);
        }
        return ctx;
    }

    /**
     * One daemon step for one transfer: retransmit expired chunks, then admit new
     * chunks while the window has room.
     */
    public void tick(SendContext ctx, long nowMs) {
        for (Chunk chunk : ctx.retransmittable(nowMs, packetTimeoutMs)) {
            log.debug("Retransmitting {} seq={} to {}", ctx.fileId(), chunk.seq(), ctx.peer().getHostAddress());
            sendChunk(ctx, chunk);
        }
        if (ctx.controlDue(nowMs, packetTimeoutMs)) {
            sendControl(ctx);
        }
        Chunk next;
        while ((next = ctx.admitNext(nowMs)) != null) {
            sendChunk(ctx, next);
        }
    }

    /** Tick every active send; remove and report the ones that completed. */
    public void tickAll(long nowMs) {
        for (Map.Entry<TransferKey, SendContext> entry : sends.entrySet()) {
            SendContext ctx = entry.getValue();
            if (ctx.isComplete()) {
                if (sends.remove(entry.getKey(), ctx)) {
                    log.info("Transfer of {} to {} complete ({} packets, {} retransmissions)",
                            ctx.fileId(), ctx.peer().getHostAddress(), ctx.packetsSent(), ctx.retransmissions());
                    listener.sendCompleted(ctx.peer(), ctx.fileId());
                }
                continue;
            }
            tick(ctx, nowMs);
        }
    }

    /** Apply an inbound acknowledgement. Acks for unknown transfers are dropped. */
    public void onAck(InetAddress peer, Message.FileAck ack) {
        SendContext ctx = sends.get(new TransferKey(peer, ack.fileId()));
        if (ctx == null) {
            log.debug("Ack for unknown transfer {} from {}", ack.fileId(), peer.getHostAddress());
            return;
        }
        if (!ctx.onAck(ack.seq(), ack.credit())) {
            log.debug("Ignoring ack for unsent seq={} of {}", ack.seq(), ack.fileId());
        }
    }

    private void sendChunk(SendContext ctx, Chunk chunk) {
        send(ctx, new Message.FileChunk(ctx.fileId(), chunk.seq(), chunk.data()));
    }

    private void sendControl(SendContext ctx) {
        send(ctx, Message.FileChunk.control(ctx.fileId(), ctx.chunkCount()));
    }

    private void send(SendContext ctx, Message.FileChunk chunk) {
        try {
            transport.sendDatagram(ctx.peer(), MessageCodec.encode(chunk));
        } catch (IOException e) {
            // Left in flight; the timeout path retries it
            log.warn("Failed to send {} seq={} to {}: {}",
                    ctx.fileId(), chunk.seq(), ctx.peer().getHostAddress(), e.getMessage());
        }
    }

    // --- Receiver ---

    /**
     * Handle an inbound chunk: store it, acknowledge it, and assemble the file if
     * it was the last one missing.
     */
    public void onChunk(InetAddress peer, Message.FileChunk chunk, long nowMs) {
        TransferKey key = new TransferKey(peer, chunk.fileId());
        forgetCompletedBefore(nowMs - COMPLETED_LINGER_MS);

        if (completedReceives.containsKey(key) && !receives.containsKey(key)) {
            if (!chunk.isControl()) {
                log.debug("Late chunk seq={} for finished {} from {}", chunk.seq(), chunk.fileId(), peer.getHostAddress());
                sendAck(peer, new Message.FileAck(chunk.fileId(), chunk.seq(), 0));
                return;
            }
            // Senders hold data back until the control chunk is acked, so this is a new transfer
            completedReceives.remove(key);
        }

        ReceiveContext ctx = receives.computeIfAbsent(key, k -> {
            log.info("Receiving {} from {}", k.fileId(), peer.getHostAddress());
            return new ReceiveContext(peer, k.fileId(), nowMs);
        });

        if (chunk.isControl()) {
            int count = chunk.chunkCount();
            if (!ctx.setChunkCount(count)) {
                log.warn("Conflicting chunk count {} for {} (have {})", count, chunk.fileId(), ctx.chunkCount());
            }
        } else if (!ctx.store(chunk.seq(), chunk.payload())) {
            log.debug("Duplicate or out-of-range chunk seq={} for {}", chunk.seq(), chunk.fileId());
        }

        sendAck(peer, new Message.FileAck(chunk.fileId(), chunk.seq(), ctx.credit(receiveWindow)));

        if (ctx.isComplete() && receives.remove(key, ctx)) {
            completedReceives.put(key, nowMs);
            assemble(ctx);
        }
    }

    /** Write a completed transfer to the download directory and report the outcome. */
    void assemble(ReceiveContext ctx) {
        try {
            Path dest = destinationFor(ctx.fileId());
            ctx.writeTo(dest);
            log.info("Received {} from {} ({} chunks) -> {}",
                    ctx.fileId(), ctx.peer().getHostAddress(), ctx.chunkCount(), dest);
            listener.receiveCompleted(ctx.peer(), ctx.fileId(), dest);
        } catch (IOException e) {
            log.error("Could not write {} from {}: {}", ctx.fileId(), ctx.peer().getHostAddress(), e.getMessage());
            listener.receiveFailed(ctx.peer(), ctx.fileId(), e);
        }
    }

    /** Destination inside the download directory; directory components of the name are dropped. */
    Path destinationFor(String fileId) throws IOException {
        String name = fileId.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        if (name.isEmpty() || name.equals(".") || name.equals("..")) {
            throw new FileSystemException(fileId, null, "unusable file name");
        }
        try {
            return downloadDir.resolve(name);
        } catch (InvalidPathException e) {
            throw new FileSystemException(fileId, null, "invalid file name: " + e.getReason());
        }
    }

    private void sendAck(InetAddress peer, Message.FileAck ack) {
        try {
            transport.sendStream(peer, MessageCodec.encode(ack));
        } catch (IOException e) {
            // The sender's timeout re-sends the chunk, which triggers a fresh ack
            log.warn("Failed to ack {} seq={} to {}: {}", ack.fileId(), ack.seq(), peer.getHostAddress(), e.getMessage());
        }
    }

    private void forgetCompletedBefore(long cutoffMs) {
        completedReceives.values().removeIf(finishedMs -> finishedMs < cutoffMs);
    }

    // --- Lifecycle ---

    /** Drop every transfer with {@code peer}, e.g. after it was pruned. */
    public void abandon(InetAddress peer) {
        sends.entrySet().removeIf(entry -> {
            if (!entry.getKey().peer().equals(peer)) return false;
            log.warn("Abandoning send of {} to {}", entry.getKey().fileId(), peer.getHostAddress());
            listener.sendAbandoned(peer, entry.getKey().fileId());
            return true;
        });
        receives.keySet().removeIf(key -> {
            if (!key.peer().equals(peer)) return false;
            log.warn("Abandoning receive of {} from {}", key.fileId(), peer.getHostAddress());
            return true;
        });
    }

    /** Active sends, oldest first. */
    public List<SendContext> activeSends() {
        List<SendContext> list = new ArrayList<>(sends.values());
        list.sort(Comparator.comparingLong(SendContext::createdMs));
        return list;
    }

    /** Active receives, oldest first. */
    public List<ReceiveContext> activeReceives() {
        List<ReceiveContext> list = new ArrayList<>(receives.values());
        list.sort(Comparator.comparingLong(ReceiveContext::createdMs));
        return list;
    }

    public SendContext sendContext(InetAddress peer, String fileId) {
        return sends.get(new TransferKey(peer, fileId));
    }

    public ReceiveContext receiveContext(InetAddress peer, String fileId) {
        return receives.get(new TransferKey(peer, fileId));
    }
}
