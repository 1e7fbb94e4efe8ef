package com.alterante.netchat.transfer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ReceiveContextTest {

    @TempDir
    Path tempDir;

    @Test
    void duplicateChunkKeepsFirstPayload() throws UnknownHostException {
        ReceiveContext ctx = context();

        assertTrue(ctx.store(1, new byte[]{1}));
        assertFalse(ctx.store(1, new byte[]{9}));
        assertEquals(1, ctx.receivedCount());
    }

    @Test
    void unknownCountNeverCompletes() throws UnknownHostException {
        ReceiveContext ctx = context();
        ctx.store(1, new byte[]{1});
        ctx.store(2, new byte[]{2});

        assertFalse(ctx.isComplete());
        assertEquals(ReceiveContext.UNKNOWN, ctx.chunkCount());
        assertEquals(32, ctx.credit(32));
    }

    @Test
    void creditIsChunksStillMissing() throws UnknownHostException {
        ReceiveContext ctx = context();
        ctx.setChunkCount(5);
        ctx.store(2, new byte[]{2});
        ctx.store(4, new byte[]{4});

        assertEquals(3, ctx.credit(32));
    }

    @Test
    void completesWhenControlArrivesLast() throws UnknownHostException {
        ReceiveContext ctx = context();
        ctx.store(3, new byte[]{3});
        ctx.store(1, new byte[]{1});
        ctx.store(2, new byte[]{2});
        assertFalse(ctx.isComplete());

        assertTrue(ctx.setChunkCount(3));
        assertTrue(ctx.isComplete());
        assertEquals(0, ctx.credit(32));
    }

    @Test
    void chunksBeyondCountAreDiscarded() throws UnknownHostException {
        ReceiveContext ctx = context();
        ctx.store(1, new byte[]{1});
        ctx.store(7, new byte[]{7});

        ctx.setChunkCount(2);
        assertFalse(ctx.has(7));
        assertFalse(ctx.store(3, new byte[]{3}));
        assertFalse(ctx.store(0, new byte[]{0}));
        assertEquals(1, ctx.receivedCount());
    }

    @Test
    void conflictingCountKeepsFirst() throws UnknownHostException {
        ReceiveContext ctx = context();

        assertTrue(ctx.setChunkCount(4));
        assertTrue(ctx.setChunkCount(4));
        assertFalse(ctx.setChunkCount(6));
        assertEquals(4, ctx.chunkCount());
    }

    @Test
    void writesPayloadsInSequenceOrder() throws IOException {
        ReceiveContext ctx = context();
        ctx.setChunkCount(3);
        ctx.store(3, "!".getBytes());
        ctx.store(1, "hello ".getBytes());
        ctx.store(2, "world".getBytes());

        Path dest = tempDir.resolve("downloads").resolve("greeting.txt");
        ctx.writeTo(dest);

        assertEquals("hello world!", Files.readString(dest));
        try (var listing = Files.list(dest.getParent())) {
            assertEquals(1, listing.count(), "no temporary file left behind");
        }
    }

    @Test
    void writeRefusesIncompleteTransfer() throws UnknownHostException {
        ReceiveContext ctx = context();
        ctx.setChunkCount(2);
        ctx.store(1, new byte[]{1});

        assertThrows(IllegalStateException.class, () -> ctx.writeTo(tempDir.resolve("x")));
    }

    private static ReceiveContext context() throws UnknownHostException {
        return new ReceiveContext(InetAddress.getByName("10.0.0.1"), "file.bin", 0);
    }
}
