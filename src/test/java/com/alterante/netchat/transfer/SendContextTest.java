package com.alterante.netchat.transfer;

import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class SendContextTest {

    private static final long TIMEOUT = 1_000;

    @Test
    void admitsInSequenceUpToCredit() throws UnknownHostException {
        SendContext ctx = started(10, 3);

        assertEquals(1, ctx.admitNext(0).seq());
        assertEquals(2, ctx.admitNext(0).seq());
        assertEquals(3, ctx.admitNext(0).seq());
        assertNull(ctx.admitNext(0), "window full");
        assertEquals(3, ctx.inFlightCount());
        assertEquals(4, ctx.nextSeq());
    }

    @Test
    void ackOpensWindowAndIsIdempotent() throws UnknownHostException {
        SendContext ctx = started(10, 2);
        ctx.admitNext(0);
        ctx.admitNext(0);

        assertTrue(ctx.onAck(1, 2));
        assertTrue(ctx.onAck(1, 2));
        assertEquals(1, ctx.acknowledgedCount());
        assertEquals(1, ctx.inFlightCount());
        assertTrue(ctx.isAcknowledged(1));
        assertFalse(ctx.isInFlight(1));

        assertEquals(3, ctx.admitNext(0).seq());
        assertNull(ctx.admitNext(0));
    }

    @Test
    void creditFollowsLatestAck() throws UnknownHostException {
        SendContext ctx = started(10, 4);
        for (int i = 0; i < 4; i++) ctx.admitNext(0);

        ctx.onAck(1, 1);
        assertEquals(1, ctx.credit());
        // three still in flight above credit 1: they stay in flight, nothing new goes out
        assertEquals(3, ctx.inFlightCount());
        assertNull(ctx.admitNext(0));
        ctx.onAck(2, 1);
        ctx.onAck(3, 1);
        assertEquals(1, ctx.inFlightCount());
        assertNull(ctx.admitNext(0));

        ctx.onAck(2, 8);
        assertEquals(8, ctx.credit());
        assertNotNull(ctx.admitNext(0));
    }

    @Test
    void ackForUnsentSeqIgnored() throws UnknownHostException {
        SendContext ctx = started(5, 2);
        ctx.admitNext(0);

        assertFalse(ctx.onAck(4, 100));
        assertFalse(ctx.onAck(-1, 100));
        assertEquals(2, ctx.credit());
        assertEquals(0, ctx.acknowledgedCount());
    }

    @Test
    void retransmitsOnlyExpiredChunks() throws UnknownHostException {
        SendContext ctx = started(3, 3);
        ctx.admitNext(0);
        ctx.admitNext(500);
        ctx.admitNext(500);
        ctx.onAck(3, 3);

        assertTrue(ctx.retransmittable(999, TIMEOUT).isEmpty());

        List<Chunk> due = ctx.retransmittable(1_000, TIMEOUT);
        assertEquals(1, due.size());
        assertEquals(1, due.get(0).seq());

        // timestamp refreshed, so seq 1 waits another full timeout
        due = ctx.retransmittable(1_500, TIMEOUT);
        assertEquals(List.of(2), seqs(due));
        assertEquals(List.of(1), seqs(ctx.retransmittable(2_000, TIMEOUT)));
        assertEquals(3, ctx.retransmissions());
    }

    @Test
    void retransmissionKeepsPayload() throws UnknownHostException {
        SendContext ctx = started(2, 2);
        Chunk first = ctx.admitNext(0);

        Chunk again = ctx.retransmittable(TIMEOUT, TIMEOUT).get(0);

        assertEquals(first.seq(), again.seq());
        assertArrayEquals(first.data(), again.data());
    }

    @Test
    void controlResentUntilAcked() throws UnknownHostException {
        SendContext ctx = context(2, 2);

        assertTrue(ctx.controlDue(0, TIMEOUT));
        assertFalse(ctx.controlDue(999, TIMEOUT));
        assertTrue(ctx.controlDue(1_000, TIMEOUT));

        ctx.onAck(0, 7);
        assertTrue(ctx.controlAcked());
        assertEquals(7, ctx.credit());
        assertFalse(ctx.controlDue(10_000, TIMEOUT));
    }

    @Test
    void dataWaitsForControlAck() throws UnknownHostException {
        SendContext ctx = context(2, 5);
        assertTrue(ctx.controlDue(0, TIMEOUT));
        assertNull(ctx.admitNext(0));
        assertNull(ctx.admitNext(5_000));
        assertEquals(0, ctx.inFlightCount());

        ctx.onAck(0, 2);
        assertEquals(1, ctx.admitNext(5_000).seq());
        assertEquals(2, ctx.admitNext(5_000).seq());
    }

    @Test
    void completeNeedsEveryChunk() throws UnknownHostException {
        SendContext ctx = started(2, 5);
        ctx.admitNext(0);
        ctx.admitNext(0);
        ctx.onAck(1, 5);
        assertFalse(ctx.isComplete());

        ctx.onAck(2, 4);
        assertTrue(ctx.isComplete());
    }

    @Test
    void zeroCreditStillSendsOneChunkAtATime() throws UnknownHostException {
        SendContext ctx = started(3, 0);

        assertEquals(1, ctx.admitNext(0).seq());
        assertNull(ctx.admitNext(0));

        ctx.onAck(1, 0);
        assertEquals(2, ctx.admitNext(0).seq());
        assertNull(ctx.admitNext(0));

        ctx.onAck(2, 0);
        assertEquals(3, ctx.admitNext(0).seq());
        ctx.onAck(3, 0);
        assertTrue(ctx.isComplete());
    }

    @Test
    void emptyFileCompletesOnControlAck() throws UnknownHostException {
        SendContext ctx = context(0, 5);
        assertNull(ctx.admitNext(0));
        assertFalse(ctx.isComplete());

        ctx.onAck(0, 0);
        assertTrue(ctx.isComplete());
    }

    @Test
    void admissionStaysBelowCreditUnderRandomAcks() throws UnknownHostException {
        Random random = new Random(42);
        SendContext ctx = started(200, 8);
        long now = 0;

        while (!ctx.isComplete() && now < 1_000_000) {
            now += 100;
            ctx.retransmittable(now, TIMEOUT);
            while (true) {
                int before = ctx.inFlightCount();
                Chunk next = ctx.admitNext(now);
                if (next == null) {
                    assertTrue(before >= ctx.credit() || ctx.nextSeq() > 200);
                    break;
                }
                assertTrue(before < ctx.credit(),
                        "admitted seq " + next.seq() + " with " + before + " in flight and credit " + ctx.credit());
            }
            if (ctx.nextSeq() > 1) {
                int seq = 1 + random.nextInt(ctx.nextSeq() - 1);
                ctx.onAck(seq, 1 + random.nextInt(16));
            }
            ctx.onAck(0, ctx.credit());
            // acknowledge the oldest in flight now and then so the run terminates
            for (int s = 1; s < ctx.nextSeq(); s++) {
                if (ctx.isInFlight(s)) {
                    if (random.nextBoolean()) ctx.onAck(s, ctx.credit());
                    break;
                }
            }
        }
        assertTrue(ctx.isComplete());
        assertEquals(200, ctx.acknowledgedCount());
    }

    /** A context whose control chunk was sent and acknowledged with {@code credit}. */
    private static SendContext started(int chunkCount, int credit) throws UnknownHostException {
        SendContext ctx = context(chunkCount, credit);
        ctx.controlDue(0, TIMEOUT);
        ctx.onAck(0, credit);
        return ctx;
    }

    private static SendContext context(int chunkCount, int credit) throws UnknownHostException {
        List<Chunk> chunks = new ArrayList<>();
        for (int seq = 1; seq <= chunkCount; seq++) {
            chunks.add(new Chunk(seq, new byte[]{(byte) seq, (byte) (seq >> 8)}));
        }
        return new SendContext(InetAddress.getByName("10.0.0.2"), Path.of("data.bin"), chunks, credit, 0);
    }

    private static List<Integer> seqs(List<Chunk> chunks) {
        return chunks.stream().map(Chunk::seq).toList();
    }
}
