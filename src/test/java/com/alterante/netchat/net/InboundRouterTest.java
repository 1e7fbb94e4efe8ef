package com.alterante.netchat.net;

import com.alterante.netchat.discovery.Discovery;
import com.alterante.netchat.discovery.MembershipListener;
import com.alterante.netchat.discovery.PeerRecord;
import com.alterante.netchat.discovery.PeerTable;
import com.alterante.netchat.protocol.Message;
import com.alterante.netchat.protocol.MessageCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.alterante.netchat.net.SessionSupervisorTest.waitFor;
import static org.junit.jupiter.api.Assertions.*;

class InboundRouterTest {

    private LoopbackNetwork.Endpoint a;
    private LoopbackNetwork.Endpoint b;
    private PeerTable table;
    private SessionSupervisor sessions;
    private InboundRouter router;
    private final List<Message> handled = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        LoopbackNetwork network = new LoopbackNetwork();
        a = network.endpoint("10.0.0.1");
        b = network.endpoint("10.0.0.2");
        table = new PeerTable();
        sessions = new SessionSupervisor((from, message) -> handled.add(message));
        Discovery discovery = new Discovery("B", 60_000, 120_000, b, table, new MembershipListener() {
            @Override
            public void peerContacted(PeerRecord peer) {
                sessions.ensure(peer.address());
            }

            @Override
            public void peerPruned(PeerRecord peer) {
                sessions.retire(peer.address());
            }
        });
        router = new InboundRouter(b, discovery, sessions);
    }

    @AfterEach
    void tearDown() {
        router.stop();
        sessions.shutdown();
    }

    @Test
    void malformedInputDropped() {
        router.route(inbound("definitely not json"), false);
        router.route(inbound("{\"type\":\"hello\"}"), true);

        assertEquals(0, table.size());
        assertEquals(0, sessions.size());
    }

    @Test
    void helloRegistersPeerAndStartsSession() throws Exception {
        router.route(new Transport.Inbound(a.localAddress(), MessageCodec.encode(new Message.Hello("A"))), false);

        assertEquals("A", table.get(a.localAddress()).orElseThrow().name());
        assertTrue(sessions.hasSession(a.localAddress()));
        assertEquals(new Message.HelloAck("B"), MessageCodec.decode(a.nextStream().data()));
    }

    @Test
    void messagesFromStrangersDropped() throws InterruptedException {
        router.route(new Transport.Inbound(a.localAddress(), MessageCodec.encode(new Message.Chat("psst"))), true);

        Thread.sleep(100);
        assertTrue(handled.isEmpty());
    }

    @Test
    void messagesFromKnownPeersReachSession() throws InterruptedException {
        sessions.ensure(a.localAddress());

        router.route(new Transport.Inbound(a.localAddress(), MessageCodec.encode(new Message.Chat("hi"))), true);

        waitFor(() -> handled.size() == 1);
        assertEquals(new Message.Chat("hi"), handled.get(0));
    }

    @Test
    void runningRouterPicksUpBroadcast() throws Exception {
        router.start();

        a.broadcast(MessageCodec.encode(new Message.Hello("A")));
        a.sendStream(b.localAddress(), "garbage".getBytes(StandardCharsets.UTF_8));

        waitFor(() -> table.contains(a.localAddress()));
        router.stop();
        assertFalse(router.isRunning());
    }

    private Transport.Inbound inbound(String text) {
        return new Transport.Inbound(a.localAddress(), text.getBytes(StandardCharsets.UTF_8));
    }
}
