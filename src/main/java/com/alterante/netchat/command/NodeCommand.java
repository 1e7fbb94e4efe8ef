package com.alterante.netchat.command;

import com.alterante.netchat.config.NodeConfig;
import com.alterante.netchat.net.NetchatNode;
import com.alterante.netchat.net.SocketTransport;
import com.alterante.netchat.transfer.TransferListener;
import picocli.CommandLine;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "node",
        description = "Join the local network and chat / share files interactively",
        mixinStandardHelpOptions = true
)
public class NodeCommand implements Callable<Integer> {

    @CommandLine.Option(names = {"--name", "-n"}, description = "Display name (default: host name)")
    private String name;

    @CommandLine.Option(names = {"--port", "-p"}, description = "UDP/TCP port (default: ${DEFAULT-VALUE})",
            defaultValue = "" + NodeConfig.DEFAULT_PORT)
    private int port;

    @CommandLine.Option(names = {"--broadcast"}, description = "Broadcast address (default: ${DEFAULT-VALUE})",
            defaultValue = NodeConfig.DEFAULT_BROADCAST_ADDRESS)
    private String broadcast;

    @CommandLine.Option(names = {"--download-dir", "-d"}, description = "Where received files are written (default: ${DEFAULT-VALUE})",
            defaultValue = NodeConfig.DEFAULT_DOWNLOAD_DIR)
    private Path downloadDir;

    @CommandLine.Option(names = {"--broadcast-period"}, description = "Seconds between beacons (default: ${DEFAULT-VALUE})",
            defaultValue = "" + NodeConfig.DEFAULT_BROADCAST_PERIOD_MS / 1000)
    private long broadcastPeriodSeconds;

    @CommandLine.Option(names = {"--pruning-period"}, description = "Seconds of silence before a peer is forgotten (default: ${DEFAULT-VALUE})",
            defaultValue = "" + NodeConfig.DEFAULT_PRUNING_PERIOD_MS / 1000)
    private long pruningPeriodSeconds;

    @CommandLine.Option(names = {"--batch-size"}, description = "Bytes per file chunk (default: ${DEFAULT-VALUE})",
            defaultValue = "" + NodeConfig.DEFAULT_BATCH_SIZE)
    private int batchSize;

    @CommandLine.Option(names = {"--window"}, description = "Initial send window in chunks (default: ${DEFAULT-VALUE})",
            defaultValue = "" + NodeConfig.DEFAULT_RECEIVE_WINDOW)
    private int window;

    @CommandLine.Option(names = {"--packet-timeout"}, description = "Retransmission timeout in ms (default: ${DEFAULT-VALUE})",
            defaultValue = "" + NodeConfig.DEFAULT_PACKET_TIMEOUT_MS)
    private long packetTimeoutMs;

    @CommandLine.Option(names = {"--verbose", "-v"}, description = "Debug logging")
    private boolean verbose;

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
        }

        NodeConfig config = new NodeConfig(
                name != null ? name : hostName(),
                port,
                broadcast,
                broadcastPeriodSeconds * 1000,
                pruningPeriodSeconds * 1000,
                batchSize,
                window,
                packetTimeoutMs,
                NodeConfig.DEFAULT_TICK_INTERVAL_MS,
                downloadDir);

        SocketTransport transport = new SocketTransport(config.port(), InetAddress.getByName(config.broadcastAddress()));
        NetchatNode node = new NetchatNode(config, transport, NodeCommand::printChat, new ConsoleTransferListener());

        // Shut down cleanly on Ctrl+C
        Runtime.getRuntime().addShutdownHook(new Thread(node::shutdown));

        node.start();
        System.out.println("Discovery started, ready to chat. Type :help for commands.");

        try {
            BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            new CommandShell(node, System.out).run(in);
        } finally {
            node.shutdown();
        }
        return 0;
    }

    private static void printChat(InetAddress from, String peerName, String text) {
        System.out.printf("[%s] FROM: %s(%s): %s%n", LocalDateTime.now(), peerName, from.getHostAddress(), text);
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "netchat";
        }
    }

    /** Prints transfer outcomes for the interactive user. */
    private static final class ConsoleTransferListener implements TransferListener {

        @Override
        public void sendCompleted(InetAddress peer, String fileId) {
            System.out.println("Sent " + fileId + " to " + peer.getHostAddress());
        }

        @Override
        public void sendAbandoned(InetAddress peer, String fileId) {
            System.out.println("Gave up sending " + fileId + " to " + peer.getHostAddress() + " (peer gone)");
        }

        @Override
        public void receiveCompleted(InetAddress peer, String fileId, Path file) {
            System.out.println("Received " + fileId + " from " + peer.getHostAddress() + " -> " + file);
        }

        @Override
        public void receiveFailed(InetAddress peer, String fileId, IOException error) {
            System.out.println("Could not save " + fileId + " from " + peer.getHostAddress() + ": " + error.getMessage());
        }
    }
}
