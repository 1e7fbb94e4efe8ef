package com.alterante.netchat.command;

import com.alterante.netchat.discovery.PeerRecord;
import com.alterante.netchat.net.NetchatNode;
import com.alterante.netchat.net.PeerNotFoundException;
import com.alterante.netchat.transfer.SendContext;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.InvalidPathException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Line-oriented command interface over a running {@link NetchatNode}.
 *
 * <pre>
 * :whoami                   own name and address
 * :peers                    known peers
 * :hello ip                 discovery probe to an explicit address
 * :send name message        chat line to a peer
 * :sendfile name path       file to a peer
 * :transfers                outbound transfers in progress
 * :quit                     shut down
 * </pre>
 */
public class CommandShell {

    private final NetchatNode node;
    private final PrintStream out;

    public CommandShell(NetchatNode node, PrintStream out) {
        this.node = node;
        this.out = out;
    }

    /** Read commands until {@code :quit} or end of input. */
    public void run(BufferedReader in) throws IOException {
        String line;
        while ((line = in.readLine()) != null) {
            if (!execute(line.trim())) {
                return;
            }
        }
    }

    /**
     * Execute one command line.
     *
     * @return false if the shell should exit
     */
    boolean execute(String line) {
        if (line.isEmpty()) return true;
        String[] parts = line.split("\\s+", 3);

        switch (parts[0]) {
            case ":quit" -> {
                return false;
            }
            case ":whoami" -> out.printf("IP:%s\tName:%s%n", node.myAddress().getHostAddress(), node.myName());
            case ":peers" -> printPeers();
            case ":hello" -> hello(parts);
            case ":send" -> chat(parts);
            case ":sendfile" -> sendFile(parts);
            case ":transfers" -> printTransfers();
            case ":help" -> printHelp();
            default -> out.println("Unknown command: " + parts[0] + " (try :help)");
        }
        return true;
    }

    private void printPeers() {
        out.println("IP:\t\tName:");
        for (PeerRecord peer : node.peers()) {
            out.println(peer.address().getHostAddress() + "\t" + peer.name());
        }
    }

    private void hello(String[] parts) {
        if (parts.length < 2) {
            out.println("Invalid command. Usage: :hello ip");
            return;
        }
        try {
            node.probe(InetAddress.getByName(parts[1]));
        } catch (UnknownHostException e) {
            out.println("Unknown host: " + parts[1]);
        } catch (IllegalArgumentException e) {
            out.println(e.getMessage());
        } catch (IOException e) {
            out.println("Could not reach " + parts[1] + ": " + e.getMessage());
        }
    }

    private void chat(String[] parts) {
        if (parts.length < 3) {
            out.println("Invalid command. Usage: :send name message");
            return;
        }
        try {
            node.sendChat(parts[1], parts[2]);
        } catch (PeerNotFoundException e) {
            out.println(e.getMessage() + ".");
        } catch (IOException e) {
            out.println("Could not send to " + parts[1] + ": " + e.getMessage());
        }
    }

    private void sendFile(String[] parts) {
        if (parts.length < 3) {
            out.println("Invalid command. Usage: :sendfile name path");
            return;
        }
        try {
            Path file = Path.of(parts[2]);
            SendContext ctx = node.sendFile(parts[1], file);
            out.printf("Sending %s (%s, %d chunks) to %s%n",
                    ctx.fileId(), formatSize(Files.size(file)), ctx.chunkCount(), parts[1]);
        } catch (PeerNotFoundException e) {
            out.println(e.getMessage() + ".");
        } catch (NoSuchFileException e) {
            out.println("File not found: " + parts[2]);
        } catch (InvalidPathException | IllegalStateException e) {
            out.println(e.getMessage());
        } catch (IOException e) {
            out.println("Cannot read " + parts[2] + ": " + e.getMessage());
        }
    }

    private void printTransfers() {
        List<SendContext> transfers = node.transfers();
        if (transfers.isEmpty()) {
            out.println("No transfers in progress.");
            return;
        }
        for (SendContext ctx : transfers) {
            out.printf("%s -> %s: %d/%d chunks acknowledged, %d in flight, %d retransmissions%n",
                    ctx.fileId(), ctx.peer().getHostAddress(), ctx.acknowledgedCount(), ctx.chunkCount(),
                    ctx.inFlightCount(), ctx.retransmissions());
        }
    }

    private void printHelp() {
        out.println(":whoami | :peers | :hello ip | :send name message | :sendfile name path | :transfers | :quit");
    }

    static String formatSize(long bytes) {
        if (bytes >= 1_000_000_000) return String.format(Locale.ROOT, "%.1f GB", bytes / 1_000_000_000.0);
        if (bytes >= 1_000_000) return String.format(Locale.ROOT, "%.1f MB", bytes / 1_000_000.0);
        if (bytes >= 1_000) return String.format(Locale.ROOT, "%.1f KB", bytes / 1_000.0);
        return bytes + " B";
    }
}
