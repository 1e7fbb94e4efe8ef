package com.alterante.netchat.net;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.NetworkInterface;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link Transport} over a UDP socket and a TCP server socket bound to the same port.
 *
 * Accepted stream connections are read on a small pool of reader threads, so a
 * client that connects and stays silent only ties up its reader, never the
 * thread calling {@link #acceptStream}.
 */
public class SocketTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(SocketTransport.class);

    /** Largest UDP payload over IPv4. */
    public static final int MAX_DATAGRAM = 65_507;
    /** Largest message accepted on a stream connection. */
    public static final int MAX_STREAM_MESSAGE = 64 * 1024;

    private static final int CONNECT_TIMEOUT_MS = 2_000;
    private static final int READ_TIMEOUT_MS = 2_000;
    private static final int ACCEPT_SLICE_MS = 50;
    private static final int STREAM_READERS = 4;

    private final int port;
    private final InetAddress broadcastAddress;
    private final DatagramSocket datagramSocket;
    private final ServerSocket serverSocket;
    private final InetAddress localAddress;
    private final byte[] recvBuf = new byte[MAX_DATAGRAM];
    private final BlockingQueue<Inbound> streamMessages = new LinkedBlockingQueue<>();
    private final ExecutorService streamReaders;

    public SocketTransport(int port, InetAddress broadcastAddress) throws IOException {
        this.port = port;
        this.broadcastAddress = broadcastAddress;

        datagramSocket = new DatagramSocket(null);
        datagramSocket.setReuseAddress(true);
        datagramSocket.setBroadcast(true);
        datagramSocket.bind(new InetSocketAddress(port));

        try {
            serverSocket = new ServerSocket();
            serverSocket.setReuseAddress(true);
            serverSocket.bind(new InetSocketAddress(port));
        } catch (IOException e) {
            datagramSocket.close();
            throw e;
        }

        localAddress = resolveLocalAddress();
        AtomicInteger readerId = new AtomicInteger();
        streamReaders = Executors.newFixedThreadPool(STREAM_READERS, r -> {
            Thread t = new Thread(r, "stream-reader-" + readerId.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("Listening on UDP/TCP port {} (local address {})", port, localAddress.getHostAddress());
    }

    @Override
    public void sendDatagram(InetAddress to, byte[] data) throws IOException {
        datagramSocket.send(new DatagramPacket(data, data.length, to, port));
    }

    @Override
    public void broadcast(byte[] data) throws IOException {
        sendDatagram(broadcastAddress, data);
    }

    @Override
    public void sendStream(InetAddress to, byte[] data) throws IOException {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(to, port), CONNECT_TIMEOUT_MS);
            OutputStream out = socket.getOutputStream();
            out.write(data);
            out.flush();
            socket.shutdownOutput();
        }
    }

    /** Single caller only: the receive buffer is shared. */
    @Override
    public Inbound receiveDatagram(int timeoutMs) throws IOException {
        DatagramPacket dgram = new DatagramPacket(recvBuf, recvBuf.length);
        datagramSocket.setSoTimeout(timeoutMs);
        try {
            datagramSocket.receive(dgram);
        } catch (SocketTimeoutException e) {
            return null;
        }
        return new Inbound(dgram.getAddress(), Arrays.copyOf(recvBuf, dgram.getLength()));
    }

    /**
     * Accepts connections until one has been read completely or {@code timeoutMs}
     * passes. Reads run on the reader pool; this call only waits for their results.
     */
    @Override
    public Inbound acceptStream(int timeoutMs) throws IOException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (true) {
            Inbound ready = streamMessages.poll();
            if (ready != null) return ready;
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) return null;

            int slice = (int) Math.max(1, Math.min(remaining, ACCEPT_SLICE_MS));
            serverSocket.setSoTimeout(slice);
            Socket conn;
            try {
                conn = serverSocket.accept();
            } catch (SocketTimeoutException e) {
                continue;
            }
            try {
                streamReaders.execute(() -> readConnection(conn));
            } catch (RejectedExecutionException e) {
                conn.close();
                throw new SocketException("transport closed");
            }
            try {
                ready = streamMessages.poll(slice, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("interrupted waiting for stream message");
            }
            if (ready != null) return ready;
        }
    }

    /** Read one message from an accepted connection; runs on the reader pool. */
    private void readConnection(Socket conn) {
        String from = conn.getInetAddress().getHostAddress();
        try (conn) {
            conn.setSoTimeout(READ_TIMEOUT_MS);
            InputStream in = conn.getInputStream();
            byte[] data = in.readNBytes(MAX_STREAM_MESSAGE + 1);
            if (data.length > MAX_STREAM_MESSAGE) {
                log.warn("Dropping stream message from {}: exceeds {} bytes", from, MAX_STREAM_MESSAGE);
                return;
            }
            streamMessages.offer(new Inbound(conn.getInetAddress(), data));
        } catch (SocketTimeoutException e) {
            log.debug("Dropping idle stream connection from {}", from);
        } catch (IOException e) {
            log.warn("Failed to read stream message from {}: {}", from, e.getMessage());
        }
    }

    @Override
    public boolean isLocal(InetAddress address) {
        if (address.isAnyLocalAddress() || address.isLoopbackAddress()) {
            return true;
        }
        try {
            return NetworkInterface.getByInetAddress(address) != null;
        } catch (SocketException e) {
            return false;
        }
    }

    @Override
    public InetAddress localAddress() {
        return localAddress;
    }

    public int port() {
        return port;
    }

    @Override
    public void close() {
        streamReaders.shutdownNow();
        datagramSocket.close();
        try {
            serverSocket.close();
        } catch (IOException e) {
            log.debug("Error closing server socket: {}", e.getMessage());
        }
    }

    /** First site-local IPv4 address of an up, non-loopback interface, else the host address. */
    private static InetAddress resolveLocalAddress() throws IOException {
        for (NetworkInterface nif : Collections.list(NetworkInterface.getNetworkInterfaces())) {
            if (!nif.isUp() || nif.isLoopback()) continue;
            for (InetAddress addr : Collections.list(nif.getInetAddresses())) {
                if (addr instanceof Inet4Address && addr.isSiteLocalAddress()) {
                    return addr;
                }
            }
        }
        try {
            return InetAddress.getLocalHost();
        } catch (UnknownHostException e) {
            log.warn("Host name does not resolve, advertising loopback: {}", e.getMessage());
            return InetAddress.getLoopbackAddress();
        }
    }
}
