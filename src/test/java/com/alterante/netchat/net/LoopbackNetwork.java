package com.alterante.netchat.net;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.InetAddress;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory network of {@link Transport} endpoints with arbitrary addresses.
 *
 * Datagrams to a missing endpoint vanish, stream sends to one are refused,
 * and a {@link DatagramFilter} can drop individual datagrams to simulate loss.
 */
public class LoopbackNetwork {

    /** Decides whether a datagram is delivered. */
    @FunctionalInterface
    public interface DatagramFilter {
        boolean deliver(InetAddress from, InetAddress to, byte[] data);
    }

    private final Map<InetAddress, Endpoint> endpoints = new ConcurrentHashMap<>();
    private volatile DatagramFilter filter = (from, to, data) -> true;
    private final AtomicLong datagramsDropped = new AtomicLong();

    public Endpoint endpoint(String ip) {
        InetAddress address = parse(ip);
        Endpoint endpoint = new Endpoint(address);
        if (endpoints.putIfAbsent(address, endpoint) != null) {
            throw new IllegalStateException("address in use: " + ip);
        }
        return endpoint;
    }

    public void setDatagramFilter(DatagramFilter filter) {
        this.filter = filter;
    }

    public long datagramsDropped() {
        return datagramsDropped.get();
    }

    public static InetAddress parse(String ip) {
        try {
            return InetAddress.getByName(ip);
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException(ip, e);
        }
    }

    private void deliverDatagram(Endpoint from, Endpoint to, byte[] data) {
        if (to == null || to.closed) return;
        if (!filter.deliver(from.address, to.address, data)) {
            datagramsDropped.incrementAndGet();
            return;
        }
        to.datagrams.offer(new Transport.Inbound(from.address, data));
    }

    public class Endpoint implements Transport {

        private final InetAddress address;
        private final BlockingQueue<Inbound> datagrams = new LinkedBlockingQueue<>();
        private final BlockingQueue<Inbound> streams = new LinkedBlockingQueue<>();
        private volatile boolean closed;

        Endpoint(InetAddress address) {
            this.address = address;
        }

        @Override
        public void sendDatagram(InetAddress to, byte[] data) throws IOException {
            checkOpen();
            deliverDatagram(this, endpoints.get(to), data);
        }

        @Override
        public void broadcast(byte[] data) throws IOException {
            checkOpen();
            List<Endpoint> all = new ArrayList<>(endpoints.values());
            for (Endpoint to : all) {
                deliverDatagram(this, to, data);
            }
        }

        @Override
        public void sendStream(InetAddress to, byte[] data) throws IOException {
            checkOpen();
            Endpoint dst = endpoints.get(to);
            if (dst == null || dst.closed) {
                throw new ConnectException("Connection refused: " + to.getHostAddress());
            }
            dst.streams.offer(new Inbound(address, data));
        }

        @Override
        public Inbound receiveDatagram(int timeoutMs) throws IOException {
            return poll(datagrams, timeoutMs);
        }

        @Override
        public Inbound acceptStream(int timeoutMs) throws IOException {
            return poll(streams, timeoutMs);
        }

        /** Take a queued datagram without waiting, for tests that drive engines by hand. */
        public Inbound nextDatagram() {
            return datagrams.poll();
        }

        /** Take a queued stream message without waiting. */
        public Inbound nextStream() {
            return streams.poll();
        }

        @Override
        public boolean isLocal(InetAddress other) {
            return address.equals(other);
        }

        @Override
        public InetAddress localAddress() {
            return address;
        }

        @Override
        public void close() {
            closed = true;
            endpoints.remove(address, this);
        }

        private Inbound poll(BlockingQueue<Inbound> queue, int timeoutMs) throws IOException {
            checkOpen();
            try {
                return queue.poll(timeoutMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("interrupted");
            }
        }

        private void checkOpen() throws SocketException {
            if (closed) throw new SocketException("endpoint closed: " + address.getHostAddress());
        }
    }
}
