package com.alterante.netchat.transfer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * An immutable slice of a file, addressed by its 1-based sequence number.
 */
public record Chunk(int seq, byte[] data) {

    public Chunk {
        if (seq < 1) {
            throw new IllegalArgumentException("data chunks are numbered from 1, got " + seq);
        }
        data = Arrays.copyOf(data, data.length);
    }

    @Override
    public byte[] data() { return Arrays.copyOf(data, data.length); }

    public int length() { return data.length; }

    /**
     * Split a file into chunks of at most {@code batchSize} bytes. The last chunk may be shorter;
     * an empty file yields no chunks.
     */
    public static List<Chunk> split(Path file, int batchSize) throws IOException {
        List<Chunk> chunks = new ArrayList<>();
        try (InputStream in = Files.newInputStream(file)) {
            int seq = 1;
            byte[] batch;
            while ((batch = in.readNBytes(batchSize)).length > 0) {
                chunks.add(new Chunk(seq++, batch));
            }
        }
        return chunks;
    }
}
