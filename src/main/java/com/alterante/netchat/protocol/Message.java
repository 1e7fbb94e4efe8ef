package com.alterante.netchat.protocol;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Objects;

/**
 * A decoded protocol message. One record per {@link MessageType}.
 */
public sealed interface Message
        permits Message.Hello, Message.HelloAck, Message.Chat, Message.FileChunk, Message.FileAck {

    MessageType type();

    /** Discovery beacon, broadcast or sent as a probe. */
    record Hello(String name) implements Message {
        public Hello {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public MessageType type() { return MessageType.HELLO; }
    }

    /** Response to a {@link Hello}. */
    record HelloAck(String name) implements Message {
        public HelloAck {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public MessageType type() { return MessageType.HELLO_ACK; }
    }

    /** A single chat line. */
    record Chat(String text) implements Message {
        public Chat {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public MessageType type() { return MessageType.CHAT; }
    }

    /**
     * One chunk of a file. Sequence 0 is the control chunk, whose payload is the
     * total chunk count as a 4-byte big-endian int.
     */
    record FileChunk(String fileId, int seq, byte[] payload) implements Message {

        public static final int CONTROL_SEQ = 0;

        public FileChunk {
            Objects.requireNonNull(fileId, "fileId");
            if (seq < 0) {
                throw new IllegalArgumentException("seq must not be negative: " + seq);
            }
            payload = payload != null ? Arrays.copyOf(payload, payload.length) : new byte[0];
        }

        /** Build the control chunk announcing {@code chunkCount} data chunks. */
        public static FileChunk control(String fileId, int chunkCount) {
            byte[] body = ByteBuffer.allocate(4).order(ByteOrder.BIG_ENDIAN).putInt(chunkCount).array();
            return new FileChunk(fileId, CONTROL_SEQ, body);
        }

        public boolean isControl() {
            return seq == CONTROL_SEQ;
        }

        /** Total chunk count carried by a control chunk. */
        public int chunkCount() {
            if (!isControl() || payload.length != 4) {
                throw new IllegalStateException("not a control chunk: seq=" + seq);
            }
            return ByteBuffer.wrap(payload).order(ByteOrder.BIG_ENDIAN).getInt();
        }

        @Override
        public byte[] payload() { return Arrays.copyOf(payload, payload.length); }

        @Override
        public MessageType type() { return MessageType.FILE_CHUNK; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof FileChunk other)) return false;
            return seq == other.seq && fileId.equals(other.fileId) && Arrays.equals(payload, other.payload);
        }

        @Override
        public int hashCode() {
            return 31 * Objects.hash(fileId, seq) + Arrays.hashCode(payload);
        }

        @Override
        public String toString() {
            return String.format("FileChunk[fileId=%s, seq=%d, payload=%d bytes]", fileId, seq, payload.length);
        }
    }

    /** Acknowledgement of one chunk, carrying the receiver's remaining credit. */
    record FileAck(String fileId, int seq, int credit) implements Message {
        public FileAck {
            Objects.requireNonNull(fileId, "fileId");
        }

        @Override
        public MessageType type() { return MessageType.FILE_ACK; }
    }
}
