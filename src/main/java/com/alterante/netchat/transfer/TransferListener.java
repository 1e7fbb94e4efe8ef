package com.alterante.netchat.transfer;

import java.io.IOException;
import java.net.InetAddress;
import java.nio.file.Path;

/**
 * Outcome notifications from the {@link TransferEngine}. Called from engine
 * threads; implementations must not block.
 */
public interface TransferListener {

    TransferListener NONE = new TransferListener() {};

    /** Every chunk of an outbound file was acknowledged. */
    default void sendCompleted(InetAddress peer, String fileId) {}

    /** An outbound transfer was dropped before completion. */
    default void sendAbandoned(InetAddress peer, String fileId) {}

    /** An inbound file was assembled and written to {@code file}. */
    default void receiveCompleted(InetAddress peer, String fileId, Path file) {}

    /** An inbound file arrived completely but could not be written. */
    default void receiveFailed(InetAddress peer, String fileId, IOException error) {}
}
