package com.alterante.netchat.discovery;

/**
 * Notified by {@link Discovery} when peers appear and disappear.
 */
public interface MembershipListener {

    /** A Hello or HelloAck arrived from {@code peer}. Called for new and known peers alike. */
    void peerContacted(PeerRecord peer);

    /** {@code peer} was removed by the pruning sweep. */
    void peerPruned(PeerRecord peer);
}
