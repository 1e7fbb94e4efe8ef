package com.alterante.netchat.protocol;

/**
 * All message kinds in the netchat protocol.
 *
 * Each kind carries the value written to the {@code type} field on the wire.
 * Membership and chat messages use string tags, file transfer messages use
 * integer tags; both are matched here so the codec has a single lookup.
 */
public enum MessageType {

    // Membership
    HELLO      ("hello", false),
    HELLO_ACK  ("aleykumselam", false),

    // Chat
    CHAT       ("message", false),

    // File transfer
    FILE_CHUNK ("4", true),
    FILE_ACK   ("5", true);

    private final String tag;
    private final boolean numeric;

    MessageType(String tag, boolean numeric) {
        this.tag = tag;
        this.numeric = numeric;
    }

    /** Value to put in the JSON {@code type} field. */
    public Object wireValue() {
        return numeric ? Integer.valueOf(tag) : tag;
    }

    /**
     * Look up a MessageType by its wire tag.
     * @return the MessageType, or null if unknown
     */
    public static MessageType fromTag(Object tag) {
        if (tag == null) return null;
        String text = tag.toString();
        for (MessageType t : values()) {
            if (t.numeric != (tag instanceof Number)) continue;
            if (t.tag.equals(text)) return t;
        }
        return null;
    }
}
