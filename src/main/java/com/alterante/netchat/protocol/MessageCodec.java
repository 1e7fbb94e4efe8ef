package com.alterante.netchat.protocol;

import org.json.JSONException;
import org.json.JSONObject;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Encodes and decodes {@link Message} instances to/from UTF-8 JSON text.
 *
 * Wire format, one JSON object per datagram or per stream connection:
 * <pre>
 * {"type":"hello",        "myname":string}
 * {"type":"aleykumselam", "myname":string}
 * {"type":"message",      "content":string}
 * {"type":4, "name":string, "seq":int, "body":base64|int}   body is the chunk count when seq == 0
 * {"type":5, "name":string, "seq":int, "rwnd":int}
 * </pre>
 */
public final class MessageCodec {

    static final String FIELD_TYPE = "type";
    static final String FIELD_MYNAME = "myname";
    static final String FIELD_CONTENT = "content";
    static final String FIELD_NAME = "name";
    static final String FIELD_SEQ = "seq";
    static final String FIELD_BODY = "body";
    static final String FIELD_RWND = "rwnd";

    private MessageCodec() {}

    /**
     * Encode a Message into UTF-8 bytes ready for a datagram or a stream write.
     */
    public static byte[] encode(Message message) {
        JSONObject json = new JSONObject();
        json.put(FIELD_TYPE, message.type().wireValue());

        switch (message.type()) {
            case HELLO -> json.put(FIELD_MYNAME, ((Message.Hello) message).name());
            case HELLO_ACK -> json.put(FIELD_MYNAME, ((Message.HelloAck) message).name());
            case CHAT -> json.put(FIELD_CONTENT, ((Message.Chat) message).text());
            case FILE_CHUNK -> {
                Message.FileChunk chunk = (Message.FileChunk) message;
                json.put(FIELD_NAME, chunk.fileId());
                json.put(FIELD_SEQ, chunk.seq());
                if (chunk.isControl()) {
                    json.put(FIELD_BODY, chunk.chunkCount());
                } else {
                    json.put(FIELD_BODY, Base64.getEncoder().encodeToString(chunk.payload()));
                }
            }
            case FILE_ACK -> {
                Message.FileAck ack = (Message.FileAck) message;
                json.put(FIELD_NAME, ack.fileId());
                json.put(FIELD_SEQ, ack.seq());
                json.put(FIELD_RWND, ack.credit());
            }
        }

        return json.toString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Decode received bytes into a Message.
     *
     * @param data the raw bytes
     * @param length number of valid bytes in {@code data}
     * @return the decoded Message
     * @throws MalformedMessageException if the bytes are not a well-formed message
     */
    public static Message decode(byte[] data, int length) throws MalformedMessageException {
        if (length <= 0) {
            throw new MalformedMessageException("empty message");
        }

        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(data, 0, length))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new MalformedMessageException("not valid UTF-8", e);
        }

        JSONObject json;
        try {
            json = new JSONObject(text);
        } catch (JSONException e) {
            throw new MalformedMessageException("not a JSON object: " + e.getMessage(), e);
        }

        MessageType type = MessageType.fromTag(json.opt(FIELD_TYPE));
        if (type == null) {
            throw new MalformedMessageException("unknown type: " + json.opt(FIELD_TYPE));
        }

        try {
            return switch (type) {
                case HELLO -> new Message.Hello(json.getString(FIELD_MYNAME));
                case HELLO_ACK -> new Message.HelloAck(json.getString(FIELD_MYNAME));
                case CHAT -> new Message.Chat(json.getString(FIELD_CONTENT));
                case FILE_CHUNK -> decodeChunk(json);
                case FILE_ACK -> new Message.FileAck(
                        json.getString(FIELD_NAME),
                        requireSeq(json),
                        json.getInt(FIELD_RWND));
            };
        } catch (JSONException e) {
            throw new MalformedMessageException(type + " missing or bad field: " + e.getMessage(), e);
        }
    }

    /** Convenience overload decoding the whole array. */
    public static Message decode(byte[] data) throws MalformedMessageException {
        return decode(data, data.length);
    }

    private static Message.FileChunk decodeChunk(JSONObject json) throws MalformedMessageException {
        String fileId = json.getString(FIELD_NAME);
        int seq = requireSeq(json);
        if (seq == Message.FileChunk.CONTROL_SEQ) {
            int count = json.getInt(FIELD_BODY);
            if (count < 0) {
                throw new MalformedMessageException("negative chunk count: " + count);
            }
            return Message.FileChunk.control(fileId, count);
        }
        try {
            byte[] payload = Base64.getDecoder().decode(json.getString(FIELD_BODY));
            return new Message.FileChunk(fileId, seq, payload);
        } catch (IllegalArgumentException e) {
            throw new MalformedMessageException("chunk body is not base64", e);
        }
    }

    private static int requireSeq(JSONObject json) throws MalformedMessageException {
        int seq = json.getInt(FIELD_SEQ);
        if (seq < 0) {
            throw new MalformedMessageException("negative seq: " + seq);
        }
        return seq;
    }
}
