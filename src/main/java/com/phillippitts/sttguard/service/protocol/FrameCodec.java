package com.phillippitts.sttguard.service.protocol;

import com.phillippitts.sttguard.exception.FrameDecodeException;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONParserConfiguration;
import org.json.JSONTokener;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Decodes and encodes data-channel messages.
 *
 * <p>Wire layout:
 * <pre>
 * [4 bytes LE uint32 metadataLength][metadataLength bytes UTF-8 JSON][N x 2 bytes PCM16 LE]
 * </pre>
 *
 * <p>Metadata fields: {@code sampleRate} (always), {@code dataLength}, {@code checksum},
 * {@code timestamp} and {@code verificationRequested}. Older clients opt in with
 * {@code server_sent_to_stt} instead of {@code verificationRequested}; both are honoured.
 *
 * <p>Metadata is parsed as strict JSON: unquoted or single-quoted keys, trailing commas and
 * anything after the closing brace are malformed.
 *
 * <p>Stateless and thread-safe. Decoding never has side effects.
 */
@Component
public class FrameCodec {

    /** Size of the little-endian metadata length prefix. */
    public static final int PREFIX_BYTES = 4;
    /** Bytes per signed 16-bit PCM sample. */
    public static final int BYTES_PER_SAMPLE = 2;

    static final String FIELD_SAMPLE_RATE = "sampleRate";
    static final String FIELD_DATA_LENGTH = "dataLength";
    static final String FIELD_CHECKSUM = "checksum";
    static final String FIELD_TIMESTAMP = "timestamp";
    static final String FIELD_VERIFICATION_REQUESTED = "verificationRequested";
    static final String FIELD_LEGACY_VERIFICATION = "server_sent_to_stt";

    private static final BigDecimal UINT32_MAX = BigDecimal.valueOf(0xFFFF_FFFFL);
    private static final JSONParserConfiguration STRICT_JSON = new JSONParserConfiguration().withStrictMode(true);

    /**
     * Splits a wire message into metadata and raw PCM payload.
     *
     * @param message complete binary message as received from the transport
     * @return decoded metadata and a copy of the payload bytes
     * @throws FrameDecodeException when the message is truncated, the metadata is malformed,
     *                              or the payload has an odd byte count
     */
    public DecodedFrame decode(byte[] message) {
        if (message == null || message.length < PREFIX_BYTES) {
            int size = message == null ? 0 : message.length;
            throw new FrameDecodeException(DecodeError.TRUNCATED, size,
                    "missing " + PREFIX_BYTES + "-byte metadata length prefix");
        }

        long metaLen = readUInt32LE(message, 0);
        int remaining = message.length - PREFIX_BYTES;
        if (metaLen > remaining) {
            throw new FrameDecodeException(DecodeError.TRUNCATED, message.length,
                    "metadata length " + metaLen + " exceeds remaining " + remaining + " bytes");
        }

        int payloadOffset = PREFIX_BYTES + (int) metaLen;
        FrameMetadata metadata = parseMetadata(message, PREFIX_BYTES, (int) metaLen);

        int payloadLength = message.length - payloadOffset;
        if (payloadLength % BYTES_PER_SAMPLE != 0) {
            throw new FrameDecodeException(DecodeError.MISALIGNED_PAYLOAD, message.length,
                    "payload of " + payloadLength + " bytes is not a multiple of " + BYTES_PER_SAMPLE);
        }
        return new DecodedFrame(metadata, Arrays.copyOfRange(message, payloadOffset, message.length));
    }

    /**
     * Builds a wire message the way streaming clients do.
     *
     * @param metadata metadata to serialise as JSON
     * @param payload PCM16 LE payload
     * @return prefix, metadata and payload concatenated
     */
    public byte[] encode(FrameMetadata metadata, byte[] payload) {
        JSONObject json = new JSONObject();
        json.put(FIELD_SAMPLE_RATE, metadata.sampleRate());
        if (metadata.dataLength() != null) {
            json.put(FIELD_DATA_LENGTH, metadata.dataLength().longValue());
        }
        if (metadata.checksum() != null) {
            json.put(FIELD_CHECKSUM, metadata.checksum().longValue());
        }
        if (metadata.timestamp() != null) {
            json.put(FIELD_TIMESTAMP, metadata.timestamp().longValue());
        }
        json.put(FIELD_VERIFICATION_REQUESTED, metadata.verificationRequested());

        byte[] meta = json.toString().getBytes(StandardCharsets.UTF_8);
        byte[] out = new byte[PREFIX_BYTES + meta.length + payload.length];
        writeUInt32LE(out, 0, meta.length);
        System.arraycopy(meta, 0, out, PREFIX_BYTES, meta.length);
        System.arraycopy(payload, 0, out, PREFIX_BYTES + meta.length, payload.length);
        return out;
    }

    private FrameMetadata parseMetadata(byte[] message, int offset, int length) {
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(message, offset, length))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new FrameDecodeException(DecodeError.MALFORMED_METADATA, message.length,
                    "metadata is not valid UTF-8", e);
        }

        JSONObject json;
        try {
            JSONTokener tokener = new JSONTokener(text, STRICT_JSON);
            json = new JSONObject(tokener, STRICT_JSON);
            if (tokener.nextClean() != 0) {
                throw tokener.syntaxError("unexpected content after the metadata object");
            }
        } catch (JSONException e) {
            throw new FrameDecodeException(DecodeError.MALFORMED_METADATA, message.length,
                    "metadata is not a JSON object: " + e.getMessage(), e);
        }

        long sampleRate = requireUInt32(json, FIELD_SAMPLE_RATE, message.length);
        boolean verificationRequested = readVerificationFlag(json, message.length);

        Long dataLength = optionalUInt32(json, FIELD_DATA_LENGTH, message.length);
        Long checksum = optionalUInt32(json, FIELD_CHECKSUM, message.length);
        Long timestamp = optionalInt64(json, FIELD_TIMESTAMP, message.length);

        if (verificationRequested && (dataLength == null || checksum == null)) {
            throw new FrameDecodeException(DecodeError.MALFORMED_METADATA, message.length,
                    "verification requested but " + FIELD_DATA_LENGTH + " and " + FIELD_CHECKSUM
                            + " are not both present");
        }
        return new FrameMetadata(sampleRate, dataLength, checksum, timestamp, verificationRequested);
    }

    private static boolean readVerificationFlag(JSONObject json, int frameSize) {
        String field = json.has(FIELD_VERIFICATION_REQUESTED)
                ? FIELD_VERIFICATION_REQUESTED
                : FIELD_LEGACY_VERIFICATION;
        Object raw = json.opt(field);
        if (raw == null || JSONObject.NULL.equals(raw)) {
            return false;
        }
        if (!(raw instanceof Boolean flag)) {
            throw new FrameDecodeException(DecodeError.MALFORMED_METADATA, frameSize,
                    field + " must be a boolean");
        }
        return flag;
    }

    private static long requireUInt32(JSONObject json, String field, int frameSize) {
        Long value = optionalUInt32(json, field, frameSize);
        if (value == null) {
            throw new FrameDecodeException(DecodeError.MALFORMED_METADATA, frameSize,
                    field + " is required");
        }
        return value;
    }

    private static Long optionalUInt32(JSONObject json, String field, int frameSize) {
        BigDecimal value = optionalIntegral(json, field, frameSize);
        if (value == null) {
            return null;
        }
        if (value.signum() < 0 || value.compareTo(UINT32_MAX) > 0) {
            throw new FrameDecodeException(DecodeError.MALFORMED_METADATA, frameSize,
                    field + " is outside the uint32 range: " + value.toPlainString());
        }
        return value.longValue();
    }

    private static Long optionalInt64(JSONObject json, String field, int frameSize) {
        BigDecimal value = optionalIntegral(json, field, frameSize);
        if (value == null) {
            return null;
        }
        try {
            return value.longValueExact();
        } catch (ArithmeticException e) {
            throw new FrameDecodeException(DecodeError.MALFORMED_METADATA, frameSize,
                    field + " is outside the int64 range", e);
        }
    }

    private static BigDecimal optionalIntegral(JSONObject json, String field, int frameSize) {
        Object raw = json.opt(field);
        if (raw == null || JSONObject.NULL.equals(raw)) {
            return null;
        }
        if (!(raw instanceof Number)) {
            throw new FrameDecodeException(DecodeError.MALFORMED_METADATA, frameSize,
                    field + " must be a number");
        }
        BigDecimal value;
        try {
            value = new BigDecimal(raw.toString());
        } catch (NumberFormatException e) {
            throw new FrameDecodeException(DecodeError.MALFORMED_METADATA, frameSize,
                    field + " is not a finite number", e);
        }
        if (value.signum() != 0 && value.stripTrailingZeros().scale() > 0) {
            throw new FrameDecodeException(DecodeError.MALFORMED_METADATA, frameSize,
                    field + " must be an integer");
        }
        return value;
    }

    private static long readUInt32LE(byte[] a, int off) {
        return (a[off] & 0xFFL)
             | ((a[off + 1] & 0xFFL) << 8)
             | ((a[off + 2] & 0xFFL) << 16)
             | ((a[off + 3] & 0xFFL) << 24);
    }

    private static void writeUInt32LE(byte[] a, int off, int value) {
        a[off] = (byte) value;
        a[off + 1] = (byte) (value >>> 8);
        a[off + 2] = (byte) (value >>> 16);
        a[off + 3] = (byte) (value >>> 24);
    }
}
