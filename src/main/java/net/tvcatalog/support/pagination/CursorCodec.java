package net.tvcatalog.support.pagination;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Encodes continuation tokens as unpadded base64url JSON and decodes them back.
 *
 * <p>Decoding never throws: malformed base64, malformed JSON, a wrong version, an unknown
 * direction, a missing {@code values} map or non-scalar values all come back as
 * {@link Optional#empty()} and the caller decides which error to surface.</p>
 */
@Component
@Slf4j
public class CursorCodec {

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final ObjectMapper objectMapper;

    public CursorCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public String encode(CursorDirection direction, Integer limit, Map<String, Object> values) {
        return encode(CursorToken.of(direction, limit, values));
    }

    public String encode(CursorToken token) {
        try {
            byte[] json = objectMapper.writeValueAsBytes(token);
            return ENCODER.encodeToString(json);
        } catch (JacksonException ex) {
            throw new IllegalStateException("Failed to encode continuation token: " + ex.getMessage(), ex);
        }
    }

    public Optional<CursorToken> decode(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            return Optional.empty();
        }
        CursorToken token;
        try {
            byte[] json = DECODER.decode(encoded.trim());
            token = objectMapper.readValue(new String(json, StandardCharsets.UTF_8), CursorToken.class);
        } catch (IllegalArgumentException | JacksonException ex) {
            log.debug("Rejected continuation token '{}': {}", encoded, ex.getMessage());
            return Optional.empty();
        }
        if (token == null || !isWellFormed(token)) {
            log.debug("Rejected continuation token '{}': unexpected payload {}", encoded, token);
            return Optional.empty();
        }
        return Optional.of(token);
    }

    private static boolean isWellFormed(CursorToken token) {
        if (token.version() == null || token.version() != CursorToken.CURRENT_VERSION) {
            return false;
        }
        if (token.direction() == null || token.values() == null) {
            return false;
        }
        for (Object value : token.values().values()) {
            if (!isScalar(value)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isScalar(Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean;
    }
}
