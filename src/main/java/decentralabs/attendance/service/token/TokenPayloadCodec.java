package decentralabs.attendance.service.token;

import decentralabs.attendance.config.AttendanceProperties;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Optional;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Generates unguessable token ids and the opaque payload string handed to the QR renderer:
 * {@code <prefix>:<tokenId>.<tag>} where the tag is a truncated HMAC-SHA256 of the id.
 */
@Component
@Slf4j
public class TokenPayloadCodec {

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final int TAG_HEX_LENGTH = 16;
    private static final SecureRandom RANDOM = new SecureRandom();

    private final String prefix;
    private final int idBytes;
    private final byte[] secret;

    public TokenPayloadCodec(AttendanceProperties properties) {
        AttendanceProperties.Token config = properties.getToken();
        this.prefix = config.getPayloadPrefix();
        this.idBytes = Math.max(16, config.getIdBytes());
        String configured = config.getPayloadSecret();
        if (configured == null || configured.isBlank()) {
            byte[] generated = new byte[32];
            RANDOM.nextBytes(generated);
            this.secret = generated;
            log.warn("attendance.token.payload-secret not set; payloads issued by this instance will not verify after a restart");
        } else {
            this.secret = configured.getBytes(StandardCharsets.UTF_8);
        }
    }

    public String newTokenId() {
        byte[] raw = new byte[idBytes];
        RANDOM.nextBytes(raw);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(raw);
    }

    public String encode(String tokenId) {
        return prefix + ":" + tokenId + "." + tag(tokenId);
    }

    /**
     * Extracts the token id from a scanned payload.
     *
     * @return empty when the prefix, layout or integrity tag does not match
     */
    public Optional<String> decode(String payload) {
        if (payload == null) {
            return Optional.empty();
        }
        String expectedPrefix = prefix + ":";
        String trimmed = payload.trim();
        if (!trimmed.startsWith(expectedPrefix)) {
            return Optional.empty();
        }
        String body = trimmed.substring(expectedPrefix.length());
        int dot = body.lastIndexOf('.');
        if (dot <= 0 || dot == body.length() - 1) {
            return Optional.empty();
        }
        String tokenId = body.substring(0, dot);
        String providedTag = body.substring(dot + 1);
        byte[] expected = tag(tokenId).getBytes(StandardCharsets.US_ASCII);
        byte[] provided = providedTag.getBytes(StandardCharsets.US_ASCII);
        if (!MessageDigest.isEqual(expected, provided)) {
            return Optional.empty();
        }
        return Optional.of(tokenId);
    }

    private String tag(String tokenId) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret, HMAC_ALGORITHM));
            byte[] digest = mac.doFinal(tokenId.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, TAG_HEX_LENGTH);
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", ex);
        }
    }
}
