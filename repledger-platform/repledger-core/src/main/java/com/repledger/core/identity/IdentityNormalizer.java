package com.repledger.core.identity;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Canonicalizes raw caller credentials into stable actor keys.
 *
 * <p>Accepts plain names, X.509 distinguished-name bundles such as
 * {@code x509::CN=buyer1,OU=client::CN=ca.org1.example.com} and the base64 encoding of such bundles.
 * The subject common name is extracted and lower-cased, so every surface form of one credential
 * maps to the same key. The function is pure, idempotent and never fails.
 */
public final class IdentityNormalizer {

    private static final Pattern BASE64 = Pattern.compile("^[A-Za-z0-9+/]+={0,2}$");
    private static final Pattern FIELD_DELIMITERS = Pattern.compile("::|,|/");
    private static final String CN_PREFIX = "cn=";

    private IdentityNormalizer() {
    }

    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        // an extracted common name may itself be encoded or carry a "cn=" field; every step that
        // changes the value shortens it, so this reaches a fixpoint
        String identity = canonicalStep(raw);
        String previous;
        do {
            previous = identity;
            identity = canonicalStep(previous);
        } while (!identity.equals(previous));
        return identity;
    }

    public static boolean sameActor(String left, String right) {
        return normalize(left).equals(normalize(right));
    }

    private static String canonicalStep(String raw) {
        String identity = raw.trim();
        identity = decodeIfEncoded(identity).orElse(identity);
        if (hasDistinguishedNameMarker(identity)) {
            identity = extractCommonName(identity).orElse(identity);
        }
        return identity.trim().toLowerCase(Locale.ROOT);
    }

    private static Optional<String> decodeIfEncoded(String candidate) {
        if (candidate.length() < 8 || candidate.length() % 4 != 0 || !BASE64.matcher(candidate).matches()) {
            return Optional.empty();
        }
        try {
            byte[] bytes = Base64.getDecoder().decode(candidate);
            String decoded = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
            // only a decoded credential counts; random base64-shaped names stay as they are
            return hasDistinguishedNameMarker(decoded) ? Optional.of(decoded.trim()) : Optional.empty();
        } catch (IllegalArgumentException | CharacterCodingException e) {
            return Optional.empty();
        }
    }

    private static boolean hasDistinguishedNameMarker(String text) {
        return text.toLowerCase(Locale.ROOT).contains(CN_PREFIX);
    }

    private static Optional<String> extractCommonName(String distinguishedName) {
        for (String field : FIELD_DELIMITERS.split(distinguishedName)) {
            String trimmed = field.trim();
            if (trimmed.length() > CN_PREFIX.length()
                    && trimmed.regionMatches(true, 0, CN_PREFIX, 0, CN_PREFIX.length())) {
                return Optional.of(trimmed.substring(CN_PREFIX.length()));
            }
        }
        return Optional.empty();
    }
}
