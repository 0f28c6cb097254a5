package com.repledger.core.identity;

import net.jqwik.api.*;
import net.jqwik.api.constraints.AlphaChars;
import net.jqwik.api.constraints.NumericChars;
import net.jqwik.api.constraints.StringLength;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for credential normalization.
 * Every surface form of one credential must collapse to the same actor key.
 */
class IdentityNormalizerPropertyTest {

    // ==================== Contract ====================

    /**
     * Property: normalization is idempotent for any input.
     */
    @Property(tries = 500)
    void normalizationIsIdempotent(@ForAll String raw) {
        String once = IdentityNormalizer.normalize(raw);
        assertThat(IdentityNormalizer.normalize(once)).isEqualTo(once);
    }

    /**
     * Property: the raw distinguished name, its base64 encoding and the bare common name are one actor.
     */
    @Property(tries = 200)
    void encodedAndRawDistinguishedNamesCollide(
            @ForAll @AlphaChars @NumericChars @StringLength(min = 1, max = 24) String commonName) {
        String distinguishedName = "x509::CN=" + commonName + ",OU=client,O=Org1::CN=ca.org1.example.com,O=Org1";
        String encoded = Base64.getEncoder().encodeToString(distinguishedName.getBytes(StandardCharsets.UTF_8));

        String expected = commonName.toLowerCase();
        assertThat(IdentityNormalizer.normalize(distinguishedName)).isEqualTo(expected);
        assertThat(IdentityNormalizer.normalize(encoded)).isEqualTo(expected);
        assertThat(IdentityNormalizer.normalize(commonName)).isEqualTo(expected);
        assertThat(IdentityNormalizer.sameActor(encoded, commonName.toUpperCase())).isTrue();
    }

    /**
     * Property: a common name that is itself base64 of a "cn=" text still normalizes to a fixpoint.
     */
    @Property(tries = 300)
    void encodedLookingCommonNamesAreStable(
            @ForAll @AlphaChars @StringLength(min = 1, max = 12) String prefix,
            @ForAll @AlphaChars @StringLength(min = 1, max = 12) String suffix) {
        String hidden = prefix + "cn=" + suffix;
        String commonName = Base64.getEncoder().encodeToString(hidden.getBytes(StandardCharsets.UTF_8));
        String distinguishedName = "x509::CN=" + commonName + ",OU=client::CN=ca.org1.example.com";

        String once = IdentityNormalizer.normalize(distinguishedName);
        assertThat(IdentityNormalizer.normalize(once)).isEqualTo(once);
        assertThat(IdentityNormalizer.sameActor(distinguishedName, once)).isTrue();
    }

    @Property(tries = 200)
    void normalizedKeysAreTrimmedAndLowerCase(@ForAll @AlphaChars @StringLength(min = 1, max = 16) String name) {
        String normalized = IdentityNormalizer.normalize("  " + name + "\t");
        assertThat(normalized).isEqualTo(name.toLowerCase());
    }

    // ==================== Examples ====================

    @Test
    void nullBecomesEmptyKey() {
        assertThat(IdentityNormalizer.normalize(null)).isEmpty();
    }

    @Test
    void slashSeparatedSubjectIsParsed() {
        assertThat(IdentityNormalizer.normalize("/C=US/O=Org1/CN=Buyer1")).isEqualTo("buyer1");
    }

    @Test
    void nestedCommonNamePrefixIsPeeled() {
        assertThat(IdentityNormalizer.normalize("CN=cn=Alice")).isEqualTo("alice");
    }

    @Test
    void base64LookingNameWithoutMarkerIsKept() {
        // "QWxpY2VCb2I=" decodes to "AliceBob", which carries no common name
        assertThat(IdentityNormalizer.normalize("QWxpY2VCb2I=")).isEqualTo("qwxpy2vcb2i=");
    }

    @Test
    void commonNameThatDecodesToMarkerNormalizesToFixpoint() {
        // "b29jbj1va053" decodes to "oocn=okNw"
        String credential = "x509::CN=b29jbj1va053,OU=client::CN=ca.org1.example.com";

        String normalized = IdentityNormalizer.normalize(credential);

        assertThat(normalized).isEqualTo("oocn=oknw");
        assertThat(IdentityNormalizer.normalize(normalized)).isEqualTo(normalized);
    }

    @Test
    void markerWithoutCommonNameFieldFallsBackToWholeString() {
        assertThat(IdentityNormalizer.normalize("Vendor-cn=7")).isEqualTo("vendor-cn=7");
    }
}
