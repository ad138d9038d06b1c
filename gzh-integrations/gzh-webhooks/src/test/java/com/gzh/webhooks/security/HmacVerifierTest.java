package com.gzh.webhooks.security;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HmacVerifierTest {

    private static final byte[] BODY = "{\"zen\":\"Keep it logically awesome.\"}".getBytes(StandardCharsets.UTF_8);

    private final HmacVerifier verifier = new HmacVerifier("s3cr3t");

    @Test
    void acceptsSignatureComputedWithSameSecret() {
        assertThat(verifier.verify(BODY, verifier.sign(BODY))).isTrue();
    }

    @Test
    void knownDigest() {
        // echo -n 'Hello, World!' | openssl dgst -sha256 -hmac "It's a Secret to Everybody"
        HmacVerifier github = new HmacVerifier("It's a Secret to Everybody");
        byte[] body = "Hello, World!".getBytes(StandardCharsets.UTF_8);

        assertThat(github.verify(body,
                "sha256=757107ea0eb2509fc211221cce984b8a37570b6d7586c22c46f4379c8b043e17")).isTrue();
    }

    @Test
    void anySingleByteMutationInvalidatesSignature() {
        String signature = verifier.sign(BODY);
        for (int i = 0; i < BODY.length; i++) {
            byte[] mutated = BODY.clone();
            mutated[i] ^= 0x01;
            assertThat(verifier.verify(mutated, signature)).as("mutation at %d", i).isFalse();
        }
    }

    @Test
    void rejectsSignatureFromOtherSecret() {
        String foreign = new HmacVerifier("other").sign(BODY);
        assertThat(verifier.verify(BODY, foreign)).isFalse();
    }

    @Test
    void malformedHeadersAreRejectedWithoutThrowing() {
        assertThat(verifier.verify(BODY, null)).isFalse();
        assertThat(verifier.verify(BODY, "")).isFalse();
        assertThat(verifier.verify(BODY, "sha1=abcdef")).isFalse();
        assertThat(verifier.verify(BODY, "sha256=not-hex")).isFalse();
        assertThat(verifier.verify(BODY, "sha256=abc")).isFalse();
        assertThat(verifier.verify(BODY, "sha256=00ff")).isFalse();
        assertThat(verifier.verify(null, verifier.sign(BODY))).isFalse();
    }

    @Test
    void blankSecretIsRejected() {
        assertThatThrownBy(() -> new HmacVerifier(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
