package com.solstream.producer.format;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Base58")
class Base58Test {

    @Test
    @DisplayName("encodes known vectors")
    void knownVectors() {
        assertThat(Base58.encode("Hello World!".getBytes(StandardCharsets.US_ASCII))).isEqualTo("2NEpo7TZRRrLZSi2U");
        assertThat(Base58.encode(new byte[0])).isEmpty();
        assertThat(Base58.encode(new byte[]{0, 0, 1})).isEqualTo("112");
    }

    @Test
    @DisplayName("the all-zero 32-byte key is the system program id")
    void systemProgram() {
        assertThat(Base58.encode(new byte[32])).isEqualTo("11111111111111111111111111111111");
    }
}
