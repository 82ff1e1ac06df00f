package com.solstream.producer.format;

import java.util.Arrays;

/**
 * Bitcoin-alphabet base-58, the text form of Solana public keys, signatures and hashes.
 */
public final class Base58 {

    private static final char[] ALPHABET =
            "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz".toCharArray();

    private Base58() {
    }

    public static String encode(byte[] input) {
        if (input.length == 0) return "";

        int zeros = 0;
        while (zeros < input.length && input[zeros] == 0) zeros++;

        byte[] digits = Arrays.copyOf(input, input.length);
        char[] encoded = new char[input.length * 2];
        int outputStart = encoded.length;
        for (int inputStart = zeros; inputStart < digits.length; ) {
            encoded[--outputStart] = ALPHABET[divmod(digits, inputStart, 256, 58)];
            if (digits[inputStart] == 0) inputStart++;
        }
        while (outputStart < encoded.length && encoded[outputStart] == ALPHABET[0]) outputStart++;
        while (--zeros >= 0) encoded[--outputStart] = ALPHABET[0];
        return new String(encoded, outputStart, encoded.length - outputStart);
    }

    // In-place division of a big-endian number; returns the remainder.
    private static byte divmod(byte[] number, int firstDigit, int base, int divisor) {
        int remainder = 0;
        for (int i = firstDigit; i < number.length; i++) {
            int digit = number[i] & 0xFF;
            int temp = remainder * base + digit;
            number[i] = (byte) (temp / divisor);
            remainder = temp % divisor;
        }
        return (byte) remainder;
    }
}
