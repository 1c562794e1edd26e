package com.filesmanager.fingerprint;

import com.filesmanager.config.Constants;

import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;

/**
 * 256 位内容摘要，以小写十六进制表示。
 */
public record Digest(String hex) implements Comparable<Digest> {
    private static final int HEX_LENGTH = Constants.DIGEST_LENGTH_BYTES * 2;

    public Digest {
        Objects.requireNonNull(hex, "hex");
        hex = hex.toLowerCase(Locale.ROOT);
        if (hex.length() != HEX_LENGTH) {
            throw new IllegalArgumentException("摘要长度必须为 " + HEX_LENGTH + " 个十六进制字符: " + hex);
        }
        for (int i = 0; i < hex.length(); i++) {
            if (Character.digit(hex.charAt(i), 16) < 0) {
                throw new IllegalArgumentException("摘要包含非法字符: " + hex);
            }
        }
    }

    public static Digest of(byte[] bytes) {
        if (bytes.length != Constants.DIGEST_LENGTH_BYTES) {
            throw new IllegalArgumentException("摘要字节长度非法: " + bytes.length);
        }
        return new Digest(HexFormat.of().formatHex(bytes));
    }

    public static Digest parse(String hex) {
        return new Digest(hex);
    }

    @Override
    public int compareTo(Digest other) {
        return hex.compareTo(other.hex);
    }

    @Override
    public String toString() {
        return hex;
    }
}
