package com.filesmanager.fingerprint;

import com.filesmanager.config.Constants;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * 文件内容指纹计算，按固定大小分块读取整个字节流。
 *
 * 摘要只取决于文件字节，与分块大小和路径编码无关。
 */
public final class FingerprintEngine {
    private final int chunkSize;

    public FingerprintEngine() {
        this(Constants.HASH_CHUNK_SIZE);
    }

    public FingerprintEngine(int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("分块大小必须为正数: " + chunkSize);
        }
        this.chunkSize = chunkSize;
    }

    /**
     * 计算文件摘要。
     *
     * @param path 文件路径
     * @return SHA-256 摘要
     * @throws IOException 读取失败或无权限时抛出
     */
    public Digest digest(Path path) throws IOException {
        MessageDigest messageDigest = newMessageDigest();
        try (InputStream input = Files.newInputStream(path)) {
            byte[] buffer = new byte[chunkSize];
            int bytesRead;
            while ((bytesRead = input.read(buffer)) != -1) {
                messageDigest.update(buffer, 0, bytesRead);
            }
        }
        return Digest.of(messageDigest.digest());
    }

    public static MessageDigest newMessageDigest() {
        try {
            return MessageDigest.getInstance(Constants.DIGEST_ALGORITHM);
        } catch (NoSuchAlgorithmException exception) {
            throw new IllegalStateException("摘要算法不可用: " + Constants.DIGEST_ALGORITHM, exception);
        }
    }
}
