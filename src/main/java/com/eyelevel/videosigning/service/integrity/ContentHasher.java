package com.eyelevel.videosigning.service.integrity;

import com.eyelevel.videosigning.config.VideoSigningConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.binary.Hex;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Computes SHA-256 content digests by streaming bytes through a fixed-size buffer, so memory use
 * does not grow with the size of the video.
 */
@Slf4j
@Component
public class ContentHasher {

    private static final String ALGORITHM = "SHA-256";

    private final int chunkSize;

    @Autowired
    public ContentHasher(final VideoSigningConfig config) {
        this(config.getHashChunkSize());
    }

    ContentHasher(final int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Hash chunk size must be positive but was " + chunkSize);
        }
        this.chunkSize = chunkSize;
    }

    /**
     * Digests every remaining byte of the stream. The stream is not closed.
     *
     * @return The lower-case hex SHA-256 of the stream's content.
     * @throws IOException if the stream cannot be read.
     */
    public String digest(final InputStream inputStream) throws IOException {
        final MessageDigest sha256 = newDigest();
        final byte[] buffer = new byte[chunkSize];
        int read;
        while ((read = inputStream.read(buffer)) != -1) {
            sha256.update(buffer, 0, read);
        }
        return Hex.encodeHexString(sha256.digest());
    }

    public String digest(final Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return digest(in);
        }
    }

    /**
     * Copies the stream to {@code target}, digesting each chunk on the way through.
     *
     * @return The digest of the copied content and the number of bytes written.
     * @throws IOException if reading the source or writing the target fails.
     */
    public DigestingCopy copyAndDigest(final InputStream source, final Path target) throws IOException {
        final MessageDigest sha256 = newDigest();
        final byte[] buffer = new byte[chunkSize];
        long total = 0;
        try (OutputStream out = Files.newOutputStream(target, StandardOpenOption.CREATE,
                                                      StandardOpenOption.TRUNCATE_EXISTING,
                                                      StandardOpenOption.WRITE)) {
            int read;
            while ((read = source.read(buffer)) != -1) {
                sha256.update(buffer, 0, read);
                out.write(buffer, 0, read);
                total += read;
            }
        }
        final String hash = Hex.encodeHexString(sha256.digest());
        log.debug("Copied {} bytes to {} with SHA-256 {}", total, target, hash);
        return new DigestingCopy(hash, total);
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * @param contentHash Lower-case hex SHA-256 of the copied bytes.
     * @param size        Number of bytes copied.
     */
    public record DigestingCopy(String contentHash, long size) {
    }
}
