package com.eyelevel.videosigning.service.storage;

import com.eyelevel.videosigning.config.VideoSigningConfig;
import com.eyelevel.videosigning.exception.StagingException;
import com.eyelevel.videosigning.service.integrity.ContentHasher;
import com.eyelevel.videosigning.service.integrity.ContentHasher.DigestingCopy;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.stream.Stream;

/**
 * Owns the two on-disk locations of the service: the staging directory for uploaded inputs awaiting
 * signing, and the artifact directory holding signed outputs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StagingStorageService {

    private final VideoSigningConfig config;
    private final ContentHasher contentHasher;

    @PostConstruct
    void ensureDirectories() {
        try {
            Files.createDirectories(stagingDir());
            Files.createDirectories(artifactDir());
            log.info("Staging directory: {}, artifact directory: {}", stagingDir(), artifactDir());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create staging or artifact directories", e);
        }
    }

    /**
     * Streams an upload into a new staging file, hashing it in the same pass.
     *
     * @param content          The upload's byte stream. Closed by this method.
     * @param originalFileName The client-supplied name; only its extension is reused.
     * @return The staged file and its content hash.
     * @throws StagingException if the bytes cannot be persisted. No partial file is left behind.
     */
    public StagedFile stage(final InputStream content, final String originalFileName) {
        final String extension = FilenameUtils.getExtension(originalFileName);
        final String suffix = StringUtils.hasText(extension) ? "." + extension : ".bin";
        Path stagedPath = null;
        try (InputStream in = content) {
            stagedPath = Files.createTempFile(stagingDir(), "upload-", suffix);
            final DigestingCopy copy = contentHasher.copyAndDigest(in, stagedPath);
            log.info("Staged '{}' as {} ({} bytes, SHA-256 {}).", originalFileName, stagedPath.getFileName(),
                     copy.size(), copy.contentHash());
            return new StagedFile(stagedPath, copy.contentHash(), copy.size());
        } catch (IOException e) {
            discard(stagedPath);
            throw new StagingException("Upload failed: could not stage '" + originalFileName + "'", e);
        }
    }

    /**
     * Deletes a staged input or an unwanted output. Failures are logged and never thrown.
     *
     * @return {@code true} if a file was removed.
     */
    public boolean discard(final Path path) {
        if (path == null) {
            return false;
        }
        try {
            if (Files.deleteIfExists(path)) {
                log.debug("Removed file {}", path);
                return true;
            }
        } catch (IOException e) {
            log.error("Failed to delete file: {}", path, e);
        }
        return false;
    }

    /**
     * Removes staged inputs last modified before {@code now - maxAge}. These belong to jobs whose
     * worker never ran to completion, e.g. because the service stopped while they were queued.
     *
     * @return The number of staged files removed.
     */
    public int purgeStagedOlderThan(final Duration maxAge) {
        final Instant cutoff = Instant.now().minus(maxAge);
        int removed = 0;
        try (Stream<Path> files = Files.list(stagingDir())) {
            for (final Path file : (Iterable<Path>) files::iterator) {
                if (Files.isRegularFile(file) && isModifiedBefore(file, cutoff) && discard(file)) {
                    removed++;
                }
            }
        } catch (IOException e) {
            log.error("Could not scan staging directory {} for abandoned uploads.", stagingDir(), e);
        }
        if (removed > 0) {
            log.warn("Removed {} abandoned staged uploads older than {} minutes.", removed, maxAge.toMinutes());
        }
        return removed;
    }

    private static boolean isModifiedBefore(final Path file, final Instant cutoff) {
        try {
            return Files.getLastModifiedTime(file).toInstant().isBefore(cutoff);
        } catch (IOException e) {
            log.debug("Could not read modification time of {}: {}", file, e.getMessage());
            return false;
        }
    }

    /**
     * Resolves a signed output name inside the artifact directory, refusing names that escape it.
     */
    public Path resolveArtifact(final String outputName) {
        final Path resolved = artifactDir().resolve(outputName).normalize();
        if (!resolved.startsWith(artifactDir())) {
            throw new IllegalArgumentException("Output name escapes the artifact directory: " + outputName);
        }
        return resolved;
    }

    public Path stagingDir() {
        return Paths.get(config.getStagingDir()).toAbsolutePath().normalize();
    }

    public Path artifactDir() {
        return Paths.get(config.getArtifactDir()).toAbsolutePath().normalize();
    }

    /**
     * @param path        The staged input file, owned by the job that signs it.
     * @param contentHash Lower-case hex SHA-256 of the staged bytes.
     * @param size        Number of bytes staged.
     */
    public record StagedFile(Path path, String contentHash, long size) {
    }
}
