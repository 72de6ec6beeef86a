package com.scholary.tts.handler.artifact;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Artifact store backed by a local directory.
 *
 * <p>Layout: {@code {jobId}.mp3} holds the audio and {@code {jobId}.json} the sidecar record.
 * Both are written to a {@code .part} file first and then moved into place, so a crash mid-write
 * leaves at most a stray {@code .part} file, which is removed on the next startup.
 *
 * <p>The index is rebuilt from the directory when the store is created. Audio files without a
 * sidecar (copied in by hand, or written by an older version) are indexed from their file
 * attributes.
 */
public class FileSystemArtifactStore implements ArtifactStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileSystemArtifactStore.class);

  static final String AUDIO_SUFFIX = ".mp3";
  static final String SIDECAR_SUFFIX = ".json";
  static final String PART_SUFFIX = ".part";

  private static final Pattern JOB_ID = Pattern.compile("[A-Za-z0-9_-]{1,128}");

  private final Path directory;
  private final Map<String, ArtifactMetadata> index = new ConcurrentHashMap<>();

  public FileSystemArtifactStore(Path directory) {
    this.directory = directory;
    try {
      Files.createDirectories(directory);
    } catch (IOException e) {
      throw new ArtifactStoreException("Failed to create artifact directory: " + directory, e);
    }
    rebuildIndex();
    LOGGER.info("Artifact store ready: directory={}, artifacts={}", directory, index.size());
  }

  @Override
  public void save(ArtifactMetadata metadata, byte[] audio) {
    String jobId = metadata.jobId();
    requireValidId(jobId);
    ArtifactMetadata stored = metadata.withSize(audio.length);

    Path sidecar = sidecarPath(jobId);
    try {
      // Sidecar first: once the audio is visible its metadata must be too
      writeAtomically(sidecar, ArtifactMetadataCodec.encode(stored));
      writeAtomically(audioPath(jobId), audio);
    } catch (IOException e) {
      deleteQuietly(sidecar);
      String message = String.format("Failed to write artifact: jobId=%s", jobId);
      LOGGER.error(message, e);
      throw new ArtifactStoreException(message, e);
    }

    index.put(jobId, stored);
    LOGGER.info("Stored artifact: jobId={}, bytes={}", jobId, audio.length);
  }

  @Override
  public boolean exists(String jobId) {
    return isValidId(jobId) && Files.isRegularFile(audioPath(jobId));
  }

  @Override
  public Optional<byte[]> read(String jobId) {
    if (!isValidId(jobId)) {
      return Optional.empty();
    }
    try {
      return Optional.of(Files.readAllBytes(audioPath(jobId)));
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException e) {
      String message = String.format("Failed to read artifact: jobId=%s", jobId);
      LOGGER.error(message, e);
      throw new ArtifactStoreException(message, e);
    }
  }

  @Override
  public boolean delete(String jobId) {
    if (!isValidId(jobId)) {
      return false;
    }
    try {
      boolean removed = Files.deleteIfExists(audioPath(jobId));
      Files.deleteIfExists(sidecarPath(jobId));
      index.remove(jobId);
      if (removed) {
        LOGGER.info("Deleted artifact: jobId={}", jobId);
      }
      return removed;
    } catch (IOException e) {
      String message = String.format("Failed to delete artifact: jobId=%s", jobId);
      LOGGER.error(message, e);
      throw new ArtifactStoreException(message, e);
    }
  }

  @Override
  public List<ArtifactMetadata> list() {
    return new ArrayList<>(index.values());
  }

  @Override
  public int count() {
    return index.size();
  }

  private void rebuildIndex() {
    index.clear();
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory)) {
      for (Path entry : entries) {
        String name = entry.getFileName().toString();
        if (name.endsWith(PART_SUFFIX)) {
          LOGGER.warn("Removing interrupted write: {}", name);
          deleteQuietly(entry);
        } else if (name.endsWith(AUDIO_SUFFIX)) {
          String jobId = name.substring(0, name.length() - AUDIO_SUFFIX.length());
          if (isValidId(jobId)) {
            index.put(jobId, loadMetadata(jobId, entry));
          }
        }
      }
    } catch (IOException e) {
      throw new ArtifactStoreException("Failed to scan artifact directory: " + directory, e);
    }
  }

  private ArtifactMetadata loadMetadata(String jobId, Path audio) throws IOException {
    BasicFileAttributes attributes = Files.readAttributes(audio, BasicFileAttributes.class);
    Path sidecar = sidecarPath(jobId);
    if (Files.isRegularFile(sidecar)) {
      try {
        ArtifactMetadata metadata = ArtifactMetadataCodec.decode(Files.readAllBytes(sidecar));
        return metadata.withSize(attributes.size());
      } catch (IOException e) {
        LOGGER.warn("Unreadable sidecar for jobId={}, falling back to file attributes", jobId, e);
      }
    }
    Instant modified = attributes.lastModifiedTime().toInstant();
    return new ArtifactMetadata(jobId, modified, modified, null, null, attributes.size());
  }

  private void writeAtomically(Path target, byte[] content) throws IOException {
    Path part = target.resolveSibling(target.getFileName() + PART_SUFFIX);
    Files.write(part, content);
    try {
      Files.move(part, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(part, target, StandardCopyOption.REPLACE_EXISTING);
    } finally {
      Files.deleteIfExists(part);
    }
  }

  private void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete {}", path, e);
    }
  }

  private Path audioPath(String jobId) {
    return directory.resolve(jobId + AUDIO_SUFFIX);
  }

  private Path sidecarPath(String jobId) {
    return directory.resolve(jobId + SIDECAR_SUFFIX);
  }

  private static boolean isValidId(String jobId) {
    return jobId != null && JOB_ID.matcher(jobId).matches();
  }

  private static void requireValidId(String jobId) {
    if (!isValidId(jobId)) {
      throw new IllegalArgumentException("Invalid job id: " + jobId);
    }
  }
}
