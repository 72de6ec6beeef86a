package com.scholary.tts.handler.artifact;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

/**
 * S3/MinIO implementation of ArtifactStore.
 *
 * <p>This uses AWS SDK v2, which works with both real S3 and S3-compatible services like MinIO. The
 * key difference is the endpoint and path-style access configuration.
 *
 * <p>Objects are {@code {keyPrefix}{jobId}.mp3} plus a {@code {keyPrefix}{jobId}.json} sidecar. A
 * PUT only becomes visible once the whole object is uploaded, so no temporary key is needed; the
 * sidecar is uploaded before the audio so a visible artifact always has its metadata.
 *
 * <p>The SDK retries transient failures (network issues, 500 errors, throttling) on its own. A 404
 * is mapped to "absent"; everything else becomes {@link ArtifactStoreException}.
 */
public class S3ArtifactStore implements ArtifactStore, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3ArtifactStore.class);

  private static final String AUDIO_SUFFIX = ".mp3";
  private static final String SIDECAR_SUFFIX = ".json";

  private final S3Client s3Client;
  private final String bucket;
  private final String keyPrefix;
  private final Map<String, ArtifactMetadata> index = new ConcurrentHashMap<>();

  public S3ArtifactStore(ObjectStoreProperties properties) {
    this(buildClient(properties), properties.bucket(), properties.keyPrefix());
  }

  S3ArtifactStore(S3Client s3Client, String bucket, String keyPrefix) {
    this.s3Client = s3Client;
    this.bucket = bucket;
    this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
    rebuildIndex();
    LOGGER.info(
        "S3 artifact store ready: bucket={}, prefix={}, artifacts={}",
        bucket,
        this.keyPrefix,
        index.size());
  }

  private static S3Client buildClient(ObjectStoreProperties properties) {
    LOGGER.info(
        "Initializing S3 client: endpoint={}, bucket={}, pathStyleAccess={}",
        properties.endpoint(),
        properties.bucket(),
        properties.pathStyleAccess());

    AwsBasicCredentials credentials =
        AwsBasicCredentials.create(properties.accessKey(), properties.secretKey());

    Region region =
        properties.region() != null && !properties.region().isEmpty()
            ? Region.of(properties.region())
            : Region.US_EAST_1;

    return S3Client.builder()
        .region(region)
        .credentialsProvider(StaticCredentialsProvider.create(credentials))
        .endpointOverride(URI.create(properties.endpoint()))
        .forcePathStyle(properties.pathStyleAccess()) // Required for MinIO
        .build();
  }

  @Override
  public void save(ArtifactMetadata metadata, byte[] audio) {
    String jobId = metadata.jobId();
    ArtifactMetadata stored = metadata.withSize(audio.length);

    try {
      put(sidecarKey(jobId), ArtifactMetadataCodec.encode(stored), "application/json");
      put(audioKey(jobId), audio, "audio/mpeg");
    } catch (IOException e) {
      throw new ArtifactStoreException("Failed to encode sidecar: jobId=" + jobId, e);
    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to upload artifact: bucket=%s, jobId=%s, statusCode=%s",
              bucket, jobId, e.statusCode());
      LOGGER.error(message, e);
      throw new ArtifactStoreException(message, e);
    }

    index.put(jobId, stored);
    LOGGER.info("Stored artifact: bucket={}, jobId={}, bytes={}", bucket, jobId, audio.length);
  }

  @Override
  public boolean exists(String jobId) {
    try {
      s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(audioKey(jobId)).build());
      return true;
    } catch (NoSuchKeyException e) {
      return false;
    } catch (S3Exception e) {
      if (e.statusCode() == 404) {
        return false;
      }
      String message =
          String.format(
              "Failed to check artifact: bucket=%s, jobId=%s, statusCode=%s",
              bucket, jobId, e.statusCode());
      LOGGER.error(message, e);
      throw new ArtifactStoreException(message, e);
    }
  }

  @Override
  public Optional<byte[]> read(String jobId) {
    try {
      byte[] audio =
          s3Client
              .getObjectAsBytes(
                  GetObjectRequest.builder().bucket(bucket).key(audioKey(jobId)).build())
              .asByteArray();
      return Optional.of(audio);
    } catch (NoSuchKeyException e) {
      return Optional.empty();
    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to read artifact: bucket=%s, jobId=%s, statusCode=%s",
              bucket, jobId, e.statusCode());
      LOGGER.error(message, e);
      throw new ArtifactStoreException(message, e);
    }
  }

  @Override
  public boolean delete(String jobId) {
    // S3 deletes succeed for missing keys, so check first
    if (!exists(jobId)) {
      index.remove(jobId);
      return false;
    }
    try {
      s3Client.deleteObject(
          DeleteObjectRequest.builder().bucket(bucket).key(audioKey(jobId)).build());
      s3Client.deleteObject(
          DeleteObjectRequest.builder().bucket(bucket).key(sidecarKey(jobId)).build());
    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to delete artifact: bucket=%s, jobId=%s, statusCode=%s",
              bucket, jobId, e.statusCode());
      LOGGER.error(message, e);
      throw new ArtifactStoreException(message, e);
    }
    index.remove(jobId);
    LOGGER.info("Deleted artifact: bucket={}, jobId={}", bucket, jobId);
    return true;
  }

  @Override
  public List<ArtifactMetadata> list() {
    return new ArrayList<>(index.values());
  }

  @Override
  public int count() {
    return index.size();
  }

  /** Release the S3 client's connections. */
  @Override
  public void close() {
    LOGGER.info("Closing S3 client");
    s3Client.close();
  }

  private void rebuildIndex() {
    Map<String, S3Object> audioObjects = new HashMap<>();
    Set<String> sidecarKeys = new HashSet<>();

    try {
      ListObjectsV2Request request =
          ListObjectsV2Request.builder().bucket(bucket).prefix(keyPrefix).build();
      for (S3Object object : s3Client.listObjectsV2Paginator(request).contents()) {
        String name = object.key().substring(keyPrefix.length());
        if (name.endsWith(AUDIO_SUFFIX)) {
          audioObjects.put(name.substring(0, name.length() - AUDIO_SUFFIX.length()), object);
        } else if (name.endsWith(SIDECAR_SUFFIX)) {
          sidecarKeys.add(name.substring(0, name.length() - SIDECAR_SUFFIX.length()));
        }
      }
    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to list artifacts: bucket=%s, statusCode=%s", bucket, e.statusCode());
      LOGGER.error(message, e);
      throw new ArtifactStoreException(message, e);
    }

    audioObjects.forEach(
        (jobId, object) -> {
          ArtifactMetadata metadata = sidecarKeys.contains(jobId) ? readSidecar(jobId) : null;
          if (metadata == null) {
            metadata =
                new ArtifactMetadata(
                    jobId, object.lastModified(), object.lastModified(), null, null, 0);
          }
          index.put(jobId, metadata.withSize(object.size()));
        });
  }

  private ArtifactMetadata readSidecar(String jobId) {
    try {
      byte[] json =
          s3Client
              .getObjectAsBytes(
                  GetObjectRequest.builder().bucket(bucket).key(sidecarKey(jobId)).build())
              .asByteArray();
      return ArtifactMetadataCodec.decode(json);
    } catch (IOException | S3Exception e) {
      LOGGER.warn("Unreadable sidecar for jobId={}, falling back to object attributes", jobId, e);
      return null;
    }
  }

  private void put(String key, byte[] content, String contentType) {
    PutObjectRequest request =
        PutObjectRequest.builder()
            .bucket(bucket)
            .key(key)
            .contentType(contentType)
            .contentLength((long) content.length)
            .build();
    s3Client.putObject(request, RequestBody.fromBytes(content));
  }

  private String audioKey(String jobId) {
    return keyPrefix + jobId + AUDIO_SUFFIX;
  }

  private String sidecarKey(String jobId) {
    return keyPrefix + jobId + SIDECAR_SUFFIX;
  }
}
