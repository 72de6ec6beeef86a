package com.scholary.tts.handler.config;

import com.scholary.tts.handler.artifact.ArtifactStore;
import com.scholary.tts.handler.artifact.ArtifactStoreProperties;
import com.scholary.tts.handler.artifact.FileSystemArtifactStore;
import com.scholary.tts.handler.artifact.ObjectStoreProperties;
import com.scholary.tts.handler.artifact.S3ArtifactStore;
import java.nio.file.Paths;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for artifact storage.
 *
 * <p>Selects the backend from {@code tts.artifacts.backend}: a local directory by default, or an
 * S3-compatible bucket configured under {@code objectstore.*}.
 */
@Configuration
@EnableConfigurationProperties(ArtifactStoreProperties.class)
public class ArtifactStoreConfig {

  @Bean
  @ConditionalOnProperty(
      name = "tts.artifacts.backend",
      havingValue = "filesystem",
      matchIfMissing = true)
  public ArtifactStore fileSystemArtifactStore(ArtifactStoreProperties properties) {
    return new FileSystemArtifactStore(Paths.get(properties.directory()));
  }

  @Configuration
  @ConditionalOnProperty(name = "tts.artifacts.backend", havingValue = "s3")
  @EnableConfigurationProperties(ObjectStoreProperties.class)
  static class S3StoreConfig {

    @Bean(destroyMethod = "close")
    public ArtifactStore s3ArtifactStore(ObjectStoreProperties properties) {
      return new S3ArtifactStore(properties);
    }
  }
}
