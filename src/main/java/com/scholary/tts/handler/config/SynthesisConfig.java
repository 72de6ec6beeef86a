package com.scholary.tts.handler.config;

import com.scholary.tts.handler.synthesis.SynthesisEngineProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the synthesis engine client.
 *
 * <p>Enables the SynthesisEngineProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(SynthesisEngineProperties.class)
public class SynthesisConfig {}
