package com.scholary.transcriber.config;

import com.scholary.transcriber.recognition.SpeechProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the speech recognition client.
 *
 * <p>Enables the SpeechProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(SpeechProperties.class)
public class SpeechConfig {}
