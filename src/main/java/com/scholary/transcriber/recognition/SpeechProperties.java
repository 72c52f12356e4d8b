package com.scholary.transcriber.recognition;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the speech recognition client.
 *
 * <p>These control how we connect to the speech service, how long a single recognition may run,
 * and how transient failures are retried. {@code apiKey} may be empty when talking to an emulator.
 */
@ConfigurationProperties(prefix = "speech")
@Validated
public record SpeechProperties(
    @NotBlank String baseUrl,
    @NotNull String apiKey,
    @NotNull Duration connectTimeout,
    @NotNull Duration requestTimeout,
    @NotNull Duration operationTimeout,
    @NotNull Duration pollInterval,
    @Positive int maxAttempts,
    @NotNull Duration initialBackoff,
    boolean retryOnTimeout,
    @NotBlank String model,
    @Positive int minSpeakerCount,
    @Positive int maxSpeakerCount) {}
