package com.sensor.readings.reshaper.config;

import java.net.URI;
import java.time.Duration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.core.retry.backoff.BackoffStrategy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * AWS SDK v2 configuration for the S3 client.
 *
 * <p>Adapts to the environment based on application.yml settings. Supports both LocalStack
 * (development) and AWS (production) environments.
 */
@Configuration
public class AwsConfiguration {

  @Value("${aws.region:us-east-1}")
  private String awsRegion;

  @Value("${aws.endpoint-url:}")
  private String endpointUrl;

  @Value("${aws.credentials.access-key:}")
  private String accessKey;

  @Value("${aws.credentials.secret-key:}")
  private String secretKey;

  @Value("${aws.sdk-retries:2}")
  private int sdkRetries;

  /**
   * Client override configuration with timeouts and a short SDK-level retry policy. Longer outages
   * are absorbed by the transfer retries and the failure ledger.
   */
  @Bean
  public ClientOverrideConfiguration clientOverrideConfiguration() {
    return ClientOverrideConfiguration.builder()
        .apiCallTimeout(Duration.ofMinutes(5))
        .apiCallAttemptTimeout(Duration.ofSeconds(60))
        .retryPolicy(
            RetryPolicy.builder()
                .numRetries(sdkRetries)
                .backoffStrategy(BackoffStrategy.defaultStrategy())
                .build())
        .build();
  }

  /** Credentials provider that adapts to environment. */
  @Bean
  public AwsCredentialsProvider awsCredentialsProvider() {
    // Use static credentials if provided (LocalStack development)
    if (!accessKey.isEmpty() && !secretKey.isEmpty()) {
      return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey));
    }
    return DefaultCredentialsProvider.create();
  }

  /** S3 client that adapts to environment. */
  @Bean
  public S3Client s3Client(
      AwsCredentialsProvider credentialsProvider,
      ClientOverrideConfiguration clientOverrideConfiguration) {

    var builder =
        S3Client.builder()
            .region(Region.of(awsRegion))
            .credentialsProvider(credentialsProvider)
            .overrideConfiguration(clientOverrideConfiguration);

    if (!endpointUrl.isEmpty()) {
      builder
          .endpointOverride(URI.create(endpointUrl))
          .forcePathStyle(true); // Required for LocalStack
    }

    return builder.build();
  }
}
