package com.scholary.transcriber.objectstore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.transcriber.exception.ErrorKind;
import java.net.URI;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.wait.strategy.HttpWaitStrategy;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;

/**
 * Runs the S3 client against a MinIO container.
 *
 * <p>Skipped when Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
class S3ObjectStoreClientTest {

  private static final String ACCESS_KEY = "minioadmin";
  private static final String SECRET_KEY = "minioadmin";
  private static final String BUCKET = "meeting-audio";

  @Container
  static GenericContainer<?> minioContainer =
      new GenericContainer<>("minio/minio:RELEASE.2024-05-10T01-41-38Z")
          .withExposedPorts(9000)
          .withEnv("MINIO_ROOT_USER", ACCESS_KEY)
          .withEnv("MINIO_ROOT_PASSWORD", SECRET_KEY)
          .withCommand("server /data")
          .waitingFor(new HttpWaitStrategy().forPath("/minio/health/ready").forPort(9000));

  private static S3Client admin;
  private static S3ObjectStoreClient client;

  @BeforeAll
  static void setUp() {
    String endpoint =
        String.format("http://%s:%d", minioContainer.getHost(), minioContainer.getMappedPort(9000));

    admin =
        S3Client.builder()
            .region(Region.US_EAST_1)
            .credentialsProvider(
                StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(ACCESS_KEY, SECRET_KEY)))
            .endpointOverride(URI.create(endpoint))
            .forcePathStyle(true)
            .build();
    admin.createBucket(CreateBucketRequest.builder().bucket(BUCKET).build());

    client =
        new S3ObjectStoreClient(
            new ObjectStoreProperties(endpoint, ACCESS_KEY, SECRET_KEY, BUCKET, "us-east-1", true));
  }

  @AfterAll
  static void tearDown() {
    if (client != null) {
      client.close();
    }
    if (admin != null) {
      admin.close();
    }
  }

  @Test
  void putObject_shouldStoreObjectAndReturnS3Uri() {
    byte[] audio = {0x49, 0x44, 0x33, 4, 0, 0};

    String uri = client.putObject("audio/abc/standup.mp3", audio, "audio/mpeg");

    assertThat(uri).isEqualTo("s3://meeting-audio/audio/abc/standup.mp3");
    GetObjectRequest get =
        GetObjectRequest.builder().bucket(BUCKET).key("audio/abc/standup.mp3").build();
    assertThat(admin.getObjectAsBytes(get).asByteArray()).isEqualTo(audio);
    HeadObjectResponse head =
        admin.headObject(b -> b.bucket(BUCKET).key("audio/abc/standup.mp3"));
    assertThat(head.contentType()).isEqualTo("audio/mpeg");
  }

  @Test
  void putObject_shouldFailWithStorageErrorForMissingBucket() {
    S3ObjectStoreClient misconfigured =
        new S3ObjectStoreClient(
            new ObjectStoreProperties(
                String.format(
                    "http://%s:%d", minioContainer.getHost(), minioContainer.getMappedPort(9000)),
                ACCESS_KEY,
                SECRET_KEY,
                "no-such-bucket",
                "us-east-1",
                true));

    try {
      assertThatThrownBy(
              () -> misconfigured.putObject("audio/x/a.wav", new byte[] {1}, "audio/wav"))
          .isInstanceOf(ObjectStoreException.class)
          .hasMessageContaining("no-such-bucket")
          .satisfies(
              e ->
                  assertThat(((ObjectStoreException) e).kind())
                      .isEqualTo(ErrorKind.STORAGE_ERROR));
    } finally {
      misconfigured.close();
    }
  }
}
