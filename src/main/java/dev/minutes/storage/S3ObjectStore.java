package dev.minutes.storage;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/** {@link ObjectStore} backed by the AWS SDK v2 synchronous S3 client. */
@Service
public class S3ObjectStore implements ObjectStore {

  private static final Logger log = LoggerFactory.getLogger(S3ObjectStore.class);

  private final S3Client s3Client;

  public S3ObjectStore(S3Client s3Client) {
    this.s3Client = s3Client;
  }

  @Override
  public Optional<ObjectMetadata> head(StorageLocation location) {
    try {
      HeadObjectResponse response =
          s3Client.headObject(
              HeadObjectRequest.builder().bucket(location.bucket()).key(location.key()).build());
      long size = response.contentLength() == null ? 0L : response.contentLength();
      return Optional.of(new ObjectMetadata(size, stripQuotes(response.eTag())));
    } catch (SdkException e) {
      log.warn("HEAD failed for {}: {}", location, e.getMessage());
      return Optional.empty();
    }
  }

  @Override
  public String getString(StorageLocation location) {
    try {
      return s3Client
          .getObjectAsBytes(
              GetObjectRequest.builder().bucket(location.bucket()).key(location.key()).build())
          .asString(StandardCharsets.UTF_8);
    } catch (SdkException e) {
      throw new ObjectStoreException("Failed to read " + location, e);
    }
  }

  @Override
  public void putJson(StorageLocation location, String json) {
    try {
      s3Client.putObject(
          PutObjectRequest.builder()
              .bucket(location.bucket())
              .key(location.key())
              .contentType("application/json")
              .build(),
          RequestBody.fromString(json, StandardCharsets.UTF_8));
    } catch (SdkException e) {
      throw new ObjectStoreException("Failed to write " + location, e);
    }
  }

  static String stripQuotes(String etag) {
    if (etag == null) {
      return null;
    }
    return etag.replace("\"", "");
  }
}
