package dev.minutes.storage;

/**
 * An object address in S3-compatible storage, rendered as {@code s3://bucket/key}.
 *
 * @param bucket bucket name
 * @param key object key inside the bucket
 */
public record StorageLocation(String bucket, String key) {

  private static final String SCHEME = "s3://";

  public StorageLocation {
    if (bucket == null || bucket.isBlank()) {
      throw new IllegalArgumentException("bucket must not be blank");
    }
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException("key must not be blank");
    }
  }

  /**
   * Parses an {@code s3://bucket/key} URI.
   *
   * @param uri the URI to parse
   * @return the parsed location
   * @throws IllegalArgumentException if the URI is not an s3 URI with both bucket and key
   */
  public static StorageLocation parse(String uri) {
    if (uri == null || !uri.startsWith(SCHEME)) {
      throw new IllegalArgumentException("Invalid storage URI: " + uri);
    }
    String path = uri.substring(SCHEME.length());
    int slash = path.indexOf('/');
    if (slash <= 0 || slash == path.length() - 1) {
      throw new IllegalArgumentException("Invalid storage URI: " + uri);
    }
    return new StorageLocation(path.substring(0, slash), path.substring(slash + 1));
  }

  public String toUri() {
    return SCHEME + bucket + "/" + key;
  }

  @Override
  public String toString() {
    return toUri();
  }
}
