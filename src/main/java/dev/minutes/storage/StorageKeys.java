package dev.minutes.storage;

/** Object key layout shared by the upload client, the workers and this service. */
public final class StorageKeys {

  private StorageKeys() {}

  public static String chunkPrefix(String tenantId, String sessionId) {
    return "users/" + tenantId + "/chunks/" + sessionId + "/";
  }

  public static String chunkKey(String tenantId, String sessionId, int chunkIndex) {
    return chunkPrefix(tenantId, sessionId) + String.format("chunk_%03d.mp4", chunkIndex);
  }

  public static String videoKey(String tenantId, String sessionId) {
    return "users/" + tenantId + "/videos/" + sessionId + ".mp4";
  }

  public static String audioKey(String tenantId, String sessionId) {
    return "users/" + tenantId + "/audio/" + sessionId + ".wav";
  }

  public static String transcriptKey(String tenantId, String sessionId) {
    return "users/" + tenantId + "/transcripts/" + sessionId + ".json";
  }

  public static String summaryKey(String tenantId, String sessionId) {
    return "users/" + tenantId + "/summaries/" + sessionId + ".json";
  }
}
