package dev.minutes.storage;

import java.util.Optional;

/** Minimal object-storage port used by segment validation and the pipeline stages. */
public interface ObjectStore {

  /**
   * Looks up an object's metadata.
   *
   * @return the metadata, or empty if the object does not exist or cannot be reached
   */
  Optional<ObjectMetadata> head(StorageLocation location);

  /**
   * Reads an object as UTF-8 text.
   *
   * @throws ObjectStoreException if the object cannot be read
   */
  String getString(StorageLocation location);

  /**
   * Writes UTF-8 text as a JSON object, replacing any existing object at the same key.
   *
   * @throws ObjectStoreException if the write fails
   */
  void putJson(StorageLocation location, String json);
}
