package dev.minutes.intake;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Extracts tenant, session and chunk index from an uploaded object key. */
@Component
public class ChunkKeyParser {

  private static final Pattern CHUNK_KEY =
      Pattern.compile("^users/([^/]+)/chunks/([^/]+)/chunk_(\\d{3})\\.mp4$");

  /**
   * Parses a chunk key. Notification keys arrive URL-encoded and are decoded first.
   *
   * @throws MalformedKeyException if the key does not match the chunk layout
   */
  public ChunkKey parse(String objectKey) {
    if (objectKey == null) {
      throw new MalformedKeyException("null");
    }
    String decoded = URLDecoder.decode(objectKey, StandardCharsets.UTF_8);
    Matcher matcher = CHUNK_KEY.matcher(decoded);
    if (!matcher.matches()) {
      throw new MalformedKeyException(decoded);
    }
    return new ChunkKey(matcher.group(1), matcher.group(2), Integer.parseInt(matcher.group(3)));
  }
}
