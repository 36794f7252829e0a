package com.scholary.relay.transcript;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.relay.objectstore.ObjectStoreClient;
import com.scholary.relay.objectstore.ObjectStoreException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes session transcripts to object storage as JSON.
 *
 * <p>Format, stored at {@code transcripts/<sessionId>.json}:
 *
 * <pre>
 * {
 *   "sessionId": "S1",
 *   "text": "hello there",
 *   "segments": [{"text": "hello there", "confidence": 0.93, ...}],
 *   "status": "COMPLETED",
 *   "error": null,
 *   "updatedAt": "2025-10-04T16:17:01Z"
 * }
 * </pre>
 */
public class TranscriptArchiver {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptArchiver.class);

  private static final String KEY_PREFIX = "transcripts/";

  private final ObjectMapper objectMapper;
  private final ObjectStoreClient objectStoreClient;
  private final String bucket;

  public TranscriptArchiver(
      ObjectMapper objectMapper, ObjectStoreClient objectStoreClient, String bucket) {
    this.objectMapper = objectMapper;
    this.objectStoreClient = objectStoreClient;
    this.bucket = bucket;
  }

  public static String keyFor(String sessionId) {
    return KEY_PREFIX + sessionId + ".json";
  }

  public byte[] writeJson(TranscriptRecord record) throws IOException {
    return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(record);
  }

  /**
   * Upload the record, replacing any earlier snapshot for the session.
   *
   * @return false if the upload failed; failures are logged, never thrown
   */
  public boolean archive(TranscriptRecord record) {
    String key = keyFor(record.sessionId());
    try {
      byte[] json = writeJson(record);
      objectStoreClient.putObject(
          bucket, key, new ByteArrayInputStream(json), json.length, "application/json");
      LOGGER.info(
          "Archived transcript: sessionId={}, segments={}, status={}",
          record.sessionId(),
          record.segments().size(),
          record.status());
      return true;
    } catch (IOException | ObjectStoreException e) {
      LOGGER.error("Failed to archive transcript for session {}", record.sessionId(), e);
      return false;
    }
  }

  /** Read an archived record, empty if none exists or it cannot be read. */
  public Optional<TranscriptRecord> load(String sessionId) {
    try (InputStream in = objectStoreClient.getObjectStream(bucket, keyFor(sessionId))) {
      return Optional.of(objectMapper.readValue(in, TranscriptRecord.class));
    } catch (ObjectStoreException e) {
      LOGGER.debug("No archived transcript for session {}: {}", sessionId, e.getMessage());
      return Optional.empty();
    } catch (IOException e) {
      LOGGER.warn("Unreadable archived transcript for session {}", sessionId, e);
      return Optional.empty();
    }
  }
}
