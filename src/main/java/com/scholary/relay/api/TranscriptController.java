package com.scholary.relay.api;

import com.scholary.relay.gateway.AuthenticationException;
import com.scholary.relay.gateway.ConnectionGateway;
import com.scholary.relay.gateway.SessionNotFoundException;
import com.scholary.relay.transcript.TranscriptArchiver;
import com.scholary.relay.transcript.TranscriptRecord;
import com.scholary.relay.transcript.TranscriptRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read access to accumulated session transcripts.
 *
 * <p>Used by report generation once a consultation has ended. Falls back to the object-store
 * archive when the in-memory record has been evicted.
 */
@RestController
@RequestMapping("/api/v1/sessions")
@Tag(name = "Transcripts", description = "Finalized transcripts of streamed sessions")
public class TranscriptController {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptController.class);

  private final ConnectionGateway gateway;
  private final TranscriptRepository transcripts;
  private final ObjectProvider<TranscriptArchiver> archiver;

  public TranscriptController(
      ConnectionGateway gateway,
      TranscriptRepository transcripts,
      ObjectProvider<TranscriptArchiver> archiver) {
    this.gateway = gateway;
    this.transcripts = transcripts;
    this.archiver = archiver;
  }

  @GetMapping("/{sessionId}/transcript")
  @Operation(
      summary = "Get session transcript",
      description =
          "Returns the finalized transcript of a session owned by the caller, with its status "
              + "and segment count. Requires Authorization: Bearer <token>.")
  public ResponseEntity<TranscriptResponse> getTranscript(
      @PathVariable String sessionId,
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
    try {
      gateway.authorize(SessionHandshakeInterceptor.bearerToken(headers(authorization)), sessionId);
    } catch (AuthenticationException e) {
      LOGGER.debug("Transcript read refused: {}", e.getMessage());
      return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
    } catch (SessionNotFoundException e) {
      return ResponseEntity.notFound().build();
    }

    Optional<TranscriptRecord> record = transcripts.findBySessionId(sessionId);
    if (record.isEmpty()) {
      TranscriptArchiver archive = archiver.getIfAvailable();
      if (archive != null) {
        record = archive.load(sessionId);
      }
    }
    return record
        .map(TranscriptResponse::from)
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.notFound().build());
  }

  private static HttpHeaders headers(String authorization) {
    HttpHeaders headers = new HttpHeaders();
    if (authorization != null) {
      headers.set(HttpHeaders.AUTHORIZATION, authorization);
    }
    return headers;
  }
}
