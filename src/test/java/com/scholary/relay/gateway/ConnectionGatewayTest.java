package com.scholary.relay.gateway;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.relay.config.RelayProperties;
import com.scholary.relay.protocol.CloseCode;
import com.scholary.relay.protocol.MessageCodec;
import com.scholary.relay.protocol.RecordingConnection;
import com.scholary.relay.protocol.ServerMessage;
import com.scholary.relay.relay.RelayFactory;
import com.scholary.relay.relay.RelayRegistry;
import com.scholary.relay.relay.RelayState;
import com.scholary.relay.relay.StreamingRelay;
import com.scholary.relay.speech.ScriptedSpeechBackend;
import com.scholary.relay.speech.SpeechProperties;
import com.scholary.relay.speech.SpeechRecognitionBackend;
import com.scholary.relay.transcript.InMemoryTranscriptRepository;
import com.scholary.relay.transcript.TranscriptAccumulator;
import com.scholary.relay.transcript.TranscriptStatus;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

class ConnectionGatewayTest {

  private static final String TOKEN = "token-clinician-1";

  private final ExecutorService executor = Executors.newCachedThreadPool();
  private final InMemorySessionRepository sessions = new InMemorySessionRepository(100, 1);
  private final RelayRegistry registry = new RelayRegistry();
  private final RecordingConnection connection = new RecordingConnection();
  private final InMemoryTranscriptRepository transcripts = new InMemoryTranscriptRepository(100, 1);

  private RelayProperties relayProperties;

  @BeforeEach
  void setUp() {
    relayProperties =
        new RelayProperties(
            16,
            500,
            0,
            4,
            0,
            65536,
            8192,
            5000,
            524288,
            new RelayProperties.AuthProperties(
                Map.of(TOKEN, "clinician-1", "token-clinician-2", "clinician-2")),
            new RelayProperties.ArchiveProperties(false));
    sessions.save(new ConsultationSession("S1", "clinician-1", SessionStatus.ACTIVE));
    sessions.save(new ConsultationSession("S2", "clinician-1", SessionStatus.PAUSED));
    sessions.save(new ConsultationSession("S3", "clinician-1", SessionStatus.ENDED));
    sessions.save(new ConsultationSession("S4", "clinician-1", SessionStatus.CREATED));
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void admitsOwnerOfActiveSession() throws Exception {
    ConnectionGateway gateway = gateway(ScriptedSpeechBackend.respondingAfterInput());

    Optional<StreamingRelay> relay = gateway.open(connection, TOKEN, "S1");

    assertThat(relay).isPresent();
    assertThat(relay.get().state()).isEqualTo(RelayState.STREAMING);
    assertThat(relay.get().principalId()).isEqualTo("clinician-1");
    assertThat(connection.sent())
        .first()
        .isEqualTo(new ServerMessage.Connected("S1", "Transcription service ready"));
    assertThat(registry.find("S1")).contains(relay.get());

    relay.get().stop("test");
    relay.get().closedFuture().get(10, TimeUnit.SECONDS);
    assertThat(registry.activeCount()).isZero();
    assertThat(connection.closeCode()).isEqualTo(CloseCode.NORMAL);
  }

  @Test
  void admitsPausedSession() {
    ConnectionGateway gateway = gateway(ScriptedSpeechBackend.respondingAfterInput());

    Optional<StreamingRelay> relay = gateway.open(connection, TOKEN, "S2");

    assertThat(relay).isPresent();
    relay.get().stop("test");
  }

  @Test
  void invalidTokenIsRejectedWithPolicyViolation() {
    ConnectionGateway gateway = gateway(ScriptedSpeechBackend.respondingAfterInput());

    Optional<StreamingRelay> relay = gateway.open(connection, "forged", "S1");

    assertThat(relay).isEmpty();
    assertRejected();
    assertThat(registry.activeCount()).isZero();
  }

  @Test
  void missingTokenIsRejected() {
    ConnectionGateway gateway = gateway(ScriptedSpeechBackend.respondingAfterInput());

    assertThat(gateway.open(connection, null, "S1")).isEmpty();
    assertRejected();
  }

  @Test
  void sessionOwnedBySomeoneElseIsRejected() {
    ConnectionGateway gateway = gateway(ScriptedSpeechBackend.respondingAfterInput());

    assertThat(gateway.open(connection, "token-clinician-2", "S1")).isEmpty();
    assertRejected();
    assertThat(connection.sent(ServerMessage.Error.class).get(0).message())
        .isEqualTo("Session not found: S1");
  }

  @Test
  void unknownSessionIsRejected() {
    ConnectionGateway gateway = gateway(ScriptedSpeechBackend.respondingAfterInput());

    assertThat(gateway.open(connection, TOKEN, "missing")).isEmpty();
    assertRejected();
  }

  @Test
  void endedAndNotYetStartedSessionsAreRejected() {
    ConnectionGateway gateway = gateway(ScriptedSpeechBackend.respondingAfterInput());
    RecordingConnection second = new RecordingConnection();

    assertThat(gateway.open(connection, TOKEN, "S3")).isEmpty();
    assertThat(gateway.open(second, TOKEN, "S4")).isEmpty();

    assertRejected();
    assertThat(second.closeCode()).isEqualTo(CloseCode.POLICY_VIOLATION);
  }

  @Test
  void secondConnectionForStreamingSessionIsRejected() throws Exception {
    CountDownLatch gate = new CountDownLatch(1);
    ConnectionGateway gateway = gateway(ScriptedSpeechBackend.gatedBy(gate));
    StreamingRelay first = gateway.open(new RecordingConnection(), TOKEN, "S1").orElseThrow();

    assertThat(gateway.open(connection, TOKEN, "S1")).isEmpty();
    assertRejected();
    assertThat(registry.find("S1")).contains(first);

    first.stop("test");
    gate.countDown();
    first.closedFuture().get(10, TimeUnit.SECONDS);
    assertThat(registry.find("S1")).isEmpty();
  }

  @Test
  void clientLostBeforeAcknowledgementReleasesSessionAndPausesTranscript() {
    ScriptedSpeechBackend backend = ScriptedSpeechBackend.respondingAfterInput();
    ConnectionGateway gateway = gateway(backend);
    connection.drop();

    assertThat(gateway.open(connection, TOKEN, "S1")).isEmpty();

    assertThat(registry.find("S1")).isEmpty();
    assertThat(transcripts.findBySessionId("S1").orElseThrow().status())
        .isEqualTo(TranscriptStatus.PAUSED);
    assertThat(connection.closeCount()).isZero();
    assertThat(backend.calls()).isZero();

    RecordingConnection retry = new RecordingConnection();
    StreamingRelay relay = gateway.open(retry, TOKEN, "S1").orElseThrow();
    relay.stop("test");
  }

  @Test
  void authorizeResolvesOwnedSessionInAnyStatus() {
    ConnectionGateway gateway = gateway(ScriptedSpeechBackend.respondingAfterInput());

    assertThat(gateway.authorize(TOKEN, "S3").status()).isEqualTo(SessionStatus.ENDED);
    assertThatThrownBy(() -> gateway.authorize("token-clinician-2", "S3"))
        .isInstanceOf(SessionNotFoundException.class);
    assertThatThrownBy(() -> gateway.authorize("bad", "S3"))
        .isInstanceOf(AuthenticationException.class);
  }

  private void assertRejected() {
    List<ServerMessage> sent = connection.sent();
    assertThat(sent).hasSize(1).first().isInstanceOf(ServerMessage.Error.class);
    assertThat(connection.sent(ServerMessage.Connected.class)).isEmpty();
    assertThat(connection.closeCount()).isEqualTo(1);
    assertThat(connection.closeCode()).isEqualTo(CloseCode.POLICY_VIOLATION);
  }

  @SuppressWarnings("unchecked")
  private ConnectionGateway gateway(SpeechRecognitionBackend backend) {
    SpeechProperties speechProperties =
        new SpeechProperties(
            false, "p", "global", "_", "long", List.of("en-IN"), 16000, 1, true, true, null, 5);
    RelayFactory factory =
        new RelayFactory(
            relayProperties,
            speechProperties,
            backend,
            new TranscriptAccumulator(transcripts),
            transcripts,
            new MessageCodec(new ObjectMapper()),
            registry,
            mock(ObjectProvider.class));
    return new ConnectionGateway(
        new ConfiguredTokenVerifier(relayProperties), sessions, factory, registry, executor);
  }
}
