package com.scholary.relay.speech;

import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.ClientStream;
import com.google.api.gax.rpc.ResponseObserver;
import com.google.api.gax.rpc.StreamController;
import com.google.cloud.speech.v2.ExplicitDecodingConfig;
import com.google.cloud.speech.v2.RecognitionConfig;
import com.google.cloud.speech.v2.SpeechClient;
import com.google.cloud.speech.v2.SpeechRecognitionAlternative;
import com.google.cloud.speech.v2.StreamingRecognitionConfig;
import com.google.cloud.speech.v2.StreamingRecognitionFeatures;
import com.google.cloud.speech.v2.StreamingRecognitionResult;
import com.google.cloud.speech.v2.StreamingRecognizeRequest;
import com.google.cloud.speech.v2.StreamingRecognizeResponse;
import com.google.protobuf.ByteString;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Google Cloud Speech-to-Text v2 implementation of {@link SpeechRecognitionBackend}.
 *
 * <p>Uses the split-call form of the bidirectional stream: requests are sent from the calling
 * thread as they are pulled from the request sequence, responses arrive on the gRPC thread through
 * a {@link ResponseObserver}. The calling thread then waits for the response side to complete.
 *
 * <p>The {@link SpeechClient} is shared by every relay and owned by the Spring context; this class
 * never closes it.
 */
public class GoogleSpeechBackend implements SpeechRecognitionBackend {

  private static final Logger LOGGER = LoggerFactory.getLogger(GoogleSpeechBackend.class);

  private final SpeechClient speechClient;
  private final SpeechProperties properties;

  public GoogleSpeechBackend(SpeechClient speechClient, SpeechProperties properties) {
    this.speechClient = speechClient;
    this.properties = properties;
    LOGGER.info(
        "Initialized Google speech backend: recognizer={}, model={}, languages={}",
        properties.recognizerPath(),
        properties.model(),
        properties.languageCodes());
  }

  @Override
  public void streamingRecognize(
      Iterator<StreamingRequest> requests, RecognitionListener listener) {
    CompletableFuture<Void> done = new CompletableFuture<>();
    AtomicReference<StreamController> controller = new AtomicReference<>();
    RequestSide requestSide = new RequestSide();

    ResponseObserver<StreamingRecognizeResponse> observer =
        new ResponseObserver<>() {
          @Override
          public void onStart(StreamController streamController) {
            controller.set(streamController);
            LOGGER.debug("Recognition stream started");
          }

          @Override
          public void onResponse(StreamingRecognizeResponse response) {
            listener.onResponse(fromProto(response));
          }

          @Override
          public void onError(Throwable t) {
            UpstreamException failure = classify(t);
            if (done.completeExceptionally(failure) && requestSide.open) {
              listener.onTransportFailure(failure);
            }
          }

          @Override
          public void onComplete() {
            LOGGER.debug("Recognition stream completed by backend");
            if (done.complete(null) && requestSide.open) {
              listener.onRemoteClose();
            }
          }
        };

    ClientStream<StreamingRecognizeRequest> stream =
        speechClient.streamingRecognizeCallable().splitCall(observer);

    int sent = 0;
    try {
      while (!done.isDone() && requests.hasNext()) {
        stream.send(toProto(requests.next(), properties.recognizerPath()));
        sent++;
      }
    } finally {
      requestSide.open = false;
    }

    if (!done.isDone()) {
      stream.closeSend();
      LOGGER.debug("Closed request side after {} requests", sent);
    }

    try {
      done.get(properties.completionTimeoutSeconds(), TimeUnit.SECONDS);
    } catch (TimeoutException e) {
      cancel(controller.get());
      throw new UpstreamException(
          UpstreamException.Kind.DEADLINE_EXCEEDED,
          String.format(
              "Recognition did not complete within %ds after input ended",
              properties.completionTimeoutSeconds()),
          e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      cancel(controller.get());
      throw new UpstreamException(
          UpstreamException.Kind.TRANSPORT, "Interrupted while waiting for recognition", e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof UpstreamException upstream) {
        throw upstream;
      }
      throw classify(e.getCause());
    }
  }

  private static void cancel(StreamController controller) {
    if (controller != null) {
      controller.cancel();
    }
  }

  static StreamingRecognizeRequest toProto(StreamingRequest request, String recognizerPath) {
    if (request instanceof StreamingRequest.Audio audio) {
      return StreamingRecognizeRequest.newBuilder()
          .setAudio(ByteString.copyFrom(audio.content()))
          .build();
    }
    RecognitionSettings settings = ((StreamingRequest.Config) request).settings();

    RecognitionConfig recognitionConfig =
        RecognitionConfig.newBuilder()
            .setExplicitDecodingConfig(
                ExplicitDecodingConfig.newBuilder()
                    .setEncoding(ExplicitDecodingConfig.AudioEncoding.LINEAR16)
                    .setSampleRateHertz(settings.sampleRateHertz())
                    .setAudioChannelCount(settings.audioChannelCount()))
            .setModel(settings.model())
            .addAllLanguageCodes(settings.languageCodes())
            .build();

    StreamingRecognitionConfig streamingConfig =
        StreamingRecognitionConfig.newBuilder()
            .setConfig(recognitionConfig)
            .setStreamingFeatures(
                StreamingRecognitionFeatures.newBuilder()
                    .setInterimResults(settings.interimResults())
                    .setEnableVoiceActivityEvents(settings.voiceActivityEvents()))
            .build();

    return StreamingRecognizeRequest.newBuilder()
        .setRecognizer(recognizerPath)
        .setStreamingConfig(streamingConfig)
        .build();
  }

  static RecognitionResponse fromProto(StreamingRecognizeResponse response) {
    RecognitionResponse.SpeechEvent event =
        switch (response.getSpeechEventType()) {
          case SPEECH_ACTIVITY_BEGIN -> RecognitionResponse.SpeechEvent.ACTIVITY_BEGIN;
          case SPEECH_ACTIVITY_END -> RecognitionResponse.SpeechEvent.ACTIVITY_END;
          default -> RecognitionResponse.SpeechEvent.NONE;
        };

    List<RecognitionResponse.Result> results = new ArrayList<>(response.getResultsCount());
    for (StreamingRecognitionResult result : response.getResultsList()) {
      List<RecognitionResponse.Alternative> alternatives =
          new ArrayList<>(result.getAlternativesCount());
      for (SpeechRecognitionAlternative alternative : result.getAlternativesList()) {
        alternatives.add(
            new RecognitionResponse.Alternative(
                alternative.getTranscript(), toDouble(alternative.getConfidence())));
      }
      results.add(
          new RecognitionResponse.Result(
              alternatives, result.getIsFinal(), result.getLanguageCode()));
    }
    return new RecognitionResponse(event, results);
  }

  /** Widen without exposing float rounding noise, so 0.93f stays 0.93 on the wire. */
  private static double toDouble(float value) {
    return Double.parseDouble(Float.toString(value));
  }

  static UpstreamException classify(Throwable t) {
    if (t instanceof UpstreamException upstream) {
      return upstream;
    }
    if (!(t instanceof ApiException api)) {
      return new UpstreamException(
          UpstreamException.Kind.TRANSPORT, "Recognition transport failed: " + t.getMessage(), t);
    }
    UpstreamException.Kind kind =
        switch (api.getStatusCode().getCode()) {
          case RESOURCE_EXHAUSTED -> UpstreamException.Kind.QUOTA_EXCEEDED;
          case INVALID_ARGUMENT, FAILED_PRECONDITION, OUT_OF_RANGE ->
              UpstreamException.Kind.INVALID_ARGUMENT;
          case UNAVAILABLE -> UpstreamException.Kind.UNAVAILABLE;
          case DEADLINE_EXCEEDED -> UpstreamException.Kind.DEADLINE_EXCEEDED;
          case CANCELLED, ABORTED, INTERNAL, DATA_LOSS -> UpstreamException.Kind.TRANSPORT;
          default -> UpstreamException.Kind.UNKNOWN;
        };
    return new UpstreamException(
        kind,
        String.format(
            "Speech backend error (%s): %s", api.getStatusCode().getCode(), api.getMessage()),
        api);
  }

  /** Whether requests are still being pulled; read from the gRPC thread. */
  private static final class RequestSide {
    private volatile boolean open = true;
  }
}
