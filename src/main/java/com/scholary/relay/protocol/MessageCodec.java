package com.scholary.relay.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * Converts between wire JSON and the typed protocol messages.
 *
 * <p>Inbound text is validated here, at the connection boundary, so nothing past this point sees
 * untyped JSON.
 */
@Component
public class MessageCodec {

  private final ObjectMapper objectMapper;

  public MessageCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Parse a client text frame.
   *
   * @throws MalformedControlMessageException if the text is not JSON, has no string {@code type},
   *     or names an unknown control message
   */
  public ControlMessage parseControl(String text) {
    JsonNode node;
    try {
      node = objectMapper.readTree(text);
    } catch (JsonProcessingException e) {
      throw new MalformedControlMessageException("Control message is not valid JSON", e);
    }
    if (node == null || !node.isObject()) {
      throw new MalformedControlMessageException("Control message must be a JSON object");
    }
    JsonNode type = node.get("type");
    if (type == null || !type.isTextual()) {
      throw new MalformedControlMessageException("Control message has no string 'type' field");
    }
    ControlMessage message = ControlMessage.fromWireName(type.asText());
    if (message == null) {
      throw new MalformedControlMessageException("Unknown control message type: " + type.asText());
    }
    return message;
  }

  public String encode(ServerMessage message) {
    try {
      return objectMapper.writerFor(ServerMessage.class).writeValueAsString(message);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException(
          "Failed to serialize " + message.getClass().getSimpleName(), e);
    }
  }
}
