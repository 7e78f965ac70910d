package com.example.jduel.handler;

import com.example.jduel.config.GameProperties;
import com.example.jduel.model.message.ClientMessage;
import com.example.jduel.model.message.ClientMessageType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * Decodes and validates client JSON frames ({@code {"type": "...", ...}}).
 */
@Component
public class MessageCodec {

    private final ObjectMapper objectMapper;
    private final GameProperties properties;

    public MessageCodec(ObjectMapper objectMapper, GameProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public ClientMessage decode(String payload) throws MalformedMessageException {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Invalid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedMessageException("Message must be a JSON object");
        }
        JsonNode typeNode = root.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            throw new MalformedMessageException("Missing message type");
        }
        ClientMessageType type = ClientMessageType.fromWire(typeNode.asText())
                .orElseThrow(() -> new MalformedMessageException("Unknown message type: " + typeNode.asText()));

        switch (type) {
            case ANSWER:
                return ClientMessage.answer(decodeAnswer(root));
            case UPDATE_CONFIG:
                return ClientMessage.updateConfig(decodeConfig(root));
            case REACTION:
                return ClientMessage.reaction(decodeReaction(root));
            default:
                return ClientMessage.of(type);
        }
    }

    private String decodeAnswer(JsonNode root) throws MalformedMessageException {
        JsonNode answer = root.get("answer");
        if (answer == null || !answer.isTextual()) {
            throw new MalformedMessageException("ANSWER requires a text 'answer'");
        }
        String text = answer.asText();
        if (text.length() > properties.maxAnswerLength()) {
            throw new MalformedMessageException("Answer too long (max " + properties.maxAnswerLength() + " characters)");
        }
        return text;
    }

    private ClientMessage.ConfigPatch decodeConfig(JsonNode root) throws MalformedMessageException {
        JsonNode config = root.get("config");
        if (config == null || !config.isObject()) {
            throw new MalformedMessageException("UPDATE_CONFIG requires a 'config' object");
        }
        Boolean multipleChoice = null;
        JsonNode mc = config.get("multipleChoiceEnabled");
        if (mc != null && !mc.isNull()) {
            if (!mc.isBoolean()) throw new MalformedMessageException("multipleChoiceEnabled must be a boolean");
            multipleChoice = mc.booleanValue();
        }
        String difficulty = null;
        JsonNode d = config.get("difficulty");
        if (d != null && !d.isNull()) {
            if (!d.isTextual()) throw new MalformedMessageException("difficulty must be a string");
            difficulty = d.asText();
        }
        return new ClientMessage.ConfigPatch(multipleChoice, difficulty);
    }

    private int decodeReaction(JsonNode root) throws MalformedMessageException {
        JsonNode id = root.get("reactionId");
        if (id == null || !id.canConvertToInt() || !id.isIntegralNumber()) {
            throw new MalformedMessageException("REACTION requires an integer 'reactionId'");
        }
        int reactionId = id.intValue();
        if (!properties.isKnownReaction(reactionId)) {
            throw new MalformedMessageException("Unknown reaction: " + reactionId);
        }
        return reactionId;
    }
}
