package com.example.jduel.model.message;

/**
 * Decoded client command. Only the fields relevant to {@link #type()} are set.
 *
 * @param answer     ANSWER payload
 * @param config     UPDATE_CONFIG payload
 * @param reactionId REACTION payload
 */
public record ClientMessage(ClientMessageType type, String answer, ConfigPatch config, Integer reactionId) {

    /** Partial config update; null fields are left unchanged. */
    public record ConfigPatch(Boolean multipleChoiceEnabled, String difficulty) {
    }

    public static ClientMessage of(ClientMessageType type) {
        return new ClientMessage(type, null, null, null);
    }

    public static ClientMessage answer(String answer) {
        return new ClientMessage(ClientMessageType.ANSWER, answer, null, null);
    }

    public static ClientMessage updateConfig(ConfigPatch patch) {
        return new ClientMessage(ClientMessageType.UPDATE_CONFIG, null, patch, null);
    }

    public static ClientMessage reaction(int reactionId) {
        return new ClientMessage(ClientMessageType.REACTION, null, null, reactionId);
    }
}
