package com.example.jduel.handler;

import com.example.jduel.config.GameProperties;
import com.example.jduel.model.message.ClientMessage;
import com.example.jduel.model.message.ClientMessageType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MessageCodecTest {

    private final MessageCodec codec = new MessageCodec(new ObjectMapper(), GameProperties.defaults());

    private String rejection(String payload) {
        return assertThrows(MalformedMessageException.class, () -> codec.decode(payload)).getMessage();
    }

    @Test
    void decodesEveryCommand() throws Exception {
        assertEquals(ClientMessage.of(ClientMessageType.START_GAME), codec.decode("{\"type\":\"START_GAME\"}"));
        assertEquals(ClientMessage.of(ClientMessageType.PLAY_AGAIN), codec.decode("{\"type\":\"PLAY_AGAIN\"}"));
        assertEquals(ClientMessage.answer("Tokyo"), codec.decode("{\"type\":\"ANSWER\",\"answer\":\"Tokyo\"}"));
        assertEquals(ClientMessage.reaction(3), codec.decode("{\"type\":\"REACTION\",\"reactionId\":3}"));

        ClientMessage config = codec.decode("{\"type\":\"UPDATE_CONFIG\",\"config\":{\"difficulty\":\"nerd\"}}");
        assertEquals(ClientMessageType.UPDATE_CONFIG, config.type());
        assertEquals("nerd", config.config().difficulty());
        assertNull(config.config().multipleChoiceEnabled());
    }

    @Test
    void emptyAnswerIsStillAnAnswer() throws Exception {
        assertEquals("", codec.decode("{\"type\":\"ANSWER\",\"answer\":\"\"}").answer());
    }

    @Test
    void rejectsBrokenFrames() {
        assertEquals("Invalid JSON", rejection("{not json"));
        assertEquals("Message must be a JSON object", rejection("[1,2]"));
        assertEquals("Missing message type", rejection("{\"answer\":\"x\"}"));
        assertTrue(rejection("{\"type\":\"CHEAT\"}").startsWith("Unknown message type"));
    }

    @Test
    void rejectsBadPayloads() {
        assertNotNull(rejection("{\"type\":\"ANSWER\"}"));
        assertNotNull(rejection("{\"type\":\"ANSWER\",\"answer\":42}"));
        assertTrue(rejection("{\"type\":\"ANSWER\",\"answer\":\"" + "a".repeat(201) + "\"}").startsWith("Answer too long"));
        assertNotNull(rejection("{\"type\":\"UPDATE_CONFIG\"}"));
        assertNotNull(rejection("{\"type\":\"UPDATE_CONFIG\",\"config\":{\"multipleChoiceEnabled\":\"yes\"}}"));
        assertNotNull(rejection("{\"type\":\"REACTION\",\"reactionId\":\"1\"}"));
        assertNotNull(rejection("{\"type\":\"REACTION\",\"reactionId\":1.5}"));
    }

    @Test
    void unknownReactionIsRejected() {
        assertEquals("Unknown reaction: 99", rejection("{\"type\":\"REACTION\",\"reactionId\":99}"));
    }
}
