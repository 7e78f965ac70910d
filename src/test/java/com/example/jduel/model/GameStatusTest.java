package com.example.jduel.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GameStatusTest {

    @Test
    void phaseTable() {
        assertTrue(GameStatus.WAITING.canTransitionTo(GameStatus.PLAYING));
        assertTrue(GameStatus.PLAYING.canTransitionTo(GameStatus.RESULTS));
        assertTrue(GameStatus.RESULTS.canTransitionTo(GameStatus.PLAYING));
        assertTrue(GameStatus.RESULTS.canTransitionTo(GameStatus.FINISHED));
        assertTrue(GameStatus.FINISHED.canTransitionTo(GameStatus.WAITING));

        assertFalse(GameStatus.WAITING.canTransitionTo(GameStatus.RESULTS));
        assertFalse(GameStatus.PLAYING.canTransitionTo(GameStatus.WAITING));
        assertFalse(GameStatus.PLAYING.canTransitionTo(GameStatus.PLAYING));
        assertFalse(GameStatus.FINISHED.canTransitionTo(GameStatus.PLAYING));
        assertFalse(GameStatus.WAITING.canTransitionTo(null));
    }

    @Test
    void wireNamesAreLowerCase() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        assertEquals("\"results\"", mapper.writeValueAsString(GameStatus.RESULTS));
        assertEquals("\"beast\"", mapper.writeValueAsString(Difficulty.BEAST));
    }

    @Test
    void difficultyRanges() {
        assertTrue(Difficulty.ENJOYER.accepts(2));
        assertFalse(Difficulty.ENJOYER.accepts(3));
        assertTrue(Difficulty.NERD.accepts(4));
        assertTrue(Difficulty.BEAST.accepts(4));
        assertFalse(Difficulty.BEAST.accepts(3));

        assertEquals(Difficulty.NERD, Difficulty.fromId(" Nerd ").orElseThrow());
        assertTrue(Difficulty.fromId("insane").isEmpty());
        assertTrue(Difficulty.fromId(null).isEmpty());
    }
}
