package com.example.jduel.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RoomTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void firstRegisteredPlayerIsHost_andOrderIsKept() {
        Room r = new Room("ABCD");
        assertTrue(r.registerPlayer("zoe"));
        assertTrue(r.registerPlayer("adam"));
        assertFalse(r.registerPlayer("zoe"), "duplicate names are refused");
        assertFalse(r.registerPlayer("  "));

        assertEquals("zoe", r.getHostId());
        assertEquals(List.of("zoe", "adam"), r.getPlayers());
        assertEquals(0, r.scoreOf("adam"));
    }

    @Test
    void sessionTokenIsMintedOnce() {
        Room r = new Room("ABCD");
        r.registerPlayer("zoe");

        String first = r.issueSessionToken("zoe", () -> "t-1");
        String second = r.issueSessionToken("zoe", () -> "t-2");

        assertEquals("t-1", first);
        assertEquals("t-1", second);
        assertEquals("t-1", r.getSessionToken("zoe"));
    }

    @Test
    void illegalTransitionThrows() {
        Room r = new Room("ABCD");
        assertThrows(IllegalStateException.class, () -> r.setStatus(GameStatus.RESULTS));
        r.setStatus(GameStatus.PLAYING);
        assertThrows(IllegalStateException.class, () -> r.setStatus(GameStatus.FINISHED));
        assertEquals(GameStatus.PLAYING, r.getStatus());
    }

    @Test
    void beginGameZeroesScoresAndOpensFirstRound() {
        Room r = new Room("ABCD");
        r.registerPlayer("zoe");
        r.addPoints("zoe", 700);
        r.addPoints("ghost", 100);

        r.beginGame(List.of(Question.of("q1", "c", "a"), Question.of("q2", "c", "b")), T0);

        assertEquals(0, r.scoreOf("zoe"));
        assertFalse(r.hasPlayer("ghost"));
        assertEquals("q1", r.currentQuestion().orElseThrow().text());
        assertTrue(r.hasNextQuestion());
        assertEquals(T0, r.getRound().getQuestionStartedAt());

        r.advanceQuestion(T0.plusSeconds(20));
        assertEquals("q2", r.currentQuestion().orElseThrow().text());
        assertFalse(r.hasNextQuestion());

        r.advanceQuestion(T0.plusSeconds(40));
        assertTrue(r.currentQuestion().isEmpty());
    }

    @Test
    void resetKeepsConnectedPlayersAndHost() {
        Room r = new Room("ABCD");
        r.registerPlayer("host");
        r.registerPlayer("bob");
        r.registerPlayer("carol");
        r.issueSessionToken("bob", () -> "tok-bob");
        r.beginGame(List.of(Question.of("q", "c", "a")), T0);
        r.addPoints("host", 1000);
        r.markFinished(T0);

        List<String> pruned = r.resetForNewGame(Set.of("host", "carol"));

        assertEquals(List.of("bob"), pruned);
        assertEquals(List.of("host", "carol"), r.getPlayers());
        assertEquals(0, r.scoreOf("host"));
        assertNull(r.getSessionToken("bob"));
        assertEquals(0, r.getTotalQuestions());
        assertNull(r.getFinishedAt());
        assertEquals("host", r.getHostId());
    }

    @Test
    void hostIsNeverReassigned() {
        Room r = new Room("ABCD");
        r.registerPlayer("host");
        r.registerPlayer("bob");

        r.resetForNewGame(Set.of("bob"));

        assertEquals("host", r.getHostId());
        assertFalse(r.hasPlayer("host"));
    }

    @Test
    void reactionCooldownPerPlayer() {
        Room r = new Room("ABCD");
        Duration cooldown = Duration.ofSeconds(3);

        assertTrue(r.tryReact("zoe", T0, cooldown));
        assertFalse(r.tryReact("zoe", T0.plusMillis(2_999), cooldown));
        assertTrue(r.tryReact("adam", T0.plusMillis(100), cooldown));
        assertTrue(r.tryReact("zoe", T0.plusSeconds(3), cooldown));
    }

    @Test
    void roundKeepsFirstAnswerOnly() {
        RoundState round = new RoundState(T0);
        assertTrue(round.recordAnswer("zoe", "Tokyo"));
        assertFalse(round.recordAnswer("zoe", "Kyoto"));
        assertEquals("Tokyo", round.getAnswers().get("zoe"));

        assertEquals(1, round.nextCorrectRank());
        assertEquals(2, round.nextCorrectRank());
        assertEquals(2, round.getCorrectCount());
    }
}
