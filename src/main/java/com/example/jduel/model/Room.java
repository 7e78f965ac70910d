package com.example.jduel.model;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Room aggregate: registered players and scores, host, config, question list and the current round.
 * Every read-modify-write happens on the room's mailbox, so this class itself does not add locking.
 */
public class Room {

    // ---------------------------------------------------------------------
    // Core identity
    // ---------------------------------------------------------------------

    private final String code;
    private final Instant createdAt;
    private final Executor mailbox;

    /** playerId → total score; insertion order is registration order. */
    private final Map<String, Integer> scores = new LinkedHashMap<>();

    /** playerId → session token (first writer wins). */
    private final Map<String, String> sessionTokens = new HashMap<>();

    /** First player ever registered. */
    private String hostId;

    // ---------------------------------------------------------------------
    // Game state
    // ---------------------------------------------------------------------

    private GameStatus status = GameStatus.WAITING;
    private final List<Question> questions = new ArrayList<>();
    private int questionIndex = 0;
    private RoomConfig config = RoomConfig.DEFAULT;
    private RoundState round = new RoundState();

    private Instant resultsStartedAt;
    private Instant finishedAt;
    private Instant lastActivityAt;

    /** playerId → time of the last relayed reaction. */
    private final Map<String, Instant> lastReactionAt = new HashMap<>();

    // ---------------------------------------------------------------------
    // Construction
    // ---------------------------------------------------------------------

    public Room(String code, Instant createdAt, Executor mailbox) {
        this.code = Objects.requireNonNull(code, "code");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.mailbox = Objects.requireNonNull(mailbox, "mailbox");
        this.lastActivityAt = createdAt;
    }

    /** Detached room (runs mailbox tasks inline); handy for projections in tests. */
    public Room(String code) {
        this(code, Instant.EPOCH, Runnable::run);
    }

    // ---------------------------------------------------------------------
    // Basic accessors
    // ---------------------------------------------------------------------

    public String getCode() { return code; }

    public Instant getCreatedAt() { return createdAt; }

    public Executor mailbox() { return mailbox; }

    public GameStatus getStatus() { return status; }

    /**
     * Only the orchestrator's transition path calls this; it cancels the room's timers first.
     * Moves outside the phase table are programming errors.
     */
    public void setStatus(GameStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transition " + status + " -> " + next + " in room " + code);
        }
        this.status = next;
    }

    public RoomConfig getConfig() { return config; }

    public void setConfig(RoomConfig config) {
        this.config = (config == null) ? RoomConfig.DEFAULT : config;
    }

    public String getHostId() { return hostId; }

    public boolean isHost(String playerId) {
        return hostId != null && hostId.equals(playerId);
    }

    public RoundState getRound() { return round; }

    public Instant getResultsStartedAt() { return resultsStartedAt; }

    public Instant getFinishedAt() { return finishedAt; }

    public Instant getLastActivityAt() { return lastActivityAt; }

    public void touch(Instant now) {
        if (now != null) this.lastActivityAt = now;
    }

    // ---------------------------------------------------------------------
    // Players
    // ---------------------------------------------------------------------

    public boolean hasPlayer(String playerId) {
        return playerId != null && scores.containsKey(playerId);
    }

    /** Registers a new player with score 0. The first one becomes host. */
    public boolean registerPlayer(String playerId) {
        if (playerId == null || playerId.isBlank() || scores.containsKey(playerId)) return false;
        scores.put(playerId, 0);
        if (hostId == null) hostId = playerId;
        return true;
    }

    /** Players in registration order. */
    public List<String> getPlayers() {
        return new ArrayList<>(scores.keySet());
    }

    public Map<String, Integer> getScores() {
        return Collections.unmodifiableMap(scores);
    }

    public int scoreOf(String playerId) {
        return scores.getOrDefault(playerId, 0);
    }

    public void addPoints(String playerId, int points) {
        if (!scores.containsKey(playerId)) return;
        scores.merge(playerId, points, Integer::sum);
    }

    public String getSessionToken(String playerId) {
        return sessionTokens.get(playerId);
    }

    /** Returns the player's token, minting one on first call. */
    public String issueSessionToken(String playerId, Supplier<String> minter) {
        String existing = sessionTokens.get(playerId);
        if (existing != null) return existing;
        String fresh = minter.get();
        String raced = sessionTokens.putIfAbsent(playerId, fresh);
        return raced != null ? raced : fresh;
    }

    // ---------------------------------------------------------------------
    // Questions
    // ---------------------------------------------------------------------

    public List<Question> getQuestions() {
        return Collections.unmodifiableList(questions);
    }

    public int getQuestionIndex() { return questionIndex; }

    public int getTotalQuestions() { return questions.size(); }

    /** Empty when the index ran past the list (e.g. after a reset race). */
    public Optional<Question> currentQuestion() {
        if (questionIndex < 0 || questionIndex >= questions.size()) return Optional.empty();
        return Optional.of(questions.get(questionIndex));
    }

    public boolean hasNextQuestion() {
        return questionIndex + 1 < questions.size();
    }

    // ---------------------------------------------------------------------
    // Phase mutations (status itself is written by the orchestrator)
    // ---------------------------------------------------------------------

    /** Loads a fresh question set, zeroes scores and opens the first round. */
    public void beginGame(List<Question> loaded, Instant now) {
        questions.clear();
        questions.addAll(loaded);
        questionIndex = 0;
        scores.replaceAll((k, v) -> 0);
        round = new RoundState(now);
        resultsStartedAt = null;
        finishedAt = null;
    }

    public void markResultsStarted(Instant now) {
        resultsStartedAt = now;
    }

    public void advanceQuestion(Instant now) {
        questionIndex++;
        round = new RoundState(now);
        resultsStartedAt = null;
    }

    public void markFinished(Instant now) {
        finishedAt = now;
        round = new RoundState();
    }

    /**
     * Lobby reset after a finished game: clears questions and round, zeroes scores and drops
     * every player not in {@code keep}. Returns the dropped players.
     */
    public List<String> resetForNewGame(Set<String> keep) {
        List<String> pruned = new ArrayList<>();
        Iterator<Map.Entry<String, Integer>> it = scores.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Integer> e = it.next();
            if (keep.contains(e.getKey())) {
                e.setValue(0);
            } else {
                pruned.add(e.getKey());
                it.remove();
            }
        }
        for (String p : pruned) {
            sessionTokens.remove(p);
        }
        questions.clear();
        questionIndex = 0;
        round = new RoundState();
        resultsStartedAt = null;
        finishedAt = null;
        lastReactionAt.clear();
        return pruned;
    }

    // ---------------------------------------------------------------------
    // Reactions
    // ---------------------------------------------------------------------

    /** True (and the cooldown restarts) if the player's last reaction is at least {@code cooldown} ago. */
    public boolean tryReact(String playerId, Instant now, Duration cooldown) {
        Instant last = lastReactionAt.get(playerId);
        if (last != null && Duration.between(last, now).compareTo(cooldown) < 0) return false;
        lastReactionAt.put(playerId, now);
        return true;
    }
}
