package com.example.jduel.controller;

import com.example.jduel.model.GameStatus;
import com.example.jduel.service.LobbyService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Lobby API: create a room, look it up, register a player before opening the game socket.
 */
@RestController
@RequestMapping("/api/rooms")
public class RoomController {

  private final LobbyService lobby;

  public RoomController(LobbyService lobby) {
    this.lobby = lobby;
  }

  // --- Create / Get --------------------------------------------------------

  @PostMapping
  public CreateRoomResponse create(HttpServletRequest request) {
    LobbyService.RoomSummary s = lobby.createRoom(clientKey(request));
    return new CreateRoomResponse(s.roomId(), s.status(), s.playerCount());
  }

  @GetMapping("/{roomId}")
  public RoomInfoResponse get(@PathVariable String roomId) {
    LobbyService.RoomSummary s = lobby.roomInfo(roomId);
    return new RoomInfoResponse(s.roomId(), s.status(), s.players(), s.playerCount());
  }

  // --- Join ----------------------------------------------------------------

  /**
   * Registers {@code playerId} in the room (or re-admits it after a disconnect) and hands out
   * the session token to present when attaching the socket.
   */
  @PostMapping("/{roomId}/join")
  public JoinRoomResponse join(@PathVariable String roomId,
                               @Valid @RequestBody JoinRoomRequest body,
                               HttpServletRequest request) {
    LobbyService.Registration r = lobby.register(roomId, body.playerId(), body.sessionToken(), clientKey(request));
    return new JoinRoomResponse(r.roomId(), r.playerId(), r.status(), r.sessionToken());
  }

  // first hop of X-Forwarded-For when running behind a proxy
  static String clientKey(HttpServletRequest request) {
    String fwd = request.getHeader("X-Forwarded-For");
    if (fwd != null && !fwd.isBlank()) {
      int comma = fwd.indexOf(',');
      return (comma > 0 ? fwd.substring(0, comma) : fwd).trim();
    }
    return request.getRemoteAddr();
  }

  // --- DTOs ----------------------------------------------------------------

  public record CreateRoomResponse(String roomId, GameStatus status, int playerCount) { }

  public record RoomInfoResponse(String roomId, GameStatus status, List<String> players, int playerCount) { }

  public record JoinRoomRequest(
      @NotBlank @Size(max = 20) String playerId,
      String sessionToken) { }

  public record JoinRoomResponse(String roomId, String playerId, GameStatus status, String sessionToken) { }
}
