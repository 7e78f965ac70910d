package com.example.jduel.config;

import com.example.jduel.handler.GameWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import java.util.*;
import java.util.stream.Collectors;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

  private final GameWebSocketHandler handler;
  private final List<String> originPatterns;
  private final String wsPath;

  public WebSocketConfig(
      GameWebSocketHandler handler,
      // path the game client connects to
      @Value("${app.websocket.path:/ws}") String wsPath,
      // CSV list, expanded to origin patterns
      @Value("${app.websocket.allowed-origins:http://localhost:5173,http://localhost:8080}") String originsCsv
  ) {
    this.handler = handler;
    this.wsPath = wsPath;

    List<String> list = Arrays.stream(originsCsv.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .flatMap(s -> expandToPatterns(s).stream())
        .distinct()
        .collect(Collectors.toList());

    this.originPatterns = list.isEmpty() ? Collections.singletonList("*") : list;
  }

  // localhost origins are widened to any port
  static List<String> expandToPatterns(String origin) {
    List<String> out = new ArrayList<>();
    if ("*".equals(origin)) { out.add("*"); return out; }
    out.add(origin);
    if (origin.startsWith("http://localhost")) {
      out.add("http://localhost:*");
      out.add("http://127.0.0.1:*");
    }
    return out;
  }

  List<String> getOriginPatterns() {
    return originPatterns;
  }

  @Override
  public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
    registry.addHandler(handler, wsPath)
            .setAllowedOriginPatterns(originPatterns.toArray(String[]::new));
  }
}
