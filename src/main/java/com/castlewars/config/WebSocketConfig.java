package com.castlewars.config;

import com.castlewars.handler.GameWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Exposes the match channel and the read-only rules API. Everything else needs authentication.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {
    public static final String GAME_PATH = "/game";
    public static final String API_PATHS = "/api/**";

    private final GameWebSocketHandler handler;
    private final GameProperties properties;

    public WebSocketConfig(GameWebSocketHandler handler, GameProperties properties) {
        this.handler = handler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, GAME_PATH).setAllowedOrigins(properties.getAllowedOrigins());
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http.csrf(csrf -> csrf.disable())
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(GAME_PATH, API_PATHS).permitAll()
                        .anyRequest().authenticated());
        return http.build();
    }
}
