package com.example.sessionhub.hub.config;

import com.example.sessionhub.hub.websocket.SessionWebSocketHandler;
import com.example.sessionhub.shared.config.AppProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsWebFilter;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

@Configuration
@Slf4j
public class WebSocketConfig {

    @Bean
    public HandlerMapping webSocketHandlerMapping(SessionWebSocketHandler handler, AppProperties appProperties) {
        String path = appProperties.getWebsocket().getPath();
        log.info("Serving session WebSocket on {}", path);
        // Ahead of the annotated controllers
        return new SimpleUrlHandlerMapping(Map.of(path, handler), -1);
    }

    /**
     * Relays hop onto this scheduler so a publisher never runs socket work on its own thread.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler relayScheduler() {
        return Schedulers.newParallel("relay-");
    }

    @Bean
    public CorsWebFilter corsWebFilter(AppProperties appProperties) {
        CorsConfiguration config = new CorsConfiguration();
        config.setAllowedOriginPatterns(appProperties.getCors().getAllowedOrigins());
        config.setAllowedMethods(List.of("*"));
        config.setAllowedHeaders(List.of("*"));

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/api/**", config);
        return new CorsWebFilter(source);
    }
}
