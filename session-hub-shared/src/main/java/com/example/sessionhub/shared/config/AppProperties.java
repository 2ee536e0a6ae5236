package com.example.sessionhub.shared.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Data
@Validated
public class AppProperties {

    @NotBlank
    private String nodeName = "session-hub-0";

    private final Topic topic = new Topic();
    private final Websocket websocket = new Websocket();
    private final Reaper reaper = new Reaper();
    private final Cors cors = new Cors();

    @Data
    public static class Topic {
        /** Events buffered per subscriber before the oldest are dropped. */
        @Positive
        private int capacity = 256;
    }

    @Data
    public static class Websocket {
        @NotBlank
        private String path = "/ws";
    }

    @Data
    public static class Reaper {
        @Positive
        private long intervalMs = 60000L;
    }

    @Data
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    }
}
