package com.example.sessionhub.shared.util;

public final class Constants {

    private Constants() {}

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_KEY = "correlation_id";
    public static final String CONNECTION_ID_KEY = "connection_id";

    public static final String HEALTH_OK = "ok";
}
