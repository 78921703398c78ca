package com.umitunal.cronlite.handler;

import com.sun.net.httpserver.HttpServer;
import com.umitunal.cronlite.core.IntervalFrequency;
import com.umitunal.cronlite.core.JobDefinition;
import com.umitunal.cronlite.core.JobType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class ApiCallHandlerTest {

    private static final JobDefinition JOB = JobDefinition.newBuilder("ping", JobType.API_CALL, IntervalFrequency.ofMinutes(1))
            .withId("api-1")
            .build();

    private HttpServer server;
    private URI baseUri;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/uuid", exchange -> respond(exchange, 200, "{\"uuid\": \"1234\"}"));
        server.createContext("/broken", exchange -> respond(exchange, 503, "unavailable"));
        server.start();
        baseUri = URI.create("http://127.0.0.1:" + server.getAddress().getPort());
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private static void respond(com.sun.net.httpserver.HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    @Test
    @DisplayName("Should report status and body of a successful call")
    void testSuccess() throws Exception {
        ApiCallHandler handler = new ApiCallHandler(baseUri.resolve("/uuid"), Duration.ofSeconds(5));

        HandlerResult result = handler.execute(JOB);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMessage()).isEqualTo("API call successful: HTTP 200 {\"uuid\": \"1234\"}");
    }

    @Test
    @DisplayName("Should fail on a non-2xx status")
    void testErrorStatus() {
        ApiCallHandler handler = new ApiCallHandler(baseUri.resolve("/broken"), Duration.ofSeconds(5));

        assertThatThrownBy(() -> handler.execute(JOB))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("HTTP 503");
    }
}
