package com.umitunal.cronlite.handler;

import com.umitunal.cronlite.core.JobDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Performs an HTTP GET and fails on any non-2xx status.
 */
public class ApiCallHandler implements JobHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiCallHandler.class);
    private static final int MAX_BODY_IN_MESSAGE = 200;

    private final HttpClient client;
    private final URI url;
    private final Duration timeout;

    public ApiCallHandler(URI url, Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), url, timeout);
    }

    public ApiCallHandler(HttpClient client, URI url, Duration timeout) {
        this.client = client;
        this.url = url;
        this.timeout = timeout;
    }

    @Override
    public HandlerResult execute(JobDefinition job) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(url)
                .timeout(timeout)
                .GET()
                .build();

        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            log.warn("API call failed for scheduler {}: HTTP {}", job.getId(), status);
            throw new IOException("HTTP " + status + " from " + url);
        }

        String body = response.body() == null ? "" : response.body().trim();
        if (body.length() > MAX_BODY_IN_MESSAGE) {
            body = body.substring(0, MAX_BODY_IN_MESSAGE) + "...";
        }
        log.info("API call successful for scheduler {}: {}", job.getId(), body);
        return HandlerResult.success("API call successful: HTTP " + status + " " + body);
    }
}
