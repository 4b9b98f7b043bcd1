package com.phillippitts.docassist.service.capability.modelserver;

import com.phillippitts.docassist.exception.CapabilityInvocationException;
import com.phillippitts.docassist.exception.OperationCancelledException;
import com.phillippitts.docassist.service.admission.CancellationToken;
import com.phillippitts.docassist.service.capability.InferenceClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Client for a locally hosted model server exposing {@code /api/tags} and {@code /api/chat}.
 *
 * <p>Each installed model is one capability. Listing never throws: an unreachable server
 * simply has no capabilities. Completion failures are reported as
 * {@link CapabilityInvocationException} so the fallback executor can move on.
 */
public class ModelServerClient implements InferenceClient {

    private static final Logger LOG = LogManager.getLogger(ModelServerClient.class);
    private static final double TEMPERATURE = 0.2;

    private final HttpClient http;
    private final URI baseUri;
    private final Duration probeTimeout;

    public ModelServerClient(HttpClient http, String baseUrl, Duration probeTimeout) {
        this.http = Objects.requireNonNull(http, "http");
        String base = Objects.requireNonNull(baseUrl, "baseUrl");
        this.baseUri = URI.create(base.endsWith("/") ? base : base + "/");
        this.probeTimeout = Objects.requireNonNull(probeTimeout, "probeTimeout");
    }

    /**
     * Lists installed models.
     *
     * @return model names, or an empty list if the server is unreachable or errors
     */
    public List<String> listModels() {
        HttpRequest request = HttpRequest.newBuilder(baseUri.resolve("api/tags"))
                .timeout(probeTimeout)
                .GET()
                .build();
        try {
            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() != 200) {
                LOG.debug("Model server returned {} for tags", response.statusCode());
                return List.of();
            }
            return ModelServerJsonParser.parseModelNames(response.body());
        } catch (IOException e) {
            LOG.debug("Model server unreachable at {}: {}", baseUri, e.toString());
            return List.of();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return List.of();
        }
    }

    @Override
    public String complete(String capabilityId, String systemPrompt, String userPrompt, Duration timeout) {
        return complete(capabilityId, systemPrompt, userPrompt, timeout, new CancellationToken());
    }

    /**
     * Sends the chat request asynchronously and waits for it. Cancelling the token aborts the
     * in-flight request.
     */
    @Override
    public String complete(String capabilityId, String systemPrompt, String userPrompt, Duration timeout,
                           CancellationToken token) {
        String body = ModelServerJsonParser.buildChatRequest(capabilityId, systemPrompt, userPrompt, TEMPERATURE);
        HttpRequest request = HttpRequest.newBuilder(baseUri.resolve("api/chat"))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();
        long t0 = System.nanoTime();
        CompletableFuture<HttpResponse<String>> pending =
                http.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        token.onCancel(() -> {
            if (pending.cancel(true)) {
                LOG.debug("Aborted request to {}", capabilityId);
            }
        });
        try {
            HttpResponse<String> response = pending.get();
            if (response.statusCode() != 200) {
                throw new CapabilityInvocationException("model server returned " + response.statusCode(), capabilityId);
            }
            String content = ModelServerJsonParser.parseChatContent(response.body());
            LOG.debug("Completion from {} in {} ms (chars={})",
                    capabilityId, (System.nanoTime() - t0) / 1_000_000L, content.length());
            return content;
        } catch (CancellationException e) {
            throw new OperationCancelledException("Cancelled while waiting for " + capabilityId);
        } catch (ExecutionException e) {
            throw invocationFailure(capabilityId, timeout, e.getCause());
        } catch (IllegalArgumentException e) {
            throw new CapabilityInvocationException(e.getMessage(), capabilityId, e);
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Interrupted while waiting for " + capabilityId);
        }
    }

    private static CapabilityInvocationException invocationFailure(String capabilityId, Duration timeout,
                                                                   Throwable cause) {
        if (cause instanceof HttpTimeoutException) {
            return CapabilityInvocationException.timeout(capabilityId, timeout.toMillis(), cause);
        }
        if (cause instanceof IOException) {
            return new CapabilityInvocationException("request failed: " + cause.getMessage(), capabilityId, cause);
        }
        return new CapabilityInvocationException(String.valueOf(cause), capabilityId, cause);
    }
}
