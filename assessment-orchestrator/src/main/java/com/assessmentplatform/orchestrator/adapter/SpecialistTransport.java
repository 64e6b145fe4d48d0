package com.assessmentplatform.orchestrator.adapter;

import com.assessmentplatform.common.exception.SpecialistException;
import com.assessmentplatform.common.specialist.Specialist;
import com.assessmentplatform.common.trace.TraceContextUtil;
import com.assessmentplatform.orchestrator.adapter.dto.SpecialistRequest;
import com.assessmentplatform.orchestrator.adapter.dto.SpecialistResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Single request/response round trip to a decision service.
 *
 * <p>Wraps the payload in the agent envelope, posts it to the specialist's endpoint and
 * unwraps {@code data} into the expected response type. Every failure surfaces as a
 * {@link SpecialistException} error signal: non-2xx status, agent-reported error,
 * missing data, malformed JSON, connectivity loss and timeout. Nothing is retried here;
 * retry policy belongs to whoever drives the session.
 *
 * <p>The session id is read from the Reactor Context and sent as {@code X-Trace-Id}.
 */
@Component
public class SpecialistTransport {

    private static final Logger log = LoggerFactory.getLogger(SpecialistTransport.class);

    private final WebClient specialistClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration timeout;

    public SpecialistTransport(WebClient specialistClient,
                               ObjectMapper objectMapper,
                               Clock clock,
                               @Value("${services.specialists.timeout-ms:30000}") long timeoutMs) {
        this.specialistClient = specialistClient;
        this.objectMapper     = objectMapper;
        this.clock            = clock;
        this.timeout          = Duration.ofMillis(timeoutMs);
    }

    /**
     * @param requestType  operation name the specialist dispatches on
     * @param payloadKey   name of the payload entry inside {@code data}
     * @param responseType record the {@code data} node is bound to
     */
    public <T> Mono<T> call(Specialist specialist, String requestType, String payloadKey,
                            Object payload, Class<T> responseType) {
        return Mono.deferContextual(ctx -> {
            String sessionId = TraceContextUtil.getSessionId(ctx);
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("requestType", requestType);
            data.put(payloadKey, payload);
            SpecialistRequest request = new SpecialistRequest(
                specialist.id(), UUID.randomUUID().toString(), clock.instant(), data);

            log.debug("Specialist call. specialist={} requestType={} requestId={} sessionId={}",
                      specialist.id(), requestType, request.requestId(), sessionId);

            return specialistClient.post()
                .uri("/" + specialist.endpoint())
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Trace-Id", sessionId)
                .bodyValue(request)
                .retrieve()
                .onStatus(status -> !status.is2xxSuccessful(), response ->
                    Mono.error(new SpecialistException(specialist,
                        "HTTP error: " + response.statusCode().value())))
                .bodyToMono(String.class)
                .switchIfEmpty(Mono.error(new SpecialistException(specialist, "No response data received")))
                .map(body -> unwrap(specialist, body, responseType))
                .timeout(timeout)
                .onErrorMap(e -> !(e instanceof SpecialistException), e -> translate(specialist, e))
                .doOnNext(r -> log.debug("Specialist responded. specialist={} requestType={} sessionId={}",
                                         specialist.id(), requestType, sessionId))
                .doOnError(e -> log.warn("Specialist call failed. specialist={} requestType={} sessionId={} reason={}",
                                         specialist.id(), requestType, sessionId, e.getMessage()));
        });
    }

    <T> T unwrap(Specialist specialist, String body, Class<T> responseType) {
        SpecialistResponse envelope;
        try {
            envelope = objectMapper.readValue(body, SpecialistResponse.class);
        } catch (JsonProcessingException e) {
            throw new SpecialistException(specialist, "Malformed response: " + e.getOriginalMessage(), e);
        }
        if (envelope == null) {
            throw new SpecialistException(specialist, "No response data received");
        }
        if (envelope.error() != null) {
            throw new SpecialistException(specialist,
                "Agent error (" + envelope.error().code() + "): " + envelope.error().message());
        }
        JsonNode data = envelope.data();
        if (data == null || data.isNull() || data.isMissingNode()) {
            throw new SpecialistException(specialist, "No response data received");
        }
        try {
            return objectMapper.treeToValue(data, responseType);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SpecialistException(specialist, "Malformed response: " + e.getMessage(), e);
        }
    }

    private SpecialistException translate(Specialist specialist, Throwable e) {
        if (e instanceof TimeoutException) {
            return new SpecialistException(specialist, "Request timed out", e);
        }
        return new SpecialistException(specialist, "Network error: " + e.getMessage(), e);
    }
}
