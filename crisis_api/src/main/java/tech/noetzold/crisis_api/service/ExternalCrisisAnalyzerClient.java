package tech.noetzold.crisis_api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import tech.noetzold.crisis_api.config.CrisisProperties;
import tech.noetzold.crisis_api.model.ExternalCrisisAssessment;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Optional remote text analyzer. Fails open: disabled, slow, or broken means
 * {@link Optional#empty()} and the local detectors decide alone.
 */
@Slf4j
@Component
public class ExternalCrisisAnalyzerClient {

    private final WebClient webClient;
    private final CrisisProperties props;

    public ExternalCrisisAnalyzerClient(@Qualifier("crisisAnalyzerWebClient") WebClient crisisAnalyzerWebClient,
                                        CrisisProperties props) {
        this.webClient = crisisAnalyzerWebClient;
        this.props = props;
    }

    public boolean enabled() {
        return props.getAnalyzer().isEnabled();
    }

    public Optional<Integer> crisisLevel(String sessionId, String message) {
        return assess(sessionId, message)
                .map(ExternalCrisisAssessment::crisisLevel)
                .map(level -> Math.max(0, Math.min(10, level)));
    }

    public Optional<ExternalCrisisAssessment> assess(String sessionId, String message) {
        if (!enabled() || message == null || message.isBlank()) {
            return Optional.empty();
        }
        try {
            return doAssess(buildPayload(sessionId, message));
        } catch (Exception e) {
            log.warn("Crisis analyzer exception for session {}: {}", sessionId, e.getMessage());
            return Optional.empty();
        }
    }

    private Map<String, Object> buildPayload(String sessionId, String message) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("request_id", "req_" + System.currentTimeMillis() + "_" + UUID.randomUUID().toString().substring(0, 8));
        payload.put("session_id", sessionId);
        payload.put("text", message);
        return payload;
    }

    private Optional<ExternalCrisisAssessment> doAssess(Map<String, Object> payload) {
        Duration timeout = props.getAnalyzer().getTimeout();
        return webClient.post()
                .uri("/crisis/analyze")
                .bodyValue(payload)
                .exchangeToMono(resp -> {
                    HttpStatusCode status = resp.statusCode();
                    if (status.is2xxSuccessful()) {
                        return resp.bodyToMono(ExternalCrisisAssessment.class)
                                .filter(a -> a.crisisLevel() != null)
                                .map(Optional::of)
                                .defaultIfEmpty(Optional.empty());
                    } else if (status.value() == HttpStatus.SERVICE_UNAVAILABLE.value()) {
                        log.warn("Crisis analyzer not ready (503)");
                        return Mono.just(Optional.<ExternalCrisisAssessment>empty());
                    } else if (status.value() == HttpStatus.BAD_REQUEST.value()) {
                        return resp.bodyToMono(String.class)
                                .doOnNext(body -> log.warn("Crisis analyzer rejected payload: {}", body))
                                .then(Mono.just(Optional.<ExternalCrisisAssessment>empty()));
                    } else {
                        log.warn("Crisis analyzer returned {}", status.value());
                        return resp.releaseBody().then(Mono.just(Optional.<ExternalCrisisAssessment>empty()));
                    }
                })
                .timeout(timeout)
                .onErrorResume(e -> {
                    log.warn("Crisis analyzer error: {}", e.toString());
                    return Mono.just(Optional.<ExternalCrisisAssessment>empty());
                })
                .blockOptional(timeout.plusMillis(250))
                .flatMap(o -> o);
    }
}
