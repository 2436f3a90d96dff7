package com.example.consult.session.controller;

import com.example.consult.session.dto.RelayStatsResponse;
import com.example.consult.session.dto.SignalDeliveryResponse;
import com.example.consult.session.dto.SignalRequest;
import com.example.consult.session.mapper.ConsultationMapper;
import com.example.consult.session.relay.SignalFrame;
import com.example.consult.session.relay.SignalingRelay;
import com.example.consult.session.security.CallerIdentity;
import com.example.consult.session.security.CallerIdentityResolver;
import com.example.consult.session.security.SessionAccessGate;
import com.example.consult.session.service.ConsultationLifecycleService;
import com.example.consult.shared.config.AppProperties;
import com.example.consult.shared.util.Constants.SessionOperation;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Relay endpoints: the admitted event stream (join), frame submission (signal) and explicit leave.
 */
@RestController
@RequestMapping("/api/consultations")
@RequiredArgsConstructor
@Slf4j
public class SignalingController {

    private final CallerIdentityResolver identityResolver;
    private final SessionAccessGate accessGate;
    private final ConsultationLifecycleService lifecycleService;
    private final SignalingRelay signalingRelay;
    private final ConsultationMapper consultationMapper;
    private final AppProperties appProperties;
    private final Scheduler jdbcScheduler;
    private final Clock clock;

    @PostMapping(value = "/{roomId}/join", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @RateLimiter(name = "consultJoinLimiter", fallbackMethod = "joinFallback")
    public Flux<ServerSentEvent<String>> join(
            @PathVariable String roomId,
            @RequestParam(required = false) String connectionId,
            ServerWebExchange exchange) {

        final String resolvedConnectionId = (connectionId == null || connectionId.isBlank())
                ? UUID.randomUUID().toString()
                : connectionId;
        Optional<CallerIdentity> caller = identityResolver.resolve(exchange);

        log.info("[JOIN_START] Relay join request for room='{}', connectionId='{}', IP='{}'",
                roomId, resolvedConnectionId,
                exchange.getRequest().getRemoteAddress() != null ? exchange.getRequest().getRemoteAddress().getAddress().getHostAddress() : "unknown");

        return Mono.fromCallable(() -> lifecycleService.join(accessGate.authorize(caller, roomId, SessionOperation.JOIN), resolvedConnectionId))
                .subscribeOn(jdbcScheduler)
                .flatMapMany(stream -> stream);
    }

    public Flux<ServerSentEvent<String>> joinFallback(String roomId, String connectionId, ServerWebExchange exchange, RequestNotPermitted ex) {
        log.warn("Join rate limit exceeded for room: {}. IP: {}. Details: {}",
            roomId,
            exchange.getRequest().getRemoteAddress(),
            ex.getMessage());
        return Flux.error(new ResponseStatusException(HttpStatus.TOO_MANY_REQUESTS, "Join rate limit exceeded. Please try again later."));
    }

    @PostMapping("/{roomId}/signal")
    public Mono<ResponseEntity<SignalDeliveryResponse>> signal(
            @PathVariable String roomId,
            @Valid @RequestBody SignalRequest request,
            ServerWebExchange exchange) {
        Optional<CallerIdentity> caller = identityResolver.resolve(exchange);
        SignalFrame frame = new SignalFrame(request.getType(), request.getPayload());
        return Mono.fromCallable(() -> signalingRelay.send(
                        accessGate.authorize(caller, roomId, SessionOperation.SIGNAL), request.getConnectionId(), frame))
                .subscribeOn(jdbcScheduler)
                .map(delivery -> ResponseEntity.status(HttpStatus.ACCEPTED).body(SignalDeliveryResponse.of(delivery)));
    }

    @PostMapping("/{roomId}/leave")
    public Mono<ResponseEntity<Map<String, Object>>> leave(
            @PathVariable String roomId,
            @RequestParam String connectionId,
            ServerWebExchange exchange) {
        Optional<CallerIdentity> caller = identityResolver.resolve(exchange);
        log.info("Leave request for room {}, connection {}", roomId, connectionId);
        return Mono.fromCallable(() -> signalingRelay.evict(accessGate.authorize(caller, roomId, SessionOperation.LEAVE), connectionId))
                .subscribeOn(jdbcScheduler)
                .map(left -> ResponseEntity.ok(Map.<String, Object>of("roomId", roomId, "left", left)));
    }

    @GetMapping("/relay/stats")
    public ResponseEntity<RelayStatsResponse> stats() {
        return ResponseEntity.ok(consultationMapper.toStatsResponse(
                signalingRelay.stats(), appProperties.getPodName(), OffsetDateTime.now(clock)));
    }
}
