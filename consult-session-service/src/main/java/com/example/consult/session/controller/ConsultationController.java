package com.example.consult.session.controller;

import com.example.consult.session.dto.MeetingSessionResponse;
import com.example.consult.session.dto.SessionStatusResponse;
import com.example.consult.session.dto.TransitionResponse;
import com.example.consult.session.mapper.ConsultationMapper;
import com.example.consult.session.security.CallerIdentity;
import com.example.consult.session.security.CallerIdentityResolver;
import com.example.consult.session.security.SessionAccessGate;
import com.example.consult.session.service.ConsultationLifecycleService;
import com.example.consult.session.service.ConsultationStatusService;
import com.example.consult.shared.util.Constants.SessionOperation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/api/consultations")
@RequiredArgsConstructor
@Slf4j
public class ConsultationController {

    private final CallerIdentityResolver identityResolver;
    private final SessionAccessGate accessGate;
    private final ConsultationLifecycleService lifecycleService;
    private final ConsultationStatusService statusService;
    private final ConsultationMapper consultationMapper;
    private final Scheduler jdbcScheduler;

    @PostMapping("/appointments/{appointmentId}/session")
    public Mono<ResponseEntity<MeetingSessionResponse>> openSession(@PathVariable long appointmentId, ServerWebExchange exchange) {
        Optional<CallerIdentity> caller = identityResolver.resolve(exchange);
        return Mono.fromCallable(() -> lifecycleService.open(accessGate.authorizeAppointment(caller, appointmentId, SessionOperation.OPEN)))
                .subscribeOn(jdbcScheduler)
                .map(consultationMapper::toResponse)
                .map(ResponseEntity::ok);
    }

    @GetMapping
    public Mono<ResponseEntity<List<MeetingSessionResponse>>> mySessions(ServerWebExchange exchange) {
        Optional<CallerIdentity> caller = identityResolver.resolve(exchange);
        return Mono.fromCallable(() -> lifecycleService.mySessions(accessGate.requireIdentity(caller, SessionOperation.LIST)))
                .subscribeOn(jdbcScheduler)
                .map(consultationMapper::toResponses)
                .map(ResponseEntity::ok);
    }

    @PostMapping("/{roomId}/start")
    public Mono<ResponseEntity<TransitionResponse>> start(@PathVariable String roomId, ServerWebExchange exchange) {
        Optional<CallerIdentity> caller = identityResolver.resolve(exchange);
        log.info("Start request for room {}", roomId);
        return Mono.fromCallable(() -> lifecycleService.start(accessGate.authorize(caller, roomId, SessionOperation.START)))
                .subscribeOn(jdbcScheduler)
                .map(consultationMapper::toTransitionResponse)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/{roomId}/status")
    public Mono<ResponseEntity<SessionStatusResponse>> status(@PathVariable String roomId, ServerWebExchange exchange) {
        Optional<CallerIdentity> caller = identityResolver.resolve(exchange);
        return Mono.fromCallable(() -> statusService.getStatus(accessGate.authorize(caller, roomId, SessionOperation.STATUS)))
                .subscribeOn(jdbcScheduler)
                .map(ResponseEntity::ok);
    }

    @PostMapping("/{roomId}/end")
    public Mono<ResponseEntity<TransitionResponse>> end(@PathVariable String roomId, ServerWebExchange exchange) {
        Optional<CallerIdentity> caller = identityResolver.resolve(exchange);
        log.info("End request for room {}", roomId);
        return Mono.fromCallable(() -> lifecycleService.end(accessGate.authorize(caller, roomId, SessionOperation.END)))
                .subscribeOn(jdbcScheduler)
                .map(consultationMapper::toTransitionResponse)
                .map(ResponseEntity::ok);
    }

    @PostMapping("/{roomId}/cancel")
    public Mono<ResponseEntity<TransitionResponse>> cancel(@PathVariable String roomId, ServerWebExchange exchange) {
        Optional<CallerIdentity> caller = identityResolver.resolve(exchange);
        log.info("Cancel request for room {}", roomId);
        return Mono.fromCallable(() -> lifecycleService.cancel(accessGate.authorize(caller, roomId, SessionOperation.CANCEL)))
                .subscribeOn(jdbcScheduler)
                .map(consultationMapper::toTransitionResponse)
                .map(ResponseEntity::ok);
    }
}
