package com.example.consult.session;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import reactor.core.publisher.Hooks;

/**
 * Video consultation session service.
 * <p>
 * Governs who may start, join and end the call of an appointment, relays WebRTC signaling between
 * the appointment's doctor and patient over server-sent events, and force-ends rooms abandoned by
 * the patient.
 */
@SpringBootApplication(scanBasePackages = "com.example.consult")
@EnableAsync
public class ConsultSessionApplication {

    static {
        // Carries the MDC correlation id across Reactor scheduler threads.
        Hooks.enableAutomaticContextPropagation();
    }

    public static void main(String[] args) {
        SpringApplication.run(ConsultSessionApplication.class, args);
    }
}
