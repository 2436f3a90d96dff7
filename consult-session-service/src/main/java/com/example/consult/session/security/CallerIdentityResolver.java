package com.example.consult.session.security;

import com.example.consult.shared.config.AppProperties;
import com.example.consult.shared.util.Constants.ParticipantRole;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;

import java.util.Optional;

@Component
@RequiredArgsConstructor
public class CallerIdentityResolver {

    private final AppProperties appProperties;

    public Optional<CallerIdentity> resolve(ServerWebExchange exchange) {
        return resolve(exchange.getRequest().getHeaders());
    }

    public Optional<CallerIdentity> resolve(HttpHeaders headers) {
        String userId = headers.getFirst(appProperties.getIdentity().getUserIdHeader());
        String claimedRole = headers.getFirst(appProperties.getIdentity().getRoleHeader());
        if (userId == null || userId.isBlank() || claimedRole == null || claimedRole.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new CallerIdentity(userId.trim(), ParticipantRole.fromClaim(claimedRole), claimedRole.trim()));
    }
}
