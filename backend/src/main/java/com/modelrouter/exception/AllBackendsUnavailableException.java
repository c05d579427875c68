package com.modelrouter.exception;

import com.modelrouter.model.routing.DispatchAttempt;
import com.modelrouter.model.routing.RoutingDecision;
import lombok.Getter;

import java.util.List;

@Getter
public class AllBackendsUnavailableException extends RoutingException {

    private final List<DispatchAttempt> attempts;

    public AllBackendsUnavailableException(List<DispatchAttempt> attempts) {
        super(ErrorKind.ALL_BACKENDS_UNAVAILABLE,
                "No backend could serve the request after " + attempts.size() + " attempt(s)");
        this.attempts = List.copyOf(attempts);
    }

    public RoutingDecision toDecision() {
        return new RoutingDecision(null, null, attempts, getMessage());
    }
}
