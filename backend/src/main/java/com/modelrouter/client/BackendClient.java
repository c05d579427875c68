package com.modelrouter.client;

import com.modelrouter.model.routing.ModelBackend;
import reactor.core.publisher.Mono;

public interface BackendClient {

    /** Generates a completion for the prompt and emits the generated text. */
    Mono<String> generate(ModelBackend backend, String prompt);

    /** Completes when the backend answers a liveness check, errors otherwise. */
    Mono<Void> probe(ModelBackend backend);
}
