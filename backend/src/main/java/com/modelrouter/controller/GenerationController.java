package com.modelrouter.controller;

import com.modelrouter.exception.ErrorKind;
import com.modelrouter.model.dto.GenerationRequest;
import com.modelrouter.model.dto.GenerationResult;
import com.modelrouter.service.RequestGateway;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/generate")
@RequiredArgsConstructor
public class GenerationController {

    private final RequestGateway requestGateway;

    @PostMapping
    public Mono<ResponseEntity<GenerationResult>> generate(@Valid @RequestBody GenerationRequest request) {
        return requestGateway.handle(request)
                .map(result -> ResponseEntity.status(statusFor(result)).body(result));
    }

    @PostMapping("/batch")
    public Mono<ResponseEntity<List<GenerationResult>>> generateBatch(@RequestBody List<GenerationRequest> requests) {
        return requestGateway.handleBatch(requests)
                .map(ResponseEntity::ok);
    }

    static HttpStatus statusFor(GenerationResult result) {
        if (result.isSuccess()) {
            return HttpStatus.OK;
        }
        ErrorKind kind = result.getErrorKind();
        if (kind == ErrorKind.INVALID_TIER || kind == ErrorKind.INVALID_REQUEST) {
            return HttpStatus.BAD_REQUEST;
        }
        if (kind == ErrorKind.ALL_BACKENDS_UNAVAILABLE) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
