package com.z254.swarm.hive.api.v1;

import com.z254.swarm.hive.agent.AgentKindRegistry;
import com.z254.swarm.hive.api.dto.ErrorResponse;
import com.z254.swarm.hive.domain.HiveException;
import com.z254.swarm.hive.persistence.CheckpointService;
import com.z254.swarm.hive.registry.AgentRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Maps engine exceptions to HTTP responses.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(HiveException.class)
    public ResponseEntity<ErrorResponse> handleHiveException(HiveException e) {
        HttpStatus status = statusFor(e);
        log.debug("Request failed with {}: {}", status, e.getMessage());
        return error(status, e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleValidation(WebExchangeBindException e) {
        String message = e.getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return error(HttpStatus.BAD_REQUEST, message);
    }

    static HttpStatus statusFor(HiveException e) {
        if (e instanceof AgentRegistry.AgentNotFoundException
                || e instanceof CheckpointService.CheckpointNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (e instanceof AgentRegistry.DuplicateAgentException) {
            return HttpStatus.CONFLICT;
        }
        if (e instanceof AgentKindRegistry.UnknownAgentKindException) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        return HttpStatus.BAD_REQUEST;
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .body(new ErrorResponse(status.value(), status.getReasonPhrase(), message, Instant.now()));
    }
}
