package com.example.acl.exception;

import com.example.acl.common.util.StringSanitizer;
import com.example.acl.security.exception.AuthenticationException;
import com.example.acl.security.exception.AuthorizationException;
import com.example.acl.security.exception.ReservedPredicateException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.web.WebProperties;
import org.springframework.boot.autoconfigure.web.reactive.error.AbstractErrorWebExceptionHandler;
import org.springframework.boot.web.error.ErrorAttributeOptions;
import org.springframework.boot.web.reactive.error.ErrorAttributes;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.server.RequestPredicates;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Component
@Order(-2)  // Higher priority than DefaultErrorWebExceptionHandler
public class GlobalErrorWebExceptionHandler extends AbstractErrorWebExceptionHandler {

    public GlobalErrorWebExceptionHandler(
            ErrorAttributes errorAttributes,
            WebProperties webProperties,
            ApplicationContext applicationContext,
            ServerCodecConfigurer serverCodecConfigurer) {
        super(errorAttributes, webProperties.getResources(), applicationContext);
        this.setMessageWriters(serverCodecConfigurer.getWriters());
    }

    @Override
    protected RouterFunction<ServerResponse> getRoutingFunction(ErrorAttributes errorAttributes) {
        return RouterFunctions.route(RequestPredicates.all(), this::renderErrorResponse);
    }

    private Mono<ServerResponse> renderErrorResponse(ServerRequest request) {
        Throwable error = getError(request);
        String path = request.path();

        // ACL messages carry their error kind and are safe to return verbatim.
        if (error instanceof AuthenticationException) {
            log.warn("Authentication failed: path={}, error={}", path, StringSanitizer.forLog(error.getMessage(), 200));
            return createErrorResponse(HttpStatus.UNAUTHORIZED, "authentication_error", error.getMessage(), path);
        }

        if (error instanceof AuthorizationException denied) {
            log.warn("Authorization denied: path={}, user={}, predicate={}",
                    path, StringSanitizer.forLog(denied.getUserId()), StringSanitizer.forLog(denied.getPredicate()));
            return createErrorResponse(HttpStatus.FORBIDDEN, "authorization_error", error.getMessage(), path);
        }

        if (error instanceof ReservedPredicateException reserved) {
            log.warn("Reserved predicate violation: path={}, predicate={}",
                    path, StringSanitizer.forLog(reserved.getPredicate()));
            return createErrorResponse(HttpStatus.BAD_REQUEST, "reserved_predicate", error.getMessage(), path);
        }

        // Validation errors -> 400
        if (error instanceof WebExchangeBindException bindException) {
            String fieldErrors = bindException.getFieldErrors().stream()
                    .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                    .collect(Collectors.joining(", "));

            log.warn("Validation failed: path={}, errors={}", path, fieldErrors);

            return createErrorResponse(HttpStatus.BAD_REQUEST, "validation_error",
                    "Validation failed: " + fieldErrors, path);
        }

        // Unreadable bodies -> 400
        if (error instanceof ServerWebInputException || error instanceof DecodingException) {
            log.warn("Malformed request: path={}, error={}", path, StringSanitizer.forLog(error.getMessage(), 200));
            return createErrorResponse(HttpStatus.BAD_REQUEST, "invalid_request", "Malformed request body", path);
        }

        // ResponseStatusException -> use its status
        if (error instanceof ResponseStatusException statusException) {
            HttpStatus status = HttpStatus.resolve(statusException.getStatusCode().value());
            if (status == null) {
                status = HttpStatus.INTERNAL_SERVER_ERROR;
            }

            log.warn("Response status exception: path={}, status={}, reason={}",
                    path, status, statusException.getReason());

            return createErrorResponse(status, "request_error",
                    statusException.getReason() != null ? statusException.getReason() : status.getReasonPhrase(),
                    path);
        }

        // Parser and model validation failures -> 400 with their message
        if (error instanceof IllegalArgumentException) {
            log.warn("Invalid argument: path={}, error={}", path, StringSanitizer.forLog(error.getMessage(), 200));
            return createErrorResponse(HttpStatus.BAD_REQUEST, "invalid_argument", error.getMessage(), path);
        }

        // Duplicate users or groups -> 409
        if (error instanceof IllegalStateException) {
            log.warn("Conflict: path={}, error={}", path, StringSanitizer.forLog(error.getMessage(), 200));
            return createErrorResponse(HttpStatus.CONFLICT, "conflict", error.getMessage(), path);
        }

        // Default error handling -> 500
        Map<String, Object> errorAttributes = getErrorAttributes(request, ErrorAttributeOptions.defaults());
        int status = (int) errorAttributes.getOrDefault("status", 500);

        log.error("Unhandled error: path={}, status={}, error={}",
                path, status, error.getMessage(), error);

        return createErrorResponse(
                HttpStatus.valueOf(status),
                "server_error",
                "An unexpected error occurred",
                path
        );
    }

    private Mono<ServerResponse> createErrorResponse(HttpStatus status, String error, String message, String path) {
        ErrorResponse body = ErrorResponse.of(status.value(), error, message, path);

        return ServerResponse.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(BodyInserters.fromValue(body));
    }
}
