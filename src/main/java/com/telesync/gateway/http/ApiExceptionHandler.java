package com.telesync.gateway.http;

import com.telesync.shared.error.ChallengeException;
import com.telesync.shared.error.ChannelNotFoundException;
import com.telesync.shared.error.CredentialException;
import com.telesync.shared.error.DuplicateChannelException;
import com.telesync.shared.error.IllegalTransitionException;
import com.telesync.shared.error.TaskNotFoundException;
import com.telesync.shared.error.TeleSyncException;
import com.telesync.shared.error.UpstreamFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(CredentialException.class)
    public ResponseEntity<ApiResponse> credential(CredentialException e) {
        log.warn("Credential error: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(ChallengeException.class)
    public ResponseEntity<ApiResponse> challenge(ChallengeException e) {
        return respond(HttpStatus.UNAUTHORIZED, e);
    }

    @ExceptionHandler({DuplicateChannelException.class, IllegalTransitionException.class})
    public ResponseEntity<ApiResponse> conflict(TeleSyncException e) {
        return respond(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler({ChannelNotFoundException.class, TaskNotFoundException.class})
    public ResponseEntity<ApiResponse> notFound(TeleSyncException e) {
        return respond(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(UpstreamFetchException.class)
    public ResponseEntity<ApiResponse> upstream(UpstreamFetchException e) {
        log.warn("Upstream call failed: {}", e.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, e);
    }

    @ExceptionHandler(TeleSyncException.class)
    public ResponseEntity<ApiResponse> other(TeleSyncException e) {
        log.error("Request failed: {}", e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class, MissingRequestHeaderException.class})
    public ResponseEntity<ApiResponse> badRequest(Exception e) {
        return ResponseEntity.badRequest().body(ApiResponse.error(e.getMessage(), "bad_request"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse> unexpected(Exception e) {
        log.error("Unhandled error", e);
        return ResponseEntity.internalServerError().body(ApiResponse.error("Internal server error", "internal_error"));
    }

    private static ResponseEntity<ApiResponse> respond(HttpStatus status, TeleSyncException e) {
        return ResponseEntity.status(status).body(ApiResponse.error(e.getMessage(), e.code()));
    }
}
