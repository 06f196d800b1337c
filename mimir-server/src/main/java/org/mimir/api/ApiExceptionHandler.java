package org.mimir.api;

import org.mimir.error.AggregateResolutionFailedException;
import org.mimir.error.ArtifactNotFoundException;
import org.mimir.error.InvalidReferenceException;
import org.mimir.error.ResolutionException;
import org.mimir.error.VerificationFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

/**
 * Maps resolution failures to HTTP statuses: bad input 400, absent 404, digest mismatch 422,
 * anything else upstream 502.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidReferenceException.class)
    public ResponseEntity<ApiModels.ErrorResponse> invalidReference(InvalidReferenceException e) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_REFERENCE", e, null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiModels.ErrorResponse> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest()
                .body(new ApiModels.ErrorResponse("BAD_REQUEST", e.getMessage(), null, null, null));
    }

    @ExceptionHandler(ArtifactNotFoundException.class)
    public ResponseEntity<ApiModels.ErrorResponse> notFound(ArtifactNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", e, null);
    }

    @ExceptionHandler(VerificationFailedException.class)
    public ResponseEntity<ApiModels.ErrorResponse> verificationFailed(VerificationFailedException e) {
        logger.error("Digest verification failed: {}", e.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "VERIFICATION_FAILED", e, null);
    }

    @ExceptionHandler(AggregateResolutionFailedException.class)
    public ResponseEntity<ApiModels.ErrorResponse> aggregate(AggregateResolutionFailedException e) {
        if (e.isNotFound()) {
            return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", e, e);
        }
        logger.error("Resolution failed: {}", e.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, "ALL_TIERS_FAILED", e, e);
    }

    @ExceptionHandler(ResolutionException.class)
    public ResponseEntity<ApiModels.ErrorResponse> resolution(ResolutionException e) {
        logger.error("Resolution failed: {}", e.getMessage(), e);
        return respond(HttpStatus.BAD_GATEWAY, "RESOLUTION_FAILED", e, null);
    }

    private static ResponseEntity<ApiModels.ErrorResponse> respond(HttpStatus status, String code, ResolutionException e,
                                                                   AggregateResolutionFailedException aggregate) {
        List<ApiModels.TierFailureView> failures = aggregate == null ? null : aggregate.getFailures().stream()
                .map(f -> new ApiModels.TierFailureView(f.tier(), f.error().getMessage()))
                .toList();
        List<String> skipped = aggregate == null ? null : aggregate.getSkippedTiers();
        String ref = e.getReference() == null ? null : e.getReference().canonical();
        return ResponseEntity.status(status)
                .body(new ApiModels.ErrorResponse(code, e.getMessage(), ref, failures, skipped));
    }
}
