package com.quotaguard.backend.controller;

import com.quotaguard.backend.dto.ApiError;
import com.quotaguard.backend.exception.RestrictedDeletionException;
import com.quotaguard.backend.exception.TransientStoreConflictException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("A refused purge names the archive step")
    void restrictedDeletionNamesArchiveStep() {
        ResponseEntity<ApiError> response = handler.handleRestrictedDeletion(new RestrictedDeletionException(7L, 3));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().getCode()).isEqualTo("RESTRICTED_DELETION");
        assertThat(response.getBody().getRequiredStep()).isEqualTo("archive-and-purge");
        assertThat(response.getBody().getMessage()).contains("3 audit entries");
    }

    @Test
    @DisplayName("An exhausted counter retry is a 503 the caller may retry")
    void transientConflictIsRetryable() {
        TransientStoreConflictException ex = new TransientStoreConflictException(7L, 3,
                new PessimisticLockingFailureException("lock timeout"));

        ResponseEntity<ApiError> response = handler.handleTransientConflict(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("1");
        assertThat(response.getBody().getRequiredStep()).isNull();
    }
}
