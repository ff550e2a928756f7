package com.quotaguard.backend.dto;

import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class ScheduleDeletionRequest {
    @Size(max = 1000)
    private String reason;
}
