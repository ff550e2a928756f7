package com.quotaguard.backend.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class TierOverrideRequest {
    @NotBlank
    private String tier;

    @NotBlank
    private String reason;

    @Min(1)
    @Max(72)
    private Integer hours;
}
