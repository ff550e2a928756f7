package com.quotaguard.backend.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class BulkUpdateRoleRequest {
    @NotEmpty
    private List<Long> principalIds;

    @NotBlank
    private String role;

    @Size(max = 1000)
    private String reason;
}
