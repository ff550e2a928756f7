package com.quotaguard.backend.dto;

import lombok.Value;

@Value
public class PurgeResultDto {
    Long principalId;
    int archivedEntries;
}
