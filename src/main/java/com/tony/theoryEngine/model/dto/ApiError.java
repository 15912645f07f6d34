package com.tony.theoryEngine.model.dto;

import com.tony.theoryEngine.model.engine.ReasonCode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiError {
    private Instant timestamp;
    private String path;
    private int status;
    private ReasonCode reasonCode;
    private String message;
    private List<ApiErrorDetail> details;
}
