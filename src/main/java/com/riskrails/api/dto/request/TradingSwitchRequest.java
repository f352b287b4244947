package com.riskrails.api.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class TradingSwitchRequest {

    @NotNull(message = "enabled is required")
    private Boolean enabled;

    private String reason;
}
