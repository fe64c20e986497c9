package com.taskbot.dto;

import jakarta.validation.constraints.NotBlank;

public record SendTestRequest(
        @NotBlank String phoneNumber,
        String message
) {
}
