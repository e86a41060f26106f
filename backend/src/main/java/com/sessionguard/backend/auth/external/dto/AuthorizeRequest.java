package com.sessionguard.backend.auth.external.dto;

import jakarta.validation.constraints.NotBlank;

public record AuthorizeRequest(
        @NotBlank
        String redirectUri
) {}
