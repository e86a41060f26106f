package com.sessionguard.backend.auth.external.dto;

public record AuthorizeResponse(String authorizationUrl) {}
