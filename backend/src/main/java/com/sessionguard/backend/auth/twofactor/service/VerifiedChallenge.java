package com.sessionguard.backend.auth.twofactor.service;

/** 소비된 챌린지에서 토큰 발급으로 넘기는 값 */
public record VerifiedChallenge(Long userId, boolean rememberMe) {}
