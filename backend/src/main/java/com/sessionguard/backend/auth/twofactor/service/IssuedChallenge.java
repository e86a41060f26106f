package com.sessionguard.backend.auth.twofactor.service;

import java.time.LocalDateTime;

/** 발급된 챌린지. challengeToken은 원문이며 다시 만들 수 없다. */
public record IssuedChallenge(String challengeToken, LocalDateTime expiresAt) {
    @Override
    public String toString() {
        return "IssuedChallenge[expiresAt=" + expiresAt + "]";
    }
}
