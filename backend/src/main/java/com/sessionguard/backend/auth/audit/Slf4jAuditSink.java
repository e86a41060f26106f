package com.sessionguard.backend.auth.audit;

import java.time.Clock;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

/**
 * "AUDIT" 로거로 한 줄씩 남기는 AuditSink.
 * - 로그 레벨/출력 대상은 logging.level.AUDIT 으로 분리해서 조정한다.
 */
@Component
@RequiredArgsConstructor
public class Slf4jAuditSink implements AuditSink {

    private static final Logger AUDIT = LoggerFactory.getLogger("AUDIT");

    private final Clock clock;

    @Override
    public void record(AuditAction action, Long userId, String detail) {
        try {
            Instant at = clock.instant();
            if (detail == null) {
                AUDIT.info("action={} userId={} at={}", action, userId, at);
            } else {
                AUDIT.info("action={} userId={} at={} detail={}", action, userId, at, detail);
            }
        } catch (RuntimeException e) {
            // 감사 기록 실패는 호출자에게 전파하지 않는다.
            LoggerFactory.getLogger(Slf4jAuditSink.class)
                    .warn("감사 로그 기록 실패: action={}, userId={}", action, userId, e);
        }
    }
}
