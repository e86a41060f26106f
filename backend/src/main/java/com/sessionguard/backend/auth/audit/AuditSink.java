package com.sessionguard.backend.auth.audit;

/**
 * 보안 이벤트 기록 포트.
 *
 * 구현체는 절대 예외를 던지면 안 된다.
 * 기록 실패 때문에 로그인/로테이션 같은 주 흐름이 실패하면 안 되기 때문이다.
 *
 * @param userId 알 수 없으면 null
 * @param detail 자유 형식. 토큰 원문/비밀번호/코드는 넣지 않는다.
 */
public interface AuditSink {

    void record(AuditAction action, Long userId, String detail);

    default void record(AuditAction action, Long userId) {
        record(action, userId, null);
    }
}
