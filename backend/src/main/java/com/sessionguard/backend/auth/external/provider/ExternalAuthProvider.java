package com.sessionguard.backend.auth.external.provider;

import com.sessionguard.backend.global.Result;

/**
 * 외부 OAuth2 로그인 제공자
 *
 * 새 제공자는 이 인터페이스를 구현한 빈을 추가하는 것으로 끝난다. (레지스트리가 이름으로 찾는다)
 *
 * 실패 규약:
 * - 4xx 응답, 깨진 응답, 필수 클레임 누락: Result 실패 (PROVIDER_EXCHANGE_FAILED / NO_USABLE_EMAIL)
 * - 5xx 응답, 타임아웃, 연결 실패: ExternalProviderUnavailableException (재시도 없음)
 */
public interface ExternalAuthProvider {

    /** 레지스트리 키 (대소문자 무시로 조회) */
    String name();

    String displayName();

    /**
     * @param state    CSRF 방지용 불투명 값 (생성/검증은 호출자 책임)
     * @param nonce    없으면 null
     */
    String buildAuthorizationUrl(String state, String redirectUri, String nonce);

    /** redirectUri는 authorize 때와 글자 하나까지 같아야 한다. */
    Result<ExternalUserInfo> exchangeCode(String code, String redirectUri);
}
