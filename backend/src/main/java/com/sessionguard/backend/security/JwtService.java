package com.sessionguard.backend.security;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;

import javax.crypto.SecretKey;

import org.springframework.stereotype.Service;

import com.sessionguard.backend.auth.config.AuthProperties;
import com.sessionguard.backend.auth.domain.User;
import com.sessionguard.backend.auth.domain.UserRole;
import com.sessionguard.backend.auth.token.support.TokenHashUtils;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;

/**
 * Access Token(JWT) 발급/검증 서비스 (Token Codec)
 *
 * - HTTP(상태코드/응답)는 모른다. "유효/무효"만 판단한다.
 * - 검증 실패는 InvalidJwtException(런타임)으로 통일해서 던지고, 필터가 401 ApiError로 변환한다.
 * - 키/issuer/audience 설정이 잘못되면 생성자에서 IllegalStateException → 기동 실패.
 *
 * 클레임:
 * - iss / aud: 설정값 고정 (검증 시 require)
 * - sub: userId
 * - role: 인가용 역할
 * - {securityStampClaim}: sha256(발급 시점의 security stamp)
 * - iat / nbf: 발급 시각, exp: iat + accessTtlSeconds
 */
@Service
public class JwtService {

    private static final int MIN_SECRET_BYTES = 32;
    private static final String ROLE_CLAIM = "role";

    private final AuthProperties.Jwt jwtProps;
    private final Clock clock;
    private final SecretKey key;
    private final JwtParser parser;


    public JwtService(AuthProperties props, Clock clock) {
        this.jwtProps = props.jwt();
        this.clock = clock;

        // secret length 검증 + 키 생성
        this.key = buildHmacKey(jwtProps.secret());

        // issuer/audience 고정으로 타 서비스 토큰을 차단한다.
        this.parser = buildParser(jwtProps.issuer(), jwtProps.audience(), this.key, this.clock);
    }


    /** principal 기반 Access JWT 발급 */
    public String issueAccessToken(User user) {
        if (user == null || user.getId() == null) throw new IllegalArgumentException("user must be persisted");
        if (user.getRole() == null) throw new IllegalArgumentException("role must not be null");
        if (user.getSecurityStamp() == null) throw new IllegalArgumentException("securityStamp must not be null");

        Instant now = clock.instant();
        Instant exp = now.plusSeconds(jwtProps.accessTtlSeconds());

        return Jwts.builder()
                .setIssuer(jwtProps.issuer())                                   // iss
                .setAudience(jwtProps.audience())                               // aud
                .setSubject(String.valueOf(user.getId()))                       // sub
                .claim(ROLE_CLAIM, user.getRole().name())                       // role
                .claim(jwtProps.securityStampClaim(), stampHash(user.getSecurityStamp()))
                .setIssuedAt(Date.from(now))                                    // iat
                .setNotBefore(Date.from(now))                                   // nbf
                .setExpiration(Date.from(exp))                                  // exp
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    public long accessTtlSeconds() {
        return jwtProps.accessTtlSeconds();
    }

    /**
     * 토큰에 실리는 stamp 값. 원문 stamp는 토큰 밖으로 나가지 않는다.
     * 필터가 현재 stamp와 비교할 때도 같은 함수를 쓴다.
     */
    public static String stampHash(String securityStamp) {
        return TokenHashUtils.sha256Hex(securityStamp);
    }

    /**
     * Access Token 검증 후, AuthPrincipal 반환
     * - 서명/만료/nbf/issuer/audience 검증 + 필수 클레임 파싱
     * - security stamp 비교는 여기서 하지 않는다. (현재 값을 아는 필터의 책임)
     */
    public AuthPrincipal verifyAccessToken(String token) {
        try {
            if (token == null || token.isBlank()) {
                throw new JwtException("token is null or blank");
            }

            Jws<Claims> jws = parser.parseClaimsJws(token);
            Claims claims = jws.getBody();

            Long userId = parseUserId(claims.getSubject());
            UserRole role = parseRole(claims.get(ROLE_CLAIM, String.class));
            String stampHash = claims.get(jwtProps.securityStampClaim(), String.class);
            if (stampHash == null || stampHash.isBlank()) {
                throw new JwtException("security stamp claim missing");
            }

            return new AuthPrincipal(userId, role, stampHash);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidJwtException("Invalid JWT", e);
        }
    }


    private static SecretKey buildHmacKey(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("JWT secret must not be blank");
        }

        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("JWT secret must be at least " + MIN_SECRET_BYTES + " bytes for HS256");
        }

        return Keys.hmacShaKeyFor(bytes);
    }

    private static JwtParser buildParser(String issuer, String audience, SecretKey key, Clock clock) {
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalStateException("JWT issuer must not be blank");
        }
        if (audience == null || audience.isBlank()) {
            throw new IllegalStateException("JWT audience must not be blank");
        }

        return Jwts.parserBuilder()
                .requireIssuer(issuer)
                .requireAudience(audience)
                .setSigningKey(key)
                // JJWT는 Date 기반 clock을 쓰므로 여기서 bridge
                .setClock(() -> Date.from(clock.instant()))
                .build();
    }

    private static Long parseUserId(String sub) {
        if (sub == null || sub.isBlank()) {
            throw new JwtException("subject (userId) is missing");
        }
        try {
            return Long.valueOf(sub);
        } catch (NumberFormatException e) {
            throw new JwtException("subject is not a valid Long: " + sub, e);
        }
    }

    private static UserRole parseRole(String roleRaw) {
        if (roleRaw == null || roleRaw.isBlank()) {
            throw new JwtException("role claim missing");
        }
        try {
            return UserRole.valueOf(roleRaw);
        } catch (IllegalArgumentException e) {
            throw new JwtException("role claim invalid: " + roleRaw, e);
        }
    }

    /**
     * HTTP 레벨과 분리된 “JWT 검증 실패” 예외
     * - Filter에서 잡아서 401 ApiError로 변환한다.
     */
    public static class InvalidJwtException extends RuntimeException {
        public InvalidJwtException(String message, Throwable cause) {
            super(message, cause);
        }
    }

}
