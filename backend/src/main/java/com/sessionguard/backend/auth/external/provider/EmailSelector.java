package com.sessionguard.backend.auth.external.provider;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * 이메일 목록에서 로그인에 쓸 주소 하나 고르기
 *
 * 우선순위: primary+verified → primary → verified
 * 어느 것도 없으면 empty (호출자는 NO_USABLE_EMAIL)
 * 같은 순위 안에서는 목록 순서를 따른다.
 */
public final class EmailSelector {

    private EmailSelector() {}

    public static Optional<ProviderEmail> select(List<ProviderEmail> candidates) {
        if (candidates == null || candidates.isEmpty()) return Optional.empty();

        List<Predicate<ProviderEmail>> preference = List.of(
                e -> e.primary() && e.verified(),
                ProviderEmail::primary,
                ProviderEmail::verified
        );

        for (Predicate<ProviderEmail> p : preference) {
            Optional<ProviderEmail> hit = candidates.stream()
                    .filter(e -> e.email() != null && !e.email().isBlank())
                    .filter(p)
                    .findFirst();
            if (hit.isPresent()) return hit;
        }
        return Optional.empty();
    }

    public record ProviderEmail(String email, boolean primary, boolean verified) {}
}
