package com.sessionguard.backend.auth.external.provider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 이름 → 제공자 조회 (대소문자 무시)
 *
 * 전역 싱글턴이 아니라 주입되는 빈이다. 테스트는 가짜 제공자로 새 레지스트리를 만들면 된다.
 * 활성화된 제공자만 들어온다.
 */
public class ExternalProviderRegistry {

    private final Map<String, ExternalAuthProvider> providers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final List<ExternalAuthProvider> ordered;

    public ExternalProviderRegistry(List<ExternalAuthProvider> providers) {
        for (ExternalAuthProvider p : providers) {
            if (this.providers.putIfAbsent(p.name(), p) != null) {
                throw new IllegalStateException("duplicate external provider name: " + p.name());
            }
        }
        this.ordered = Collections.unmodifiableList(new ArrayList<>(providers));
    }

    public Optional<ExternalAuthProvider> find(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        return Optional.ofNullable(providers.get(name.trim()));
    }

    public List<ExternalAuthProvider> all() {
        return ordered;
    }
}
