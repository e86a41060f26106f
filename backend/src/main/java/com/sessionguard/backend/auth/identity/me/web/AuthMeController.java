package com.sessionguard.backend.auth.identity.me.web;

import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.sessionguard.backend.auth.identity.me.dto.MeResponse;
import com.sessionguard.backend.auth.identity.me.service.MeService;
import com.sessionguard.backend.security.AuthPrincipal;

import lombok.RequiredArgsConstructor;

@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthMeController {

    private final MeService meService;

    // 계정 상태는 stamp가 바뀌면 곧바로 달라지므로 캐시하지 않는다.
    @GetMapping("/me")
    public ResponseEntity<MeResponse> me(@AuthenticationPrincipal AuthPrincipal principal) {
        MeResponse body = meService.me(principal).orElseThrow();
        return ResponseEntity.ok()
                .cacheControl(CacheControl.noStore())
                .body(body);
    }
}
