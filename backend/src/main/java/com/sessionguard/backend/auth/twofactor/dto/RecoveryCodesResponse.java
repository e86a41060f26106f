package com.sessionguard.backend.auth.twofactor.dto;

import java.util.List;

/** 원문은 이 응답에서 한 번만 보여준다. (DB에는 해시만) */
public record RecoveryCodesResponse(List<String> recoveryCodes) {}
