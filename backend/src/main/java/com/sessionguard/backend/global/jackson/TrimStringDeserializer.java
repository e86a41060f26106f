package com.sessionguard.backend.global.jackson;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

/**
 * 이메일/코드/토큰 같은 단일 값 필드용 역직렬화기.
 *
 * - 앞뒤 공백을 자른다. 잘랐더니 비어 있으면 null (@NotBlank에서 걸린다)
 * - 숫자로 온 코드(123456)는 문자열로 받아준다.
 * - 객체/배열은 파싱 실패로 돌린다.
 */
public class TrimStringDeserializer extends JsonDeserializer<String> {

    @Override
    public String deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonToken token = p.currentToken();
        if (token == null || !token.isScalarValue()) {
            return (String) ctxt.handleUnexpectedToken(String.class, p);
        }

        String v = p.getValueAsString();
        if (v == null) {
            return null;
        }
        String trimmed = v.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
