package com.weblarek.backend.global.jackson;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.weblarek.backend.auth.identity.support.EmailNormalizer;

/**
 * 이메일 필드를 바인딩 시점에 정규화(trim + 소문자)한다.
 *
 * - "  Anna@Weblarek.RU " 로 와도 @Email 검증과 DB 조회가 같은 값을 보게 된다.
 * - null은 null 그대로 둔다. (필수 여부는 @NotBlank가 판단)
 */
public class NormalizedEmailDeserializer extends JsonDeserializer<String> {

    @Override
    public String deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        return EmailNormalizer.normalize(p.getValueAsString());
    }
}
