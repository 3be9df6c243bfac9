package com.ryuqq.drorchestrator.core.hash;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.SerializableString;
import com.fasterxml.jackson.core.io.CharacterEscapes;
import com.fasterxml.jackson.core.io.SerializedString;
import com.fasterxml.jackson.core.util.MinimalPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 기동 구성 해시 계산기.
 *
 * <p>구성을 키 정렬된 canonical JSON으로 직렬화한 뒤 SHA-256을 계산합니다.
 * 중첩 map과 list 안의 map도 재귀적으로 정렬하므로 삽입 순서와 무관합니다.</p>
 *
 * <p><strong>직렬화 형식:</strong> 기존에 저장된 해시와 비교할 수 있도록 다음 규칙을 따릅니다.</p>
 * <ul>
 *   <li>구분자는 {@code ", "}와 {@code ": "}</li>
 *   <li>비 ASCII 문자와 제어 문자는 소문자 16진수 네 자리 유니코드 escape로 표기 (BMP 밖 문자는 surrogate 쌍)</li>
 * </ul>
 * <p>실수 표기는 JVM 형식을 따르므로 지수 표기가 필요한 값은 다른 구현의 해시와 다를 수 있습니다.</p>
 *
 * <p><strong>출력 형식:</strong></p>
 * <ul>
 *   <li>null 또는 빈 구성: {@code "sha256:empty"}</li>
 *   <li>그 외: {@code "sha256:" + 64자리 소문자 hex}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ConfigHasher {

    public static final String EMPTY_HASH = "sha256:empty";
    private static final String PREFIX = "sha256:";

    private static final ObjectWriter CANONICAL_WRITER = new ObjectMapper()
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
        .writer(new SpacedSeparators())
        .with(new AsciiEscapes());

    // Utility class - prevent instantiation
    private ConfigHasher() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 구성 해시 계산.
     *
     * @param config 구성 (null 가능)
     * @return "sha256:..." 형식의 해시
     * @throws IllegalArgumentException 구성을 JSON으로 직렬화할 수 없는 경우
     */
    public static String hash(Map<String, ?> config) {
        if (config == null || config.isEmpty()) {
            return EMPTY_HASH;
        }
        return PREFIX + sha256Hex(canonicalJson(config));
    }

    /**
     * 키가 재귀적으로 정렬된 JSON 문자열.
     *
     * @param config 구성
     * @return canonical JSON
     */
    public static String canonicalJson(Map<String, ?> config) {
        try {
            return CANONICAL_WRITER.writeValueAsString(sortRecursively(config));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Config is not JSON-serializable: " + e.getOriginalMessage(), e);
        }
    }

    private static Object sortRecursively(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            map.forEach((key, nested) -> sorted.put(String.valueOf(key), sortRecursively(nested)));
            return sorted;
        }
        if (value instanceof List<?> list) {
            List<Object> sorted = new ArrayList<>(list.size());
            for (Object element : list) {
                sorted.add(sortRecursively(element));
            }
            return sorted;
        }
        return value;
    }

    private static String sha256Hex(String json) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(json.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * 한 줄 출력에 {@code ", "}와 {@code ": "} 구분자를 사용.
     */
    private static final class SpacedSeparators extends MinimalPrettyPrinter {

        private static final long serialVersionUID = 1L;

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(": ");
        }

        @Override
        public void writeObjectEntrySeparator(JsonGenerator g) throws IOException {
            g.writeRaw(", ");
        }

        @Override
        public void writeArrayValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(", ");
        }
    }

    /**
     * 비 ASCII 문자와 짧은 escape가 없는 제어 문자를 소문자 16진수로 escape.
     */
    private static final class AsciiEscapes extends CharacterEscapes {

        private static final long serialVersionUID = 1L;

        private final int[] asciiEscapes;

        AsciiEscapes() {
            int[] escapes = CharacterEscapes.standardAsciiEscapesForJSON();
            for (int ch = 0; ch < 0x20; ch++) {
                if (escapes[ch] == CharacterEscapes.ESCAPE_STANDARD) {
                    escapes[ch] = CharacterEscapes.ESCAPE_CUSTOM;
                }
            }
            this.asciiEscapes = escapes;
        }

        @Override
        public int[] getEscapeCodesForAscii() {
            return asciiEscapes;
        }

        @Override
        public SerializableString getEscapeSequence(int ch) {
            if (ch < 0x20 || ch > 0x7E) {
                return new SerializedString(String.format("\\u%04x", ch));
            }
            return null;
        }
    }
}
