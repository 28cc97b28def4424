package com.ryuqq.handover.application.config;

import com.ryuqq.handover.core.classify.ValidationGroup;
import com.ryuqq.handover.core.classify.ValidationGroups;

import java.util.Properties;

/**
 * Handover Coordinator 설정 (불변 record).
 *
 * <p>생성 시점에 Coordinator에 주입되며, 전역 상태에서 읽지 않습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>stagingUri: 복사 대상 서버 URI (targetUri 생성에 사용, 보통 '/'로 끝남)</li>
 *   <li>pollDelayMs: 외부 작업 재확인 간격 (기본 60000ms)</li>
 *   <li>validation: 검증 러너 제출 설정</li>
 *   <li>copyWebUri: 복사 작업 결과 화면 URL prefix</li>
 *   <li>metadata: 메타데이터 갱신 제출 설정</li>
 * </ul>
 *
 * @param stagingUri staging 서버 URI
 * @param pollDelayMs 재확인 간격 (밀리초, 0 이상)
 * @param validation 검증 설정
 * @param copyWebUri 복사 결과 URL prefix
 * @param metadata 메타데이터 설정
 *
 * @author Handover Team
 * @since 1.0.0
 */
public record HandoverSettings(
    String stagingUri,
    long pollDelayMs,
    ValidationSettings validation,
    String copyWebUri,
    MetadataSettings metadata
) {

    public static final long DEFAULT_POLL_DELAY_MS = 60_000L;

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public HandoverSettings {
        if (stagingUri == null || stagingUri.isBlank()) {
            throw new IllegalArgumentException("stagingUri cannot be null or blank");
        }
        if (pollDelayMs < 0) {
            throw new IllegalArgumentException(
                "pollDelayMs must be non-negative (current: " + pollDelayMs + ")"
            );
        }
        if (validation == null) {
            throw new IllegalArgumentException("validation cannot be null");
        }
        if (copyWebUri == null || copyWebUri.isBlank()) {
            throw new IllegalArgumentException("copyWebUri cannot be null or blank");
        }
        if (metadata == null) {
            metadata = new MetadataSettings();
        }
    }

    /**
     * pollDelayMs만 변경한 새 인스턴스 생성.
     */
    public HandoverSettings withPollDelayMs(long pollDelayMs) {
        return new HandoverSettings(stagingUri, pollDelayMs, validation, copyWebUri, metadata);
    }

    /**
     * metadata만 변경한 새 인스턴스 생성.
     */
    public HandoverSettings withMetadata(MetadataSettings metadata) {
        return new HandoverSettings(stagingUri, pollDelayMs, validation, copyWebUri, metadata);
    }

    /**
     * Properties에서 설정 생성.
     *
     * <p><strong>키:</strong></p>
     * <pre>
     * handover.staging-uri                 (필수)
     * handover.poll-delay-ms               (기본 60000)
     * handover.copy.web-uri                (필수)
     * handover.validation.production-uri   (필수)
     * handover.validation.compara-uri      (필수)
     * handover.validation.live-uri         (필수)
     * handover.validation.data-files-path
     * handover.validation.web-uri          (필수)
     * handover.validation.group.core       (기본 CoreHandover)
     * handover.validation.group.variation  (기본 VariationHandover)
     * handover.validation.group.funcgen    (기본 FuncgenHandover)
     * handover.validation.group.compara    (기본 ComparaHandover)
     * handover.metadata.release
     * handover.metadata.division-release
     * handover.metadata.release-date
     * handover.metadata.current-release    (기본 true)
     * </pre>
     *
     * @param properties 설정 값
     * @return HandoverSettings
     * @throws IllegalArgumentException 필수 키가 없거나 값이 유효하지 않은 경우
     */
    public static HandoverSettings fromProperties(Properties properties) {
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }

        ValidationGroups defaults = new ValidationGroups();
        ValidationGroups groups = new ValidationGroups(
            ValidationGroup.of(properties.getProperty("handover.validation.group.core", defaults.core().getValue())),
            ValidationGroup.of(properties.getProperty("handover.validation.group.variation", defaults.variation().getValue())),
            ValidationGroup.of(properties.getProperty("handover.validation.group.funcgen", defaults.funcgen().getValue())),
            ValidationGroup.of(properties.getProperty("handover.validation.group.compara", defaults.compara().getValue()))
        );

        ValidationSettings validation = new ValidationSettings(
            required(properties, "handover.validation.production-uri"),
            required(properties, "handover.validation.compara-uri"),
            required(properties, "handover.validation.live-uri"),
            properties.getProperty("handover.validation.data-files-path"),
            required(properties, "handover.validation.web-uri"),
            groups
        );

        MetadataSettings metadata = new MetadataSettings(
            properties.getProperty("handover.metadata.release"),
            properties.getProperty("handover.metadata.division-release"),
            properties.getProperty("handover.metadata.release-date"),
            Boolean.parseBoolean(properties.getProperty("handover.metadata.current-release", "true"))
        );

        return new HandoverSettings(
            required(properties, "handover.staging-uri"),
            parseLong(properties, "handover.poll-delay-ms", DEFAULT_POLL_DELAY_MS),
            validation,
            required(properties, "handover.copy.web-uri"),
            metadata
        );
    }

    private static String required(Properties properties, String key) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required property: " + key);
        }
        return value.trim();
    }

    private static long parseLong(Properties properties, String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " must be a number (current: " + value + ")", e);
        }
    }
}
