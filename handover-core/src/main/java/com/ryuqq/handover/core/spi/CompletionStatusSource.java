package com.ryuqq.handover.core.spi;

/**
 * 완료 보고서를 제공하는 상태 URL 조회.
 *
 * @author Handover Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CompletionStatusSource {

    /**
     * @param statusUrl 상태 URL
     * @return 현재 보고서
     * @throws com.ryuqq.handover.core.exception.JobQueryException 전송 실패 또는 응답 형식 오류
     */
    CompletionReport fetch(String statusUrl);
}
