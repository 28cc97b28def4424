package com.ryuqq.handover.core.job;

/**
 * 외부 장기 실행 작업 서비스 클라이언트.
 *
 * <p>검증 러너, 복사 러너, 메타데이터 서비스마다 하나씩 구현됩니다.</p>
 *
 * <p><strong>오류 구분:</strong></p>
 * <ul>
 *   <li>전송 실패, 잘못된 응답 → 예외 ({@link com.ryuqq.handover.core.exception.JobSubmissionException},
 *       {@link com.ryuqq.handover.core.exception.JobQueryException})</li>
 *   <li>작업이 실행되어 실패 → 정상 반환된 {@link JobStatus}</li>
 * </ul>
 *
 * <p>구현체는 thread-safe해야 합니다.</p>
 *
 * @param <R> 서비스별 제출 파라미터 타입
 *
 * @author Handover Team
 * @since 1.0.0
 */
public interface JobClient<R> {

    /**
     * 작업 제출.
     *
     * <p>내부적으로 재시도하지 않습니다. 재시도 정책은 호출자가 결정합니다.</p>
     *
     * @param request 제출 파라미터
     * @return 서비스가 발급한 작업 ID
     * @throws com.ryuqq.handover.core.exception.JobSubmissionException 서비스에 연결할 수 없거나 요청이 거부된 경우
     */
    JobId submit(R request);

    /**
     * 작업 상태 조회 (부수 효과 없음).
     *
     * @param jobId 작업 ID
     * @return 현재 상태
     * @throws com.ryuqq.handover.core.exception.JobQueryException 전송 실패 또는 응답을 해석할 수 없는 경우
     */
    JobStatus retrieve(JobId jobId);
}
