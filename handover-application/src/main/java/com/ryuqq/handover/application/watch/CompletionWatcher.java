package com.ryuqq.handover.application.watch;

import com.ryuqq.handover.application.scheduling.StepScheduler;
import com.ryuqq.handover.core.contract.StepEnvelope;
import com.ryuqq.handover.core.contract.StepName;
import com.ryuqq.handover.core.exception.JobQueryException;
import com.ryuqq.handover.core.model.CompletionWatch;
import com.ryuqq.handover.core.model.TaskId;
import com.ryuqq.handover.core.outcome.Finish;
import com.ryuqq.handover.core.outcome.Reschedule;
import com.ryuqq.handover.core.outcome.StepOutcome;
import com.ryuqq.handover.core.spi.CompletionReport;
import com.ryuqq.handover.core.spi.CompletionStatusSource;
import com.ryuqq.handover.core.spi.Notifier;
import com.ryuqq.handover.core.spi.StepHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 상태 URL이 완료를 보고할 때까지 감시한 뒤 수신자에게 결과를 보내는 WATCH_COMPLETION 핸들러.
 *
 * <p>상태 URL은 {@code status}, {@code subject}, {@code body}를 담은 JSON을 반환해야 합니다.
 * status가 submitted/running/incomplete이면 pollDelayMs 후 다시 확인하며 횟수 제한은 없습니다.</p>
 *
 * <p><strong>오류 처리:</strong></p>
 * <ul>
 *   <li>해석할 수 없는 응답: 재전달 없이 DLQ (재시도해도 같은 응답)</li>
 *   <li>조회/전송 실패: 전파하여 Runtime의 재전달에 맡김</li>
 * </ul>
 *
 * @author Handover Team
 * @since 1.0.0
 */
public class CompletionWatcher implements StepHandler {

    private static final Logger log = LoggerFactory.getLogger(CompletionWatcher.class);

    private final CompletionStatusSource statusSource;
    private final Notifier notifier;
    private final StepScheduler scheduler;
    private final long pollDelayMs;

    public CompletionWatcher(CompletionStatusSource statusSource, Notifier notifier, StepScheduler scheduler,
                             long pollDelayMs) {
        if (statusSource == null) {
            throw new IllegalArgumentException("statusSource cannot be null");
        }
        if (notifier == null) {
            throw new IllegalArgumentException("notifier cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        if (pollDelayMs < 0) {
            throw new IllegalArgumentException("pollDelayMs must be non-negative (current: " + pollDelayMs + ")");
        }
        this.statusSource = statusSource;
        this.notifier = notifier;
        this.scheduler = scheduler;
        this.pollDelayMs = pollDelayMs;
    }

    /**
     * 감시 시작.
     *
     * @param statusUrl 완료 여부를 보고하는 URL
     * @param recipient 결과 수신자
     * @return 감시 작업 식별자
     */
    public TaskId watch(String statusUrl, String recipient) {
        TaskId taskId = scheduler.enqueue(StepName.WATCH_COMPLETION, new CompletionWatch(statusUrl, recipient), 0);
        log.info("Watching {} for {} as {}", statusUrl, recipient, taskId);
        return taskId;
    }

    @Override
    public StepOutcome handle(StepEnvelope envelope) {
        CompletionWatch watch = envelope.payloadAs(CompletionWatch.class);

        CompletionReport report;
        try {
            report = statusSource.fetch(watch.statusUrl());
        } catch (JobQueryException e) {
            if (e.isMalformedResponse() && e.isRetryable()) {
                log.error("Invalid response from {}", watch.statusUrl(), e);
                throw new JobQueryException(JobQueryException.MALFORMED_RESPONSE, e.getMessage(), e, false);
            }
            throw e;
        }

        if (report.isPending()) {
            log.debug("{} is {}, checking again", watch.statusUrl(), report.state().wireValue());
            return Reschedule.after(pollDelayMs, "status " + report.state().wireValue());
        }

        notifier.notify(watch.recipient(), report.subject(), report.body());
        log.info("Sent completion of {} to {}", watch.statusUrl(), watch.recipient());
        return Finish.because("completion sent");
    }
}
