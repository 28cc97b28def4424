package com.ryuqq.handover.application.watch;

import com.ryuqq.handover.application.scheduling.StepScheduler;
import com.ryuqq.handover.core.contract.StepEnvelope;
import com.ryuqq.handover.core.contract.StepName;
import com.ryuqq.handover.core.model.EmailMessage;
import com.ryuqq.handover.core.model.TaskId;
import com.ryuqq.handover.core.outcome.Finish;
import com.ryuqq.handover.core.outcome.StepOutcome;
import com.ryuqq.handover.core.spi.Notifier;
import com.ryuqq.handover.core.spi.StepHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 메일 한 통을 큐를 거쳐 보내는 SEND_EMAIL 핸들러.
 *
 * <p>전송 실패(NotificationException)는 전파되어 Runtime의 재전달 정책을 따릅니다.</p>
 *
 * @author Handover Team
 * @since 1.0.0
 */
public class EmailSender implements StepHandler {

    private static final Logger log = LoggerFactory.getLogger(EmailSender.class);

    private final Notifier notifier;
    private final StepScheduler scheduler;

    public EmailSender(Notifier notifier, StepScheduler scheduler) {
        if (notifier == null) {
            throw new IllegalArgumentException("notifier cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        this.notifier = notifier;
        this.scheduler = scheduler;
    }

    /**
     * 전송 예약.
     *
     * @return 전송 작업 식별자
     */
    public TaskId send(String recipient, String subject, String body) {
        TaskId taskId = scheduler.enqueue(StepName.SEND_EMAIL, new EmailMessage(recipient, subject, body), 0);
        log.debug("Queued '{}' for {} as {}", subject, recipient, taskId);
        return taskId;
    }

    @Override
    public StepOutcome handle(StepEnvelope envelope) {
        EmailMessage message = envelope.payloadAs(EmailMessage.class);
        notifier.notify(message.recipient(), message.subject(), message.body());
        log.info("Sent '{}' to {}", message.subject(), message.recipient());
        return Finish.because("email sent");
    }
}
