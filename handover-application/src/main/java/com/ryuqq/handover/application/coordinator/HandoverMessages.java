package com.ryuqq.handover.application.coordinator;

import com.ryuqq.handover.core.job.JobId;
import com.ryuqq.handover.core.model.DatabaseUri;

/**
 * 담당자 알림 제목과 본문.
 *
 * <p>본문의 데이터베이스 URI는 비밀번호를 가린 형태로 표시합니다.</p>
 *
 * @author Handover Team
 * @since 1.0.0
 */
final class HandoverMessages {

    static final String VALIDATION_SUBMITTED = "HC submitted";
    static final String VALIDATION_FAILED_TO_RUN = "HC failed to run";
    static final String VALIDATION_FOUND_FAILURES = "HC ran but failed";
    static final String COPY_FAILED = "Database copy failed";

    private HandoverMessages() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static String validationSubmitted(String sourceUri) {
        return masked(sourceUri) + " has been submitted for checking";
    }

    static String validationFailedToRun(String sourceUri, String webUri, JobId jobId) {
        return String.format("Running healthchecks vs %s failed to execute.%nPlease see %s%n",
            masked(sourceUri), link(webUri, jobId));
    }

    static String validationFoundFailures(String sourceUri, String webUri, JobId jobId) {
        return String.format("Running healthchecks vs %s completed but found failures.%nPlease see %s%n",
            masked(sourceUri), link(webUri, jobId));
    }

    static String copyFailed(String sourceUri, String targetUri, String webUri, JobId jobId) {
        return String.format("Copying %s to %s failed.%nPlease see %s%n",
            masked(sourceUri), masked(targetUri), link(webUri, jobId));
    }

    static String link(String webUri, JobId jobId) {
        return webUri + jobId.getValue();
    }

    static String masked(String uri) {
        return DatabaseUri.parse(uri).toString();
    }
}
