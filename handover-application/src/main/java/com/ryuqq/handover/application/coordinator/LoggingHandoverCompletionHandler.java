package com.ryuqq.handover.application.coordinator;

import com.ryuqq.handover.core.model.HandoverRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 완료를 로그로만 남기는 기본 HandoverCompletionHandler.
 *
 * @author Handover Team
 * @since 1.0.0
 */
public class LoggingHandoverCompletionHandler implements HandoverCompletionHandler {

    private static final Logger log = LoggerFactory.getLogger(LoggingHandoverCompletionHandler.class);

    @Override
    public void onHandoverComplete(HandoverRequest request) {
        log.info("Handover {} complete: {} -> {} (metadata job {})",
            request.handoverToken(), request.sourceUri(), request.targetUri(), request.metadataJobId());
    }
}
