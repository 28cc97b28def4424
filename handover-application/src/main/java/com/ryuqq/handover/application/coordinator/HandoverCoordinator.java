package com.ryuqq.handover.application.coordinator;

import com.ryuqq.handover.application.config.HandoverSettings;
import com.ryuqq.handover.application.config.MetadataSettings;
import com.ryuqq.handover.application.config.ValidationSettings;
import com.ryuqq.handover.core.classify.Classifier;
import com.ryuqq.handover.core.classify.ValidationGroup;
import com.ryuqq.handover.core.contract.StepEnvelope;
import com.ryuqq.handover.core.contract.StepName;
import com.ryuqq.handover.core.exception.IntakeValidationException;
import com.ryuqq.handover.core.exception.JobQueryException;
import com.ryuqq.handover.core.exception.NotificationException;
import com.ryuqq.handover.core.exception.SourceDatabaseNotFoundException;
import com.ryuqq.handover.core.job.CopyJobRequest;
import com.ryuqq.handover.core.job.JobClient;
import com.ryuqq.handover.core.job.JobId;
import com.ryuqq.handover.core.job.JobKind;
import com.ryuqq.handover.core.job.JobState;
import com.ryuqq.handover.core.job.JobStatus;
import com.ryuqq.handover.core.job.MetadataJobRequest;
import com.ryuqq.handover.core.job.ValidationJobRequest;
import com.ryuqq.handover.core.model.DatabaseUri;
import com.ryuqq.handover.core.model.HandoverRequest;
import com.ryuqq.handover.core.model.HandoverSubmission;
import com.ryuqq.handover.core.model.HandoverToken;
import com.ryuqq.handover.core.outcome.Advance;
import com.ryuqq.handover.core.outcome.Finish;
import com.ryuqq.handover.core.outcome.Reschedule;
import com.ryuqq.handover.core.outcome.StepOutcome;
import com.ryuqq.handover.core.spi.HandoverStore;
import com.ryuqq.handover.core.spi.Notifier;
import com.ryuqq.handover.core.spi.SourceDatabaseChecker;
import com.ryuqq.handover.core.spi.StepHandler;
import com.ryuqq.handover.core.statemachine.HandoverStage;
import com.ryuqq.handover.core.statemachine.StageTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Handover 상태 머신.
 *
 * <p>접수(accept)는 호출 스레드에서 동기적으로 실행되고, 이후 단계는 지연 실행 큐가
 * 전달하는 step(CHECK_VALIDATION, CHECK_COPY, CHECK_METADATA)으로 진행됩니다.
 * 각 step은 외부 작업 상태를 한 번 조회하고 {@link StepOutcome}을 반환하며,
 * 대기(sleep)하지 않습니다.</p>
 *
 * <p><strong>Step 처리 규칙:</strong></p>
 * <pre>
 * CHECK_VALIDATION
 *   pending                 → Reschedule(pollDelayMs)
 *   failed                  → 알림 "HC failed to run"   → VALIDATION_ERROR
 *   succeeded, output failed → 알림 "HC ran but failed" → VALIDATION_REJECTED
 *   succeeded, output 정상   → 복사 제출 → Advance(CHECK_COPY)
 * CHECK_COPY
 *   pending                 → Reschedule(pollDelayMs)
 *   failed                  → 알림 "Database copy failed" → COPY_FAILED
 *   그 외                    → 메타데이터 갱신 제출 → Advance(CHECK_METADATA)
 * CHECK_METADATA
 *   완료 처리기 호출 → DONE
 * </pre>
 *
 * <p><strong>멱등성:</strong></p>
 * <ul>
 *   <li>각 step은 HandoverStore의 현재 단계가 기대 단계가 아니면 중복 전달로 보고 Finish합니다.</li>
 *   <li>현재 단계가 이 step이 만드는 바로 다음 대기 단계이면 해당 확인 step을 다시 Advance합니다.
 *       (전이 후 후속 step 등록이 실패해 재전달된 경우)</li>
 *   <li>작업 제출은 Store에 기록된 작업 ID가 있으면 재사용합니다.</li>
 * </ul>
 *
 * <p><strong>오류 처리:</strong></p>
 * <ul>
 *   <li>JobSubmissionException, JobQueryException: step 밖으로 전파 (Runtime이 재전달/DLQ 처리)</li>
 *   <li>NotificationException: 로그만 남기고 계속 진행</li>
 *   <li>업무 실패: 알림 후 종료 단계로 전이</li>
 * </ul>
 *
 * @author Handover Team
 * @since 1.0.0
 */
public class HandoverCoordinator {

    private static final Logger log = LoggerFactory.getLogger(HandoverCoordinator.class);

    static final String METADATA_SOURCE = "Handover";

    private final HandoverSettings settings;
    private final Classifier classifier;
    private final JobClient<ValidationJobRequest> validationClient;
    private final JobClient<CopyJobRequest> copyClient;
    private final JobClient<MetadataJobRequest> metadataClient;
    private final Notifier notifier;
    private final SourceDatabaseChecker sourceChecker;
    private final HandoverStore store;
    private final HandoverCompletionHandler completionHandler;
    private final Supplier<HandoverToken> tokenGenerator;

    private HandoverCoordinator(Builder builder) {
        this.settings = require(builder.settings, "settings");
        this.validationClient = require(builder.validationClient, "validationClient");
        this.copyClient = require(builder.copyClient, "copyClient");
        this.metadataClient = require(builder.metadataClient, "metadataClient");
        this.notifier = require(builder.notifier, "notifier");
        this.sourceChecker = require(builder.sourceChecker, "sourceChecker");
        this.store = require(builder.store, "store");
        this.classifier = builder.classifier != null
            ? builder.classifier
            : Classifier.standard(settings.validation().groups());
        this.completionHandler = builder.completionHandler != null
            ? builder.completionHandler
            : new LoggingHandoverCompletionHandler();
        this.tokenGenerator = builder.tokenGenerator != null
            ? builder.tokenGenerator
            : HandoverToken::generate;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Handover 접수.
     *
     * <ol>
     *   <li>필수 값(sourceUri, contact, changeType) 검증</li>
     *   <li>targetUri가 없으면 stagingUri + source 데이터베이스 이름으로 생성</li>
     *   <li>토큰 발급, source 존재 확인, Store 등록</li>
     *   <li>분류 결과에 따라 검증 제출 또는 검증 생략 후 복사 제출</li>
     * </ol>
     *
     * @param submission 접수 요청
     * @return 첫 확인 step (CHECK_VALIDATION 또는 CHECK_COPY)
     * @throws IntakeValidationException 필수 값 누락 또는 잘못된 URI
     * @throws SourceDatabaseNotFoundException source 데이터베이스가 없는 경우 (작업 미제출)
     */
    public Advance accept(HandoverSubmission submission) {
        if (submission == null) {
            throw new IntakeValidationException("submission cannot be null");
        }
        requireField(submission.sourceUri(), "sourceUri");
        requireField(submission.contact(), "contact");
        requireField(submission.changeType(), "changeType");

        String sourceUri = submission.sourceUri().trim();
        DatabaseUri source = parseUri(sourceUri, "sourceUri");
        String targetUri = submission.hasTargetUri()
            ? submission.targetUri().trim()
            : deriveTargetUri(source);
        DatabaseUri target = parseUri(targetUri, "targetUri");

        HandoverToken token = tokenGenerator.get();
        log.info("Handling handover {}: {} -> {} ({})", token, source, target, submission.changeType());

        if (!sourceChecker.exists(source)) {
            log.error("{} does not exist", source);
            throw new SourceDatabaseNotFoundException(source.toString());
        }
        log.debug("{} looks good", source);

        HandoverRequest request = HandoverRequest.accepted(
            sourceUri, targetUri, submission.contact(), submission.changeType(), submission.comment(), token
        );
        store.register(request);

        try {
            Optional<ValidationGroup> group = classifier.classify(sourceUri);
            if (group.isEmpty()) {
                log.info("No validation needed for {}, starting copy", source);
                store.transition(token, HandoverStage.VALIDATION_SKIPPED);
                return startCopy(request);
            }
            log.info("Starting validation group {} for {}", group.get(), source);
            return startValidation(request, group.get());
        } catch (RuntimeException e) {
            store.remove(token);
            throw e;
        }
    }

    /**
     * 접수된 handover의 추적 중단.
     *
     * <p>accept 이후 첫 확인 step을 등록하지 못한 경우 호출합니다. 이미 제출된 작업은
     * 취소하지 않으며, 로그에 작업 ID를 남깁니다.</p>
     *
     * @param token 중단할 handover 토큰
     */
    public void abandon(HandoverToken token) {
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        for (JobKind kind : JobKind.values()) {
            store.findJobId(token, kind).ifPresent(jobId ->
                log.error("Abandoning handover {} with submitted {} job {}", token, kind, jobId));
        }
        store.remove(token);
    }

    /**
     * CHECK_VALIDATION step.
     */
    public StepOutcome checkValidation(StepEnvelope envelope) {
        HandoverRequest request = envelope.payloadAs(HandoverRequest.class);
        Optional<StepOutcome> redelivered = resolveIfNotAt(request, HandoverStage.AWAITING_VALIDATION, envelope.step());
        if (redelivered.isPresent()) {
            return redelivered.get();
        }

        JobId jobId = requireJobId(request, JobKind.VALIDATION);
        JobStatus status = validationClient.retrieve(jobId);
        if (status.isPending()) {
            log.debug("Validation job {} for {} is {}, polling again", jobId, request.handoverToken(),
                status.state().wireValue());
            return Reschedule.after(settings.pollDelayMs(), "validation job " + status.state().wireValue());
        }

        String webUri = settings.validation().webUri();
        if (status.state() == JobState.FAILED) {
            log.info("Validation job {} failed to run for {}", jobId, request.handoverToken());
            notifyContact(request, HandoverMessages.VALIDATION_FAILED_TO_RUN,
                HandoverMessages.validationFailedToRun(request.sourceUri(), webUri, jobId));
            store.transition(request.handoverToken(), HandoverStage.VALIDATION_ERROR);
            return Finish.because("validation failed to run");
        }

        if (!status.hasOutput()) {
            throw JobQueryException.malformed("Validation job " + jobId + " succeeded without output", null);
        }
        if (status.output().isFailed()) {
            log.info("Validation job {} found problems for {}", jobId, request.handoverToken());
            notifyContact(request, HandoverMessages.VALIDATION_FOUND_FAILURES,
                HandoverMessages.validationFoundFailures(request.sourceUri(), webUri, jobId));
            store.transition(request.handoverToken(), HandoverStage.VALIDATION_REJECTED);
            return Finish.because("validation found problems");
        }

        log.info("Validation passed for {}, starting copy", request.handoverToken());
        return startCopy(request);
    }

    /**
     * CHECK_COPY step.
     */
    public StepOutcome checkCopy(StepEnvelope envelope) {
        HandoverRequest request = envelope.payloadAs(HandoverRequest.class);
        Optional<StepOutcome> redelivered = resolveIfNotAt(request, HandoverStage.AWAITING_COPY, envelope.step());
        if (redelivered.isPresent()) {
            return redelivered.get();
        }

        JobId jobId = requireJobId(request, JobKind.COPY);
        JobStatus status = copyClient.retrieve(jobId);
        if (status.isPending()) {
            log.debug("Copy job {} for {} is {}, polling again", jobId, request.handoverToken(),
                status.state().wireValue());
            return Reschedule.after(settings.pollDelayMs(), "copy job " + status.state().wireValue());
        }

        if (status.state() == JobState.FAILED) {
            log.info("Copy job {} failed for {}", jobId, request.handoverToken());
            notifyContact(request, HandoverMessages.COPY_FAILED,
                HandoverMessages.copyFailed(request.sourceUri(), request.targetUri(), settings.copyWebUri(), jobId));
            store.transition(request.handoverToken(), HandoverStage.COPY_FAILED);
            return Finish.because("copy failed");
        }

        log.info("Copy complete for {}, submitting metadata update", request.handoverToken());
        MetadataSettings metadata = settings.metadata();
        JobId metadataJobId = submitOnce(request, JobKind.METADATA, () -> metadataClient.submit(
            new MetadataJobRequest(
                request.targetUri(),
                metadata.release(),
                metadata.divisionRelease(),
                metadata.releaseDate(),
                metadata.currentRelease(),
                request.contact(),
                request.comment(),
                METADATA_SOURCE
            )
        ));
        store.transition(request.handoverToken(), HandoverStage.AWAITING_METADATA);
        return Advance.to(StepName.CHECK_METADATA, request.withJobId(JobKind.METADATA, metadataJobId));
    }

    /**
     * CHECK_METADATA step.
     *
     * <p>메타데이터 작업 완료를 조회하지 않고 제출된 것으로 완료 처리합니다.</p>
     */
    public StepOutcome checkMetadata(StepEnvelope envelope) {
        HandoverRequest request = envelope.payloadAs(HandoverRequest.class);
        Optional<StepOutcome> redelivered = resolveIfNotAt(request, HandoverStage.AWAITING_METADATA, envelope.step());
        if (redelivered.isPresent()) {
            return redelivered.get();
        }

        log.info("Assuming completed metadata update {} for {}", request.metadataJobId(), request.handoverToken());
        completionHandler.onHandoverComplete(request);
        store.transition(request.handoverToken(), HandoverStage.DONE);
        return Finish.because("handover complete");
    }

    /**
     * Runtime 등록용 step 핸들러.
     *
     * @return CHECK_VALIDATION, CHECK_COPY, CHECK_METADATA 핸들러
     */
    public Map<StepName, StepHandler> handlers() {
        Map<StepName, StepHandler> handlers = new EnumMap<>(StepName.class);
        handlers.put(StepName.CHECK_VALIDATION, this::checkValidation);
        handlers.put(StepName.CHECK_COPY, this::checkCopy);
        handlers.put(StepName.CHECK_METADATA, this::checkMetadata);
        return Collections.unmodifiableMap(handlers);
    }

    private Advance startValidation(HandoverRequest request, ValidationGroup group) {
        ValidationSettings validation = settings.validation();
        JobId jobId = submitOnce(request, JobKind.VALIDATION, () -> validationClient.submit(
            new ValidationJobRequest(
                request.sourceUri(),
                validation.productionUri(),
                validation.comparaUri(),
                settings.stagingUri(),
                validation.liveUri(),
                List.of(),
                List.of(group.getValue()),
                validation.dataFilesPath(),
                null,
                null
            )
        ));
        store.transition(request.handoverToken(), HandoverStage.AWAITING_VALIDATION);
        notifyContact(request, HandoverMessages.VALIDATION_SUBMITTED,
            HandoverMessages.validationSubmitted(request.sourceUri()));
        return Advance.to(StepName.CHECK_VALIDATION, request.withJobId(JobKind.VALIDATION, jobId));
    }

    private Advance startCopy(HandoverRequest request) {
        JobId jobId = submitOnce(request, JobKind.COPY,
            () -> copyClient.submit(CopyJobRequest.replace(request.sourceUri(), request.targetUri())));
        store.transition(request.handoverToken(), HandoverStage.AWAITING_COPY);
        return Advance.to(StepName.CHECK_COPY, request.withJobId(JobKind.COPY, jobId));
    }

    private JobId submitOnce(HandoverRequest request, JobKind kind, Supplier<JobId> submission) {
        Optional<JobId> recorded = store.findJobId(request.handoverToken(), kind);
        if (recorded.isPresent()) {
            log.info("Reusing {} job {} for {}", kind, recorded.get(), request.handoverToken());
            return recorded.get();
        }
        JobId jobId = store.recordJobId(request.handoverToken(), kind, submission.get());
        log.info("Submitted {} job {} for {}", kind, jobId, request.handoverToken());
        return jobId;
    }

    private Optional<StepOutcome> resolveIfNotAt(HandoverRequest request, HandoverStage expected, StepName step) {
        Optional<HandoverStage> stage = store.findStage(request.handoverToken());
        if (stage.isEmpty()) {
            log.warn("Dropping {} for unknown handover {}", step, request.handoverToken());
            return Optional.of(Finish.because("unknown handover"));
        }
        HandoverStage current = stage.get();
        if (current == expected) {
            return Optional.empty();
        }
        Optional<StepName> pending = checkStepFor(current);
        if (pending.isPresent() && StageTransition.isAllowed(expected, current)) {
            // 이 step이 이미 다음 단계로 전이했지만 후속 step 등록 전에 실패한 경우
            log.warn("Redelivered {} for handover {} found stage {}, re-issuing {}",
                step, request.handoverToken(), current, pending.get());
            return Optional.of(Advance.to(pending.get(), withRecordedJobIds(request)));
        }
        log.info("Ignoring duplicate {} for handover {} at stage {}", step, request.handoverToken(), current);
        return Optional.of(Finish.because("duplicate delivery at stage " + current));
    }

    private HandoverRequest withRecordedJobIds(HandoverRequest request) {
        HandoverRequest resolved = request;
        for (JobKind kind : JobKind.values()) {
            if (resolved.jobId(kind) == null) {
                Optional<JobId> recorded = store.findJobId(request.handoverToken(), kind);
                if (recorded.isPresent()) {
                    resolved = resolved.withJobId(kind, recorded.get());
                }
            }
        }
        return resolved;
    }

    private static Optional<StepName> checkStepFor(HandoverStage stage) {
        return switch (stage) {
            case AWAITING_VALIDATION -> Optional.of(StepName.CHECK_VALIDATION);
            case AWAITING_COPY -> Optional.of(StepName.CHECK_COPY);
            case AWAITING_METADATA -> Optional.of(StepName.CHECK_METADATA);
            default -> Optional.empty();
        };
    }

    private void notifyContact(HandoverRequest request, String subject, String body) {
        try {
            notifier.notify(request.contact(), subject, body);
        } catch (NotificationException e) {
            log.warn("Could not send '{}' to {} for handover {}", subject, request.contact(),
                request.handoverToken(), e);
        }
    }

    private String deriveTargetUri(DatabaseUri source) {
        if (!source.hasDatabase()) {
            throw new IntakeValidationException("sourceUri does not name a database: " + source);
        }
        return settings.stagingUri() + source.database();
    }

    private static JobId requireJobId(HandoverRequest request, JobKind kind) {
        JobId jobId = request.jobId(kind);
        if (jobId == null) {
            throw new IllegalStateException(kind + " job id missing for handover " + request.handoverToken());
        }
        return jobId;
    }

    private static DatabaseUri parseUri(String value, String field) {
        try {
            return DatabaseUri.parse(value);
        } catch (IllegalArgumentException e) {
            throw new IntakeValidationException(field + " is not a valid database uri: " + e.getMessage(), e);
        }
    }

    private static void requireField(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IntakeValidationException(field + " is required");
        }
    }

    private static <T> T require(T value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
        return value;
    }

    /**
     * HandoverCoordinator 빌더.
     *
     * <p>classifier, completionHandler, tokenGenerator는 생략하면 기본값을 사용합니다.</p>
     */
    public static final class Builder {

        private HandoverSettings settings;
        private Classifier classifier;
        private JobClient<ValidationJobRequest> validationClient;
        private JobClient<CopyJobRequest> copyClient;
        private JobClient<MetadataJobRequest> metadataClient;
        private Notifier notifier;
        private SourceDatabaseChecker sourceChecker;
        private HandoverStore store;
        private HandoverCompletionHandler completionHandler;
        private Supplier<HandoverToken> tokenGenerator;

        private Builder() {
        }

        public Builder settings(HandoverSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder classifier(Classifier classifier) {
            this.classifier = classifier;
            return this;
        }

        public Builder validationClient(JobClient<ValidationJobRequest> validationClient) {
            this.validationClient = validationClient;
            return this;
        }

        public Builder copyClient(JobClient<CopyJobRequest> copyClient) {
            this.copyClient = copyClient;
            return this;
        }

        public Builder metadataClient(JobClient<MetadataJobRequest> metadataClient) {
            this.metadataClient = metadataClient;
            return this;
        }

        public Builder notifier(Notifier notifier) {
            this.notifier = notifier;
            return this;
        }

        public Builder sourceChecker(SourceDatabaseChecker sourceChecker) {
            this.sourceChecker = sourceChecker;
            return this;
        }

        public Builder store(HandoverStore store) {
            this.store = store;
            return this;
        }

        public Builder completionHandler(HandoverCompletionHandler completionHandler) {
            this.completionHandler = completionHandler;
            return this;
        }

        public Builder tokenGenerator(Supplier<HandoverToken> tokenGenerator) {
            this.tokenGenerator = tokenGenerator;
            return this;
        }

        public HandoverCoordinator build() {
            return new HandoverCoordinator(this);
        }
    }
}
