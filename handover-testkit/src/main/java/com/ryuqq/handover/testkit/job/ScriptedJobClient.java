package com.ryuqq.handover.testkit.job;

import com.ryuqq.handover.core.job.JobClient;
import com.ryuqq.handover.core.job.JobId;
import com.ryuqq.handover.core.job.JobOutput;
import com.ryuqq.handover.core.job.JobState;
import com.ryuqq.handover.core.job.JobStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scripted {@link JobClient} fake.
 *
 * <p>Every submitted job replays the same script of retrieve results in order;
 * once the script is exhausted the last entry repeats. A script entry is either
 * a {@link JobStatus} or a {@link RuntimeException} to throw.</p>
 *
 * <pre>
 * ScriptedJobClient&lt;CopyJobRequest&gt; copy = new ScriptedJobClient&lt;&gt;("copy")
 *     .willReturnStates(JobState.RUNNING, JobState.SUCCEEDED);
 * </pre>
 *
 * <p>Thread-safe.</p>
 *
 * @param <R> request type
 * @author Handover Team
 * @since 1.0.0
 */
public class ScriptedJobClient<R> implements JobClient<R> {

    private final String prefix;
    private final AtomicInteger sequence = new AtomicInteger();
    private final List<R> submissions = new CopyOnWriteArrayList<>();
    private final Map<JobId, AtomicInteger> retrievals = new ConcurrentHashMap<>();
    private final List<Object> script = new CopyOnWriteArrayList<>();
    private volatile RuntimeException submitFailure;

    public ScriptedJobClient(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("prefix cannot be null or blank");
        }
        this.prefix = prefix;
        this.script.add(succeeded());
    }

    /**
     * Replaces the script with the given statuses.
     */
    public ScriptedJobClient<R> willReturn(JobStatus... statuses) {
        script.clear();
        script.addAll(List.of(statuses));
        return this;
    }

    /**
     * Replaces the script with bare states; {@code SUCCEEDED} carries a clean output.
     */
    public ScriptedJobClient<R> willReturnStates(JobState... states) {
        List<Object> entries = new ArrayList<>();
        for (JobState state : states) {
            entries.add(state == JobState.SUCCEEDED ? succeeded() : JobStatus.of(state));
        }
        script.clear();
        script.addAll(entries);
        return this;
    }

    /**
     * Appends a failure to the script.
     */
    public ScriptedJobClient<R> thenThrow(RuntimeException failure) {
        script.add(failure);
        return this;
    }

    /**
     * Appends a status to the script.
     */
    public ScriptedJobClient<R> thenReturn(JobStatus status) {
        script.add(status);
        return this;
    }

    public ScriptedJobClient<R> failSubmissionsWith(RuntimeException failure) {
        this.submitFailure = failure;
        return this;
    }

    @Override
    public JobId submit(R request) {
        RuntimeException failure = submitFailure;
        if (failure != null) {
            throw failure;
        }
        submissions.add(request);
        return JobId.of(prefix + "-" + sequence.incrementAndGet());
    }

    @Override
    public JobStatus retrieve(JobId jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        int call = retrievals.computeIfAbsent(jobId, id -> new AtomicInteger()).getAndIncrement();
        Object entry = script.get(Math.min(call, script.size() - 1));
        if (entry instanceof RuntimeException exception) {
            throw exception;
        }
        return (JobStatus) entry;
    }

    public List<R> submissions() {
        return List.copyOf(submissions);
    }

    public int submissionCount() {
        return submissions.size();
    }

    public int retrieveCount(JobId jobId) {
        AtomicInteger count = retrievals.get(jobId);
        return count == null ? 0 : count.get();
    }

    public int totalRetrieveCount() {
        return retrievals.values().stream().mapToInt(AtomicInteger::get).sum();
    }

    public static JobStatus succeeded() {
        return JobStatus.of(JobState.SUCCEEDED, JobOutput.of("succeeded"));
    }

    public static JobStatus succeededWithFailures() {
        return JobStatus.of(JobState.SUCCEEDED, JobOutput.of("failed"));
    }
}
