package com.ryuqq.handover.adapter.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.handover.core.exception.JobQueryException;
import com.ryuqq.handover.core.exception.JobSubmissionException;
import com.ryuqq.handover.core.job.JobClient;
import com.ryuqq.handover.core.job.JobId;
import com.ryuqq.handover.core.job.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * JSON-over-HTTP {@link JobClient} for the job services.
 *
 * <p>Wire format shared by all services:</p>
 * <ul>
 *   <li>{@code POST {base}/jobs} with a JSON body, answered by {@code {"job_id": ...}}</li>
 *   <li>{@code GET {base}/jobs/{id}}, answered by {@code {"id": ..., "status": ..., "output": {...}}}</li>
 * </ul>
 *
 * <p>Neither call is retried here. Redelivery of the step that made the call is
 * the only retry mechanism.</p>
 *
 * @param <R> service request type
 * @author Handover Team
 * @since 1.0.0
 */
public abstract class AbstractHttpJobClient<R> implements JobClient<R> {

    private static final Logger log = LoggerFactory.getLogger(AbstractHttpJobClient.class);

    private final HttpJobClientConfig config;
    private final HttpClient httpClient;
    private final JobStatusParser parser;
    protected final ObjectMapper objectMapper;

    protected AbstractHttpJobClient(HttpJobClientConfig config) {
        this(config, HttpClient.newBuilder()
            .connectTimeout(requireConfig(config).connectTimeout())
            .build());
    }

    protected AbstractHttpJobClient(HttpJobClientConfig config, HttpClient httpClient) {
        if (httpClient == null) {
            throw new IllegalArgumentException("httpClient cannot be null");
        }
        this.config = requireConfig(config);
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
        this.parser = new JobStatusParser(objectMapper);
    }

    /**
     * Service name used in log lines and error messages.
     */
    protected abstract String serviceName();

    /**
     * Maps the request to the service's JSON body.
     */
    protected abstract ObjectNode toRequestBody(R request);

    @Override
    public JobId submit(R request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        URI uri = config.jobsUri();
        String body;
        try {
            body = objectMapper.writeValueAsString(toRequestBody(request));
        } catch (JsonProcessingException e) {
            throw new JobSubmissionException("Could not encode " + serviceName() + " request", e);
        }

        HttpRequest httpRequest = HttpRequest.newBuilder(uri)
            .timeout(config.requestTimeout())
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new JobSubmissionException(serviceName() + " service unreachable at " + uri, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobSubmissionException("Interrupted while submitting to " + serviceName(), e);
        }

        if (response.statusCode() >= 400) {
            log.warn("{} rejected submission with HTTP {}: {}", serviceName(), response.statusCode(), response.body());
            throw new JobSubmissionException(serviceName() + " rejected submission with HTTP " + response.statusCode());
        }

        JobId jobId = readJobId(response.body());
        log.debug("Submitted {} job {}", serviceName(), jobId);
        return jobId;
    }

    @Override
    public JobStatus retrieve(JobId jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        URI uri = URI.create(config.jobsUri() + "/" + URLEncoder.encode(jobId.getValue(), StandardCharsets.UTF_8));
        HttpRequest httpRequest = HttpRequest.newBuilder(uri)
            .timeout(config.requestTimeout())
            .header("Accept", "application/json")
            .GET()
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new JobQueryException(serviceName() + " service unreachable at " + uri, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobQueryException("Interrupted while querying " + serviceName(), e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new JobQueryException(
                serviceName() + " returned HTTP " + response.statusCode() + " for job " + jobId.getValue());
        }
        return parser.parseStatus(response.body());
    }

    private JobId readJobId(String body) {
        JsonNode root;
        try {
            root = body == null || body.isBlank() ? null : objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new JobSubmissionException(serviceName() + " returned an unreadable submission response", e);
        }
        JsonNode jobId = root == null ? null : root.get("job_id");
        if (jobId == null || jobId.isNull() || jobId.asText().isBlank()) {
            throw new JobSubmissionException(serviceName() + " response carries no job_id");
        }
        return JobId.of(jobId.asText());
    }

    /**
     * Writes a list field, {@code null} when the list is empty.
     */
    protected void putList(ObjectNode node, String field, List<String> values) {
        if (values == null || values.isEmpty()) {
            node.putNull(field);
        } else {
            ArrayNode array = node.putArray(field);
            for (String value : values) {
                array.add(value);
            }
        }
    }

    private static HttpJobClientConfig requireConfig(HttpJobClientConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return config;
    }
}
