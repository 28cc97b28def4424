package com.ryuqq.handover.adapter.http;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.handover.core.job.MetadataJobRequest;

import java.net.http.HttpClient;

/**
 * Client for the release metadata service.
 *
 * @author Handover Team
 * @since 1.0.0
 */
public class HttpMetadataJobClient extends AbstractHttpJobClient<MetadataJobRequest> {

    public HttpMetadataJobClient(HttpJobClientConfig config) {
        super(config);
    }

    public HttpMetadataJobClient(HttpJobClientConfig config, HttpClient httpClient) {
        super(config, httpClient);
    }

    @Override
    protected String serviceName() {
        return "metadata";
    }

    @Override
    protected ObjectNode toRequestBody(MetadataJobRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("database_uri", request.databaseUri());
        body.put("e_release", request.release());
        body.put("eg_release", request.divisionRelease());
        body.put("release_date", request.releaseDate());
        body.put("current_release", request.currentRelease());
        body.put("email", request.email());
        body.put("comment", request.comment());
        body.put("source", request.source());
        return body;
    }
}
