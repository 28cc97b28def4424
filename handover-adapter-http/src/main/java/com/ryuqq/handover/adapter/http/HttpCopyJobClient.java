package com.ryuqq.handover.adapter.http;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.handover.core.job.CopyJobRequest;

import java.net.http.HttpClient;

/**
 * Client for the database copy service.
 *
 * @author Handover Team
 * @since 1.0.0
 */
public class HttpCopyJobClient extends AbstractHttpJobClient<CopyJobRequest> {

    public HttpCopyJobClient(HttpJobClientConfig config) {
        super(config);
    }

    public HttpCopyJobClient(HttpJobClientConfig config, HttpClient httpClient) {
        super(config, httpClient);
    }

    @Override
    protected String serviceName() {
        return "copy";
    }

    @Override
    protected ObjectNode toRequestBody(CopyJobRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("source_db_uri", request.sourceUri());
        body.put("target_db_uri", request.targetUri());
        putList(body, "only_tables", request.onlyTables());
        putList(body, "skip_tables", request.skipTables());
        body.put("update", request.update());
        body.put("drop", request.drop());
        body.put("email", request.email());
        return body;
    }
}
