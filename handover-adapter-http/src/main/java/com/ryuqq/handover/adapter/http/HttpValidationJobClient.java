package com.ryuqq.handover.adapter.http;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.handover.core.job.ValidationJobRequest;

import java.net.http.HttpClient;

/**
 * Client for the database validation (healthcheck) service.
 *
 * @author Handover Team
 * @since 1.0.0
 */
public class HttpValidationJobClient extends AbstractHttpJobClient<ValidationJobRequest> {

    public HttpValidationJobClient(HttpJobClientConfig config) {
        super(config);
    }

    public HttpValidationJobClient(HttpJobClientConfig config, HttpClient httpClient) {
        super(config, httpClient);
    }

    @Override
    protected String serviceName() {
        return "validation";
    }

    @Override
    protected ObjectNode toRequestBody(ValidationJobRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("db_uri", request.databaseUri());
        body.put("production_uri", request.productionUri());
        body.put("compara_uri", request.comparaUri());
        body.put("staging_uri", request.stagingUri());
        body.put("live_uri", request.liveUri());
        putList(body, "hc_names", request.healthcheckNames());
        putList(body, "hc_groups", request.groups());
        body.put("data_files_path", request.dataFilesPath());
        body.put("email", request.email());
        body.put("tag", request.tag());
        return body;
    }
}
