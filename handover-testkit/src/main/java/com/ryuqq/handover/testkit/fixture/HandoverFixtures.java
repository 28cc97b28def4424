package com.ryuqq.handover.testkit.fixture;

import com.ryuqq.handover.core.contract.StepEnvelope;
import com.ryuqq.handover.core.contract.StepName;
import com.ryuqq.handover.core.contract.StepPayload;
import com.ryuqq.handover.core.model.CompletionWatch;
import com.ryuqq.handover.core.model.HandoverRequest;
import com.ryuqq.handover.core.model.HandoverSubmission;
import com.ryuqq.handover.core.model.HandoverToken;
import com.ryuqq.handover.core.model.TaskId;

/**
 * Shared test data.
 *
 * @author Handover Team
 * @since 1.0.0
 */
public final class HandoverFixtures {

    public static final String CONTACT = "curator@example.org";
    public static final String CHANGE_TYPE = "new_assembly";
    public static final String STAGING_URI = "mysql://rw@staging-host:3306/";

    public static final String CORE_DB = "mysql://ro@source-host:3306/homo_sapiens_core_110_38";
    public static final String VARIATION_DB = "mysql://ro@source-host:3306/homo_sapiens_variation_110_38";
    public static final String FUNCGEN_DB = "mysql://ro@source-host:3306/mus_musculus_funcgen_110_39";
    public static final String COMPARA_DB = "mysql://ro@source-host:3306/ensembl_compara_110";
    public static final String UNCLASSIFIED_DB = "mysql://ro@source-host:3306/ensembl_ontology_110";

    private HandoverFixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static HandoverSubmission submission(String sourceUri) {
        return HandoverSubmission.of(sourceUri, CONTACT, CHANGE_TYPE, "fixture");
    }

    public static HandoverRequest request(String sourceUri) {
        String database = sourceUri.substring(sourceUri.lastIndexOf('/') + 1);
        return HandoverRequest.accepted(sourceUri, STAGING_URI + database, CONTACT, CHANGE_TYPE, "fixture",
            HandoverToken.generate());
    }

    public static StepEnvelope envelope(StepName step, StepPayload payload) {
        return StepEnvelope.first(TaskId.random(), step, payload, System.currentTimeMillis());
    }

    public static StepEnvelope watchEnvelope(String statusUrl) {
        return envelope(StepName.WATCH_COMPLETION, new CompletionWatch(statusUrl, CONTACT));
    }
}
