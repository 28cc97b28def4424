package com.ryuqq.handover.core.exception;

/**
 * 원본 데이터베이스가 존재하지 않음.
 *
 * @author Handover Team
 * @since 1.0.0
 */
public class SourceDatabaseNotFoundException extends IntakeValidationException {

    public static final String ERROR_CODE = "SOURCE_NOT_FOUND";

    private final String sourceUri;

    public SourceDatabaseNotFoundException(String sourceUri) {
        super(ERROR_CODE, sourceUri + " does not exist");
        this.sourceUri = sourceUri;
    }

    public String getSourceUri() {
        return sourceUri;
    }
}
