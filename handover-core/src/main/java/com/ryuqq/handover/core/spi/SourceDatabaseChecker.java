package com.ryuqq.handover.core.spi;

import com.ryuqq.handover.core.model.DatabaseUri;

/**
 * 데이터베이스 존재 여부 확인.
 *
 * @author Handover Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface SourceDatabaseChecker {

    /**
     * @param uri 확인할 데이터베이스
     * @return 존재하면 true
     * @throws com.ryuqq.handover.core.exception.DatabaseCheckException 서버에 연결할 수 없는 경우
     */
    boolean exists(DatabaseUri uri);
}
