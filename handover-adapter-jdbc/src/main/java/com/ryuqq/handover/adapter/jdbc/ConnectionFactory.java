package com.ryuqq.handover.adapter.jdbc;

import com.ryuqq.handover.core.model.DatabaseUri;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens a connection to the server a database URI points at.
 *
 * @author Handover Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ConnectionFactory {

    /**
     * @param uri database URI; only its server part is used
     * @return an open connection, closed by the caller
     * @throws SQLException if the server cannot be reached
     */
    Connection open(DatabaseUri uri) throws SQLException;
}
