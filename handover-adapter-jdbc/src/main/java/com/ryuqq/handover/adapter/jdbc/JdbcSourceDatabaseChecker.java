package com.ryuqq.handover.adapter.jdbc;

import com.ryuqq.handover.core.exception.DatabaseCheckException;
import com.ryuqq.handover.core.model.DatabaseUri;
import com.ryuqq.handover.core.spi.SourceDatabaseChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Checks the server's schema catalog for the source database.
 *
 * @author Handover Team
 * @since 1.0.0
 */
public class JdbcSourceDatabaseChecker implements SourceDatabaseChecker {

    private static final Logger log = LoggerFactory.getLogger(JdbcSourceDatabaseChecker.class);

    static final String SCHEMA_QUERY =
        "SELECT SCHEMA_NAME FROM INFORMATION_SCHEMA.SCHEMATA WHERE SCHEMA_NAME = ?";

    private final ConnectionFactory connectionFactory;

    public JdbcSourceDatabaseChecker() {
        this(new DriverManagerConnectionFactory());
    }

    public JdbcSourceDatabaseChecker(ConnectionFactory connectionFactory) {
        if (connectionFactory == null) {
            throw new IllegalArgumentException("connectionFactory cannot be null");
        }
        this.connectionFactory = connectionFactory;
    }

    @Override
    public boolean exists(DatabaseUri uri) {
        if (uri == null) {
            throw new IllegalArgumentException("uri cannot be null");
        }
        if (!uri.hasDatabase()) {
            throw new IllegalArgumentException("uri has no database name: " + uri);
        }

        try (Connection connection = connectionFactory.open(uri);
             PreparedStatement statement = connection.prepareStatement(SCHEMA_QUERY)) {
            statement.setString(1, uri.database());
            try (ResultSet resultSet = statement.executeQuery()) {
                boolean found = resultSet.next();
                log.debug("Database {} on {} {}", uri.database(), uri.host(), found ? "exists" : "not found");
                return found;
            }
        } catch (SQLException e) {
            throw new DatabaseCheckException("Could not check " + uri.database() + " on " + uri.host(), e);
        }
    }
}
