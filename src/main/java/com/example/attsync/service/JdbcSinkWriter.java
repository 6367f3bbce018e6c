package com.example.attsync.service;

import com.example.attsync.model.NormalizedRecord;
import com.example.attsync.model.WriteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTransientConnectionException;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Inserts records into the HR attendance table with bound parameters.
 *
 * <p>Column contract: {@code id, log_date, user_id, badge_id, spare, log_time, status, door,
 * spare2, device_tag}. {@code id} is left to the database, {@code user_id} and
 * {@code badge_id} both carry the badge, the spare columns are empty and {@code status} is 0.
 * Each row is committed on its own so a rejected row never takes others with it.
 */
public class JdbcSinkWriter implements SinkWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcSinkWriter.class);
    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private final Connection connection;
    private final String insertSql;
    private final String existsSql;
    private final boolean skipExisting;
    private PreparedStatement insertStatement;
    private PreparedStatement existsStatement;

    public JdbcSinkWriter(Connection connection, String table, boolean skipExisting) {
        this.connection = Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(table, "table");
        if (!TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid sink table name: " + table);
        }
        this.insertSql = "INSERT INTO " + table
            + " (log_date, user_id, badge_id, spare, log_time, status, door, spare2, device_tag)"
            + " VALUES (?, ?, ?, '', ?, 0, ?, '', ?)";
        this.existsSql = "SELECT COUNT(1) FROM " + table
            + " WHERE log_date = ? AND badge_id = ? AND log_time = ? AND device_tag = ?";
        this.skipExisting = skipExisting;
    }

    @Override
    public WriteResult write(NormalizedRecord record) {
        Objects.requireNonNull(record, "record");
        try {
            if (skipExisting && exists(record)) {
                LOGGER.debug("Skipping existing row {}", record);
                return WriteResult.duplicate(record);
            }
            int rows = insert(record);
            if (rows <= 0) {
                return WriteResult.error(record, "Insert affected no rows");
            }
            return WriteResult.ok(record);
        } catch (SQLException ex) {
            if (isConnectionFailure(ex)) {
                throw new SinkUnavailableException("Lost connection to sink: " + ex.getMessage(), ex);
            }
            return WriteResult.error(record, ex.getMessage());
        }
    }

    private int insert(NormalizedRecord record) throws SQLException {
        if (insertStatement == null) {
            insertStatement = connection.prepareStatement(insertSql);
        }
        insertStatement.setObject(1, record.getLogDate());
        insertStatement.setString(2, record.getBadgeId());
        insertStatement.setString(3, record.getBadgeId());
        insertStatement.setObject(4, record.getLogTime());
        insertStatement.setString(5, record.getDoorId());
        insertStatement.setString(6, record.getDeviceTag());
        return insertStatement.executeUpdate();
    }

    private boolean exists(NormalizedRecord record) throws SQLException {
        if (existsStatement == null) {
            existsStatement = connection.prepareStatement(existsSql);
        }
        existsStatement.setObject(1, record.getLogDate());
        existsStatement.setString(2, record.getBadgeId());
        existsStatement.setObject(3, record.getLogTime());
        existsStatement.setString(4, record.getDeviceTag());
        try (ResultSet rs = existsStatement.executeQuery()) {
            return rs.next() && rs.getLong(1) > 0;
        }
    }

    private boolean isConnectionFailure(SQLException ex) {
        if (ex instanceof SQLNonTransientConnectionException || ex instanceof SQLTransientConnectionException) {
            return true;
        }
        String state = ex.getSQLState();
        if (state != null && state.startsWith("08")) {
            return true;
        }
        try {
            return connection.isClosed();
        } catch (SQLException closedCheck) {
            return true;
        }
    }

    @Override
    public void close() {
        closeQuietly(insertStatement);
        closeQuietly(existsStatement);
        insertStatement = null;
        existsStatement = null;
    }

    private void closeQuietly(PreparedStatement statement) {
        if (statement == null) {
            return;
        }
        try {
            statement.close();
        } catch (SQLException ex) {
            LOGGER.warn("Error while closing sink statement", ex);
        }
    }
}
