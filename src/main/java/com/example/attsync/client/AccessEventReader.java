package com.example.attsync.client;

import com.example.attsync.model.RawAttendanceEvent;
import com.example.attsync.util.Watermarks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Reads the ZKTeco {@code CHECKINOUT} table joined with {@code USERINFO}, which maps the
 * terminal-local user id to the printed badge number.
 */
public class AccessEventReader implements EventReader {
    private static final Logger LOGGER = LoggerFactory.getLogger(AccessEventReader.class);

    static final String QUERY = "SELECT c.CHECKTIME, c.sn, u.USERID, u.Badgenumber, u.Name"
        + " FROM CHECKINOUT c INNER JOIN USERINFO u ON u.USERID = c.USERID"
        + " WHERE c.CHECKTIME >= ?"
        + " ORDER BY c.CHECKTIME";

    private final Connection connection;

    public AccessEventReader(Connection connection) {
        this.connection = Objects.requireNonNull(connection, "connection");
    }

    @Override
    public Stream<RawAttendanceEvent> fetchSince(LocalDate watermark) {
        Objects.requireNonNull(watermark, "watermark");
        PreparedStatement statement = null;
        ResultSet resultSet;
        try {
            statement = connection.prepareStatement(QUERY);
            statement.setTimestamp(1, Timestamp.valueOf(Watermarks.lowerBound(watermark)));
            resultSet = statement.executeQuery();
        } catch (SQLException ex) {
            closeQuietly(null, statement);
            throw new LegacyStoreException(LegacyStoreException.Kind.QUERY,
                "Failed to query punches after " + watermark + ": " + ex.getMessage(), ex);
        }
        LOGGER.debug("Reading punches after {}", watermark);
        PreparedStatement openStatement = statement;
        return StreamSupport.stream(new RowSpliterator(resultSet), false)
            .onClose(() -> closeQuietly(resultSet, openStatement));
    }

    private static RawAttendanceEvent toEvent(ResultSet rs) throws SQLException {
        Timestamp checkTime = rs.getTimestamp(1);
        if (checkTime == null) {
            throw new SQLException("CHECKTIME is null");
        }
        String serial = rs.getString(2);
        Map<String, String> user = new LinkedHashMap<>();
        user.put("USERID", rs.getString(3));
        String badge = rs.getString(4);
        user.put("Badgenumber", badge);
        user.put("Name", rs.getString(5));
        return new RawAttendanceEvent(checkTime.toLocalDateTime(), badge, serial, user);
    }

    private static void closeQuietly(ResultSet resultSet, PreparedStatement statement) {
        if (resultSet != null) {
            try {
                resultSet.close();
            } catch (SQLException ex) {
                LOGGER.warn("Error while closing result set", ex);
            }
        }
        if (statement != null) {
            try {
                statement.close();
            } catch (SQLException ex) {
                LOGGER.warn("Error while closing statement", ex);
            }
        }
    }

    private static final class RowSpliterator extends Spliterators.AbstractSpliterator<RawAttendanceEvent> {
        private final ResultSet resultSet;

        RowSpliterator(ResultSet resultSet) {
            super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
            this.resultSet = resultSet;
        }

        @Override
        public boolean tryAdvance(Consumer<? super RawAttendanceEvent> action) {
            try {
                if (!resultSet.next()) {
                    return false;
                }
                action.accept(toEvent(resultSet));
                return true;
            } catch (SQLException ex) {
                throw new LegacyStoreException(LegacyStoreException.Kind.QUERY,
                    "Failed to read punch row: " + ex.getMessage(), ex);
            }
        }
    }
}
