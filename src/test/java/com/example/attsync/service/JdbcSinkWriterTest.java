package com.example.attsync.service;

import com.example.attsync.TestDatabases;
import com.example.attsync.model.NormalizedRecord;
import com.example.attsync.model.WriteResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcSinkWriterTest {
    private static final String TABLE = "att_raw_data";

    private Connection connection;

    @BeforeEach
    void setUp() throws SQLException {
        connection = TestDatabases.factory(TestDatabases.newUrl("hr")).open();
        TestDatabases.createSinkTable(connection, TABLE);
    }

    @AfterEach
    void tearDown() throws SQLException {
        if (!connection.isClosed()) {
            connection.close();
        }
    }

    @Test
    void writesRowFollowingTheColumnContract() throws SQLException {
        try (JdbcSinkWriter writer = new JdbcSinkWriter(connection, TABLE, false)) {
            WriteResult result = writer.write(record("12", "A1"));

            assertThat(result.isOk()).isTrue();
        }

        try (Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery("SELECT id, log_date, user_id, badge_id, spare, log_time, status,"
                 + " door, spare2, device_tag FROM " + TABLE)) {
            assertThat(rs.next()).isTrue();
            assertThat(rs.getLong("id")).isPositive();
            assertThat(rs.getObject("log_date", LocalDate.class)).isEqualTo(LocalDate.of(2025, 1, 10));
            assertThat(rs.getString("user_id")).isEqualTo("12");
            assertThat(rs.getString("badge_id")).isEqualTo("12");
            assertThat(rs.getString("spare")).isEmpty();
            assertThat(rs.getObject("log_time", LocalTime.class)).isEqualTo(LocalTime.of(8, 21));
            assertThat(rs.getInt("status")).isZero();
            assertThat(rs.getString("door")).isEqualTo("A1");
            assertThat(rs.getString("spare2")).isEmpty();
            assertThat(rs.getString("device_tag")).isEqualTo("SRC-ZKT-A1");
            assertThat(rs.next()).isFalse();
        }
    }

    @Test
    void quotesInValuesAreStoredLiterally() throws SQLException {
        String hostile = "1'; DROP TABLE att_raw_data; --";
        try (JdbcSinkWriter writer = new JdbcSinkWriter(connection, TABLE, false)) {
            assertThat(writer.write(record("7'", "X'")).isOk()).isTrue();
            assertThat(writer.write(new NormalizedRecord(LocalDate.of(2025, 1, 10), LocalTime.NOON, "8",
                "A1", hostile, "SRC-ZKT-")).isOk()).isTrue();
        }

        assertThat(TestDatabases.count(connection, TABLE)).isEqualTo(2);
        try (Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery("SELECT device_tag FROM " + TABLE + " WHERE badge_id = '8'")) {
            assertThat(rs.next()).isTrue();
            assertThat(rs.getString(1)).isEqualTo(hostile);
        }
    }

    @Test
    void rejectedRowIsReportedAndLaterRowsStillWrite() throws SQLException {
        try (JdbcSinkWriter writer = new JdbcSinkWriter(connection, TABLE, false)) {
            WriteResult rejected = writer.write(record("12", "DOOR-NAME-TOO-LONG-FOR-COLUMN"));
            WriteResult accepted = writer.write(record("13", "A1"));

            assertThat(rejected.getOutcome()).isEqualTo(WriteResult.Outcome.ERROR);
            assertThat(rejected.getErrorMessage()).isPresent();
            assertThat(accepted.isOk()).isTrue();
        }
        assertThat(TestDatabases.count(connection, TABLE)).isEqualTo(1);
    }

    @Test
    void existingRowIsSkippedWhenEnabled() throws SQLException {
        try (JdbcSinkWriter writer = new JdbcSinkWriter(connection, TABLE, true)) {
            assertThat(writer.write(record("12", "A1")).getOutcome()).isEqualTo(WriteResult.Outcome.OK);
            assertThat(writer.write(record("12", "A1")).getOutcome()).isEqualTo(WriteResult.Outcome.DUPLICATE);
        }
        assertThat(TestDatabases.count(connection, TABLE)).isEqualTo(1);
    }

    @Test
    void duplicatesAreInsertedWhenSkippingIsDisabled() throws SQLException {
        try (JdbcSinkWriter writer = new JdbcSinkWriter(connection, TABLE, false)) {
            writer.write(record("12", "A1"));
            writer.write(record("12", "A1"));
        }
        assertThat(TestDatabases.count(connection, TABLE)).isEqualTo(2);
    }

    @Test
    void rejectsSuspiciousTableNames() {
        assertThatThrownBy(() -> new JdbcSinkWriter(connection, "att; DROP TABLE x", false))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JdbcSinkWriter(connection, "att raw", false))
            .isInstanceOf(IllegalArgumentException.class);
        new JdbcSinkWriter(connection, "hr_db.att_raw_data", false).close();
    }

    @Test
    void lostConnectionIsNotAnOrdinaryRowError() throws SQLException {
        JdbcSinkWriter writer = new JdbcSinkWriter(connection, TABLE, false);
        connection.close();

        assertThatThrownBy(() -> writer.write(record("12", "A1")))
            .isInstanceOf(SinkUnavailableException.class);
        writer.close();
    }

    private static NormalizedRecord record(String badge, String door) {
        return new NormalizedRecord(LocalDate.of(2025, 1, 10), LocalTime.of(8, 21), badge, door,
            "SRC-ZKT-" + door, "SRC-ZKT-");
    }
}
