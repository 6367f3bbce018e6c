package com.example.attsync.client;

import com.example.attsync.TestDatabases;
import com.example.attsync.model.RawAttendanceEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AccessEventReaderTest {
    private Connection connection;

    @BeforeEach
    void setUp() throws SQLException {
        connection = TestDatabases.factory(TestDatabases.newUrl("zk")).open();
        TestDatabases.createLegacySchema(connection);
        TestDatabases.insertUser(connection, 1, "12", "Alice");
        TestDatabases.insertUser(connection, 2, "123456", "Visitor");
    }

    @AfterEach
    void tearDown() throws SQLException {
        connection.close();
    }

    @Test
    void returnsOnlyPunchesAfterTheWatermarkDay() throws SQLException {
        TestDatabases.insertPunch(connection, 1, "2025-01-08T07:55:00", "A1");
        TestDatabases.insertPunch(connection, 1, "2025-01-09T23:59:59", "A1");
        TestDatabases.insertPunch(connection, 1, "2025-01-10T08:31:00", "A1");

        List<RawAttendanceEvent> events = read(LocalDate.of(2025, 1, 9));

        assertThat(events).extracting(RawAttendanceEvent::getEventTime)
            .containsExactly(LocalDateTime.of(2025, 1, 10, 8, 31));
    }

    @Test
    void joinsUserRowAndKeepsChronologicalOrder() throws SQLException {
        TestDatabases.insertPunch(connection, 2, "2025-01-10T17:02:00", "B7");
        TestDatabases.insertPunch(connection, 1, "2025-01-10T08:31:00", "A1");

        List<RawAttendanceEvent> events = read(LocalDate.of(2025, 1, 9));

        assertThat(events).hasSize(2);
        RawAttendanceEvent first = events.get(0);
        assertThat(first.getBadgeId()).isEqualTo("12");
        assertThat(first.getTerminalSerial()).isEqualTo("A1");
        assertThat(first.getJoinedUserFields())
            .containsEntry("USERID", "1")
            .containsEntry("Badgenumber", "12")
            .containsEntry("Name", "Alice");
        assertThat(events.get(1).getBadgeId()).isEqualTo("123456");
    }

    @Test
    void punchesWithoutUserRowAreNotReturned() throws SQLException {
        TestDatabases.insertPunch(connection, 99, "2025-01-10T08:31:00", "A1");

        assertThat(read(LocalDate.of(2025, 1, 9))).isEmpty();
    }

    @Test
    void missingTableIsAQueryFailure() throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("DROP TABLE CHECKINOUT");
        }
        AccessEventReader reader = new AccessEventReader(connection);

        assertThatThrownBy(() -> reader.fetchSince(LocalDate.of(2025, 1, 9)))
            .isInstanceOf(LegacyStoreException.class)
            .satisfies(ex -> assertThat(((LegacyStoreException) ex).getKind())
                .isEqualTo(LegacyStoreException.Kind.QUERY));
    }

    @Test
    void closingTheStreamLeavesTheConnectionUsable() throws SQLException {
        TestDatabases.insertPunch(connection, 1, "2025-01-10T08:31:00", "A1");
        TestDatabases.insertPunch(connection, 1, "2025-01-10T12:00:00", "A1");
        AccessEventReader reader = new AccessEventReader(connection);

        try (Stream<RawAttendanceEvent> events = reader.fetchSince(LocalDate.of(2025, 1, 9))) {
            assertThat(events.findFirst()).isPresent();
        }

        assertThat(connection.isClosed()).isFalse();
        assertThat(read(LocalDate.of(2025, 1, 9))).hasSize(2);
    }

    private List<RawAttendanceEvent> read(LocalDate watermark) {
        try (Stream<RawAttendanceEvent> events = new AccessEventReader(connection).fetchSince(watermark)) {
            return events.collect(Collectors.toList());
        }
    }
}
