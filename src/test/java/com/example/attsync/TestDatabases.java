package com.example.attsync;

import com.example.attsync.util.ConnectionFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * In-memory H2 stand-ins for the ZKTeco Access file and the HR database.
 */
public final class TestDatabases {
    private TestDatabases() {
    }

    public static String newUrl(String prefix) {
        return "jdbc:h2:mem:" + prefix + "_" + UUID.randomUUID().toString().replace("-", "") + ";DB_CLOSE_DELAY=-1";
    }

    public static ConnectionFactory factory(String url) {
        return ConnectionFactory.forUrl(url, "sa", "");
    }

    public static void createLegacySchema(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("CREATE TABLE USERINFO (USERID INT PRIMARY KEY, Badgenumber VARCHAR(24), Name VARCHAR(40))");
            statement.execute("CREATE TABLE CHECKINOUT (USERID INT, CHECKTIME TIMESTAMP, CHECKTYPE VARCHAR(1), sn VARCHAR(40))");
        }
    }

    public static void insertUser(Connection connection, int userId, String badge, String name) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
            "INSERT INTO USERINFO (USERID, Badgenumber, Name) VALUES (?, ?, ?)")) {
            statement.setInt(1, userId);
            statement.setString(2, badge);
            statement.setString(3, name);
            statement.executeUpdate();
        }
    }

    public static void insertPunch(Connection connection, int userId, String checkTime, String serial) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
            "INSERT INTO CHECKINOUT (USERID, CHECKTIME, CHECKTYPE, sn) VALUES (?, ?, 'I', ?)")) {
            statement.setInt(1, userId);
            statement.setTimestamp(2, Timestamp.valueOf(LocalDateTime.parse(checkTime)));
            statement.setString(3, serial);
            statement.executeUpdate();
        }
    }

    public static void createSinkTable(Connection connection, String table) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("CREATE TABLE " + table + " ("
                + "id BIGINT AUTO_INCREMENT PRIMARY KEY, "
                + "log_date DATE NOT NULL, "
                + "user_id VARCHAR(20), "
                + "badge_id VARCHAR(20), "
                + "spare VARCHAR(20), "
                + "log_time TIME, "
                + "status INT DEFAULT 0, "
                + "door VARCHAR(16), "
                + "spare2 VARCHAR(20), "
                + "device_tag VARCHAR(40))");
        }
    }

    public static int count(Connection connection, String table) throws SQLException {
        try (Statement statement = connection.createStatement();
             java.sql.ResultSet rs = statement.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getInt(1);
        }
    }
}
