package io.pricingworkers.broker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.pricingworkers.core.Json;
import io.pricingworkers.core.ResultRecord;
import io.pricingworkers.core.ResultStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Optional;

/**
 * Result records in {@code backend_results_<namespace>}, one row per task id.
 */
public class JdbcResultBackend implements ResultBackend {
    private static final Logger log = LoggerFactory.getLogger(JdbcResultBackend.class);

    private final String jdbcUrl;
    private final String user;
    private final String password;
    private final String table;
    private final ObjectMapper mapper = Json.mapper();

    public JdbcResultBackend(String jdbcUrl, String user, String password, int namespace) throws BrokerUnavailableException {
        this.jdbcUrl = jdbcUrl;
        this.user = user;
        this.password = password;
        this.table = "backend_results_" + namespace;
        try (Connection c = getConnection(); Statement s = c.createStatement()) {
            s.execute("CREATE TABLE IF NOT EXISTS " + table + " ("
                    + "task_id VARCHAR(64) PRIMARY KEY, "
                    + "task_name VARCHAR(64), "
                    + "status VARCHAR(16) NOT NULL, "
                    + "record CLOB NOT NULL, "
                    + "completed_at BIGINT)");
        } catch (SQLException e) {
            throw new BrokerUnavailableException("cannot initialise backend table at " + jdbcUrl, e);
        }
    }

    @Override
    public void record(ResultRecord result) throws BrokerUnavailableException {
        String json;
        try {
            json = mapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("cannot encode result " + result.taskId(), e);
        }
        try (Connection c = getConnection()) {
            c.setAutoCommit(false);
            try {
                if (!result.status().terminal() && currentIsTerminal(c, result.taskId())) {
                    c.rollback();
                    return;
                }
                try (PreparedStatement ps = c.prepareStatement("MERGE INTO " + table
                        + " (task_id, task_name, status, record, completed_at) KEY (task_id) VALUES (?, ?, ?, ?, ?)")) {
                    ps.setString(1, result.taskId());
                    ps.setString(2, result.taskName() == null ? null : result.taskName().wireName());
                    ps.setString(3, result.status().name());
                    ps.setString(4, json);
                    ps.setLong(5, result.completedAt() == null ? 0L : result.completedAt().toEpochMilli());
                    ps.executeUpdate();
                }
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new BrokerUnavailableException("record failed for " + result.taskId(), e);
        }
    }

    private boolean currentIsTerminal(Connection c, String taskId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT status FROM " + table + " WHERE task_id = ?")) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && ResultStatus.valueOf(rs.getString(1)).terminal();
            }
        }
    }

    @Override
    public Optional<ResultRecord> find(String taskId) throws BrokerUnavailableException {
        try (Connection c = getConnection();
             PreparedStatement ps = c.prepareStatement("SELECT record FROM " + table + " WHERE task_id = ?")) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(mapper.readValue(rs.getString(1), ResultRecord.class));
            }
        } catch (SQLException e) {
            throw new BrokerUnavailableException("find failed for " + taskId, e);
        } catch (JsonProcessingException e) {
            throw new BrokerUnavailableException("corrupt result record for " + taskId, e);
        }
    }

    @Override
    public boolean ping() {
        try (Connection c = getConnection(); Statement s = c.createStatement()) {
            s.execute("SELECT 1");
            return true;
        } catch (SQLException e) {
            log.warn("backend ping failed url={}: {}", jdbcUrl, e.getMessage());
            return false;
        }
    }

    private Connection getConnection() throws SQLException {
        return (user == null) ? DriverManager.getConnection(jdbcUrl) : DriverManager.getConnection(jdbcUrl, user, password);
    }
}
