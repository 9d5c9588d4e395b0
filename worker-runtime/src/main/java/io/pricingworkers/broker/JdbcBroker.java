package io.pricingworkers.broker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.pricingworkers.core.Json;
import io.pricingworkers.core.TaskEnvelope;
import io.pricingworkers.core.TaskName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Broker over a JDBC table, one table per namespace. Rows are claimed with a conditional UPDATE on the lease
 * column, so envelopes survive a crashed worker and are redelivered once the lease runs out. Each claim writes a
 * fresh lease id; ack and nack only touch rows still carrying the caller's lease id.
 *
 * <p>Lanes are held in a side table claimed in the same transaction as the task row.
 */
public class JdbcBroker implements Broker {
    private static final Logger log = LoggerFactory.getLogger(JdbcBroker.class);
    private static final int CANDIDATES = 32;
    private static final String DUPLICATE_KEY = "23505";

    private final String jdbcUrl;
    private final String user;
    private final String password;
    private final String tasks;
    private final String lanes;
    private final Duration visibilityTimeout;
    private final Duration pollInterval;
    private final Clock clock;
    private final ObjectMapper mapper = Json.mapper();
    private volatile boolean closed;

    public JdbcBroker(String jdbcUrl, String user, String password, int namespace,
                      Duration visibilityTimeout, Duration pollInterval, Clock clock) throws BrokerUnavailableException {
        this.jdbcUrl = jdbcUrl;
        this.user = user;
        this.password = password;
        this.tasks = "broker_tasks_" + namespace;
        this.lanes = "broker_lanes_" + namespace;
        this.visibilityTimeout = visibilityTimeout;
        this.pollInterval = pollInterval;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        createTables();
    }

    private void createTables() throws BrokerUnavailableException {
        try (Connection c = getConnection(); Statement s = c.createStatement()) {
            s.execute("CREATE TABLE IF NOT EXISTS " + tasks + " ("
                    + "seq BIGINT GENERATED BY DEFAULT AS IDENTITY, "
                    + "task_id VARCHAR(64) PRIMARY KEY, "
                    + "task_name VARCHAR(64) NOT NULL, "
                    + "lane VARCHAR(32), "
                    + "envelope CLOB NOT NULL, "
                    + "available_at BIGINT NOT NULL, "
                    + "lease_until BIGINT, "
                    + "lease_id VARCHAR(64))");
            s.execute("CREATE TABLE IF NOT EXISTS " + lanes + " ("
                    + "lane VARCHAR(32) PRIMARY KEY, "
                    + "task_id VARCHAR(64) NOT NULL, "
                    + "lease_id VARCHAR(64) NOT NULL, "
                    + "lease_until BIGINT NOT NULL)");
        } catch (SQLException e) {
            throw new BrokerUnavailableException("cannot initialise broker tables at " + jdbcUrl, e);
        }
    }

    @Override
    public String enqueue(TaskEnvelope envelope) throws BrokerUnavailableException {
        envelope.validate();
        if (closed) throw new BrokerUnavailableException("broker closed");
        String json = encode(envelope);
        long availableAt = envelope.notBefore() == null ? 0L : envelope.notBefore().toEpochMilli();
        try (Connection c = getConnection()) {
            String sql = "MERGE INTO " + tasks + " (task_id, task_name, lane, envelope, available_at, lease_until, lease_id) "
                    + "KEY (task_id) VALUES (?, ?, ?, ?, ?, NULL, NULL)";
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, envelope.taskId());
                ps.setString(2, envelope.taskName().wireName());
                ps.setString(3, envelope.lane());
                ps.setString(4, json);
                ps.setLong(5, availableAt);
                ps.executeUpdate();
            }
        } catch (SQLException e) {
            throw new BrokerUnavailableException("enqueue failed for " + envelope.taskId(), e);
        }
        log.debug("enqueued task={} id={} table={}", envelope.taskName(), envelope.taskId(), tasks);
        return envelope.taskId();
    }

    @Override
    public Optional<Delivery> dequeue(Set<TaskName> capabilities, Duration timeout) throws BrokerUnavailableException, InterruptedException {
        if (capabilities.isEmpty()) return Optional.empty();
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!closed) {
            Optional<Delivery> claimed = tryClaim(capabilities);
            if (claimed.isPresent()) return claimed;
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) return Optional.empty();
            Thread.sleep(Math.max(1, Math.min(pollInterval.toMillis(), remaining / 1_000_000)));
        }
        return Optional.empty();
    }

    private Optional<Delivery> tryClaim(Set<TaskName> capabilities) throws BrokerUnavailableException {
        long now = clock.millis();
        try (Connection c = getConnection()) {
            Set<String> held = heldLanes(c, now);
            for (Candidate cand : candidates(c, capabilities, now)) {
                if (cand.lane != null && held.contains(cand.lane)) continue;
                String leaseId = UUID.randomUUID().toString();
                if (claim(c, cand, leaseId, now)) {
                    TaskEnvelope env = decode(cand.json);
                    if (cand.leasedBefore) {
                        log.warn("lease expired, redelivering task={} id={} retry={}", env.taskName(), env.taskId(), env.retryCount());
                    }
                    return Optional.of(new Delivery(env, leaseId));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new BrokerUnavailableException("dequeue failed on " + tasks, e);
        }
    }

    private Set<String> heldLanes(Connection c, long now) throws SQLException {
        Set<String> out = new HashSet<>();
        try (PreparedStatement ps = c.prepareStatement("SELECT lane FROM " + lanes + " WHERE lease_until > ?")) {
            ps.setLong(1, now);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(rs.getString(1));
            }
        }
        return out;
    }

    private List<Candidate> candidates(Connection c, Set<TaskName> capabilities, long now) throws SQLException {
        StringBuilder in = new StringBuilder();
        for (int i = 0; i < capabilities.size(); i++) in.append(i == 0 ? "?" : ",?");
        String sql = "SELECT task_id, lane, envelope, lease_until FROM " + tasks
                + " WHERE task_name IN (" + in + ") AND available_at <= ? AND (lease_until IS NULL OR lease_until <= ?)"
                + " ORDER BY seq LIMIT " + CANDIDATES;
        List<Candidate> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            int i = 1;
            for (TaskName t : capabilities) ps.setString(i++, t.wireName());
            ps.setLong(i++, now);
            ps.setLong(i, now);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rs.getLong(4);
                    boolean leasedBefore = !rs.wasNull();
                    out.add(new Candidate(rs.getString(1), rs.getString(2), rs.getString(3), leasedBefore));
                }
            }
        }
        return out;
    }

    private boolean claim(Connection c, Candidate cand, String leaseId, long now) throws SQLException {
        long until = now + visibilityTimeout.toMillis();
        c.setAutoCommit(false);
        try {
            try (PreparedStatement ps = c.prepareStatement("UPDATE " + tasks + " SET lease_until = ?, lease_id = ? "
                    + "WHERE task_id = ? AND (lease_until IS NULL OR lease_until <= ?)")) {
                ps.setLong(1, until);
                ps.setString(2, leaseId);
                ps.setString(3, cand.taskId);
                ps.setLong(4, now);
                if (ps.executeUpdate() != 1) {
                    c.rollback();
                    return false;
                }
            }
            if (cand.lane != null && !claimLane(c, cand, leaseId, now, until)) {
                c.rollback();
                return false;
            }
            c.commit();
            return true;
        } catch (SQLException e) {
            c.rollback();
            throw e;
        } finally {
            c.setAutoCommit(true);
        }
    }

    private boolean claimLane(Connection c, Candidate cand, String leaseId, long now, long until) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("UPDATE " + lanes + " SET task_id = ?, lease_id = ?, lease_until = ? "
                + "WHERE lane = ? AND (lease_until <= ? OR task_id = ?)")) {
            ps.setString(1, cand.taskId);
            ps.setString(2, leaseId);
            ps.setLong(3, until);
            ps.setString(4, cand.lane);
            ps.setLong(5, now);
            ps.setString(6, cand.taskId);
            if (ps.executeUpdate() == 1) return true;
        }
        try (PreparedStatement ps = c.prepareStatement("INSERT INTO " + lanes + " (lane, task_id, lease_id, lease_until) VALUES (?, ?, ?, ?)")) {
            ps.setString(1, cand.lane);
            ps.setString(2, cand.taskId);
            ps.setString(3, leaseId);
            ps.setLong(4, until);
            ps.executeUpdate();
            return true;
        } catch (SQLException e) {
            if (DUPLICATE_KEY.equals(e.getSQLState())) {
                log.debug("lane {} taken concurrently, skipping {}", cand.lane, cand.taskId);
                return false;
            }
            throw e;
        }
    }

    @Override
    public boolean ack(Delivery delivery) throws BrokerUnavailableException {
        try (Connection c = getConnection()) {
            return inTransaction(c, () -> {
                try (PreparedStatement ps = c.prepareStatement("DELETE FROM " + tasks + " WHERE task_id = ? AND lease_id = ?")) {
                    ps.setString(1, delivery.taskId());
                    ps.setString(2, delivery.leaseId());
                    if (ps.executeUpdate() != 1) return stale(delivery);
                }
                releaseLane(c, delivery.leaseId());
                return true;
            });
        } catch (SQLException e) {
            throw new BrokerUnavailableException("ack failed for " + delivery.taskId(), e);
        }
    }

    @Override
    public boolean nack(Delivery delivery, boolean requeue, Duration delay) throws BrokerUnavailableException {
        if (!requeue) return ack(delivery);
        TaskEnvelope next = delivery.envelope().requeued(clock.instant(), delay);
        String json = encode(next);
        try (Connection c = getConnection()) {
            return inTransaction(c, () -> {
                try (PreparedStatement ps = c.prepareStatement("UPDATE " + tasks
                        + " SET envelope = ?, available_at = ?, lease_until = NULL, lease_id = NULL WHERE task_id = ? AND lease_id = ?")) {
                    ps.setString(1, json);
                    ps.setLong(2, next.notBefore() == null ? 0L : next.notBefore().toEpochMilli());
                    ps.setString(3, delivery.taskId());
                    ps.setString(4, delivery.leaseId());
                    if (ps.executeUpdate() != 1) return stale(delivery);
                }
                releaseLane(c, delivery.leaseId());
                return true;
            });
        } catch (SQLException e) {
            throw new BrokerUnavailableException("nack failed for " + delivery.taskId(), e);
        }
    }

    private static boolean stale(Delivery delivery) {
        log.debug("ignoring stale lease task={} id={}", delivery.envelope().taskName(), delivery.taskId());
        return false;
    }

    private static boolean inTransaction(Connection c, SqlWork work) throws SQLException {
        c.setAutoCommit(false);
        try {
            boolean done = work.run();
            c.commit();
            return done;
        } catch (SQLException e) {
            c.rollback();
            throw e;
        } finally {
            c.setAutoCommit(true);
        }
    }

    private void releaseLane(Connection c, String leaseId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("DELETE FROM " + lanes + " WHERE lease_id = ?")) {
            ps.setString(1, leaseId);
            ps.executeUpdate();
        }
    }

    @Override
    public boolean ping() {
        try (Connection c = getConnection(); Statement s = c.createStatement()) {
            s.execute("SELECT 1");
            return true;
        } catch (SQLException e) {
            log.warn("broker ping failed url={}: {}", jdbcUrl, e.getMessage());
            return false;
        }
    }

    @Override
    public int depth() {
        try (Connection c = getConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM " + tasks + " WHERE lease_until IS NULL OR lease_until <= ?")) {
            ps.setLong(1, clock.millis());
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        } catch (SQLException e) {
            log.warn("broker depth unavailable: {}", e.getMessage());
            return -1;
        }
    }

    @Override
    public int inflight() {
        try (Connection c = getConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM " + tasks + " WHERE lease_until > ?")) {
            ps.setLong(1, clock.millis());
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        } catch (SQLException e) {
            log.warn("broker inflight unavailable: {}", e.getMessage());
            return -1;
        }
    }

    @Override
    public boolean isClosed() { return closed; }

    @Override
    public void close() { closed = true; }

    private String encode(TaskEnvelope envelope) throws BrokerUnavailableException {
        try {
            return mapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new BrokerUnavailableException("cannot encode envelope " + envelope.taskId(), e);
        }
    }

    private TaskEnvelope decode(String json) throws BrokerUnavailableException {
        try {
            return mapper.readValue(json, TaskEnvelope.class);
        } catch (JsonProcessingException e) {
            throw new BrokerUnavailableException("corrupt envelope in " + tasks, e);
        }
    }

    private Connection getConnection() throws SQLException {
        return (user == null) ? DriverManager.getConnection(jdbcUrl) : DriverManager.getConnection(jdbcUrl, user, password);
    }

    @FunctionalInterface
    private interface SqlWork {
        boolean run() throws SQLException;
    }

    private record Candidate(String taskId, String lane, String json, boolean leasedBefore) {}
}
