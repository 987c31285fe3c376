package com.example.voter.storage;

import com.example.voter.exception.StoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "voter.store.type", havingValue = "h2", matchIfMissing = true)
public class H2KVStore implements KVStore {

    private static final String UNIQUE_VIOLATION = "23505";

    private final DataSource dataSource;

    @PostConstruct
    public void init() throws SQLException {
        try (Connection connection = dataSource.getConnection();
             Statement stmt = connection.createStatement()) {
            stmt.execute("CREATE TABLE IF NOT EXISTS kv_store (store_key VARCHAR(255) PRIMARY KEY, document VARCHAR)");
        }
        log.info("kv_store table ready");
    }

    @Override
    public String get(String key) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement pstmt = conn.prepareStatement(
                     "SELECT document FROM kv_store WHERE store_key = ?")) {
            pstmt.setString(1, key);
            try (ResultSet rs = pstmt.executeQuery()) {
                return rs.next() ? rs.getString("document") : null;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to get document for key " + key, e);
        }
    }

    @Override
    public boolean putIfAbsent(String key, String value) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement pstmt = conn.prepareStatement(
                     "INSERT INTO kv_store (store_key, document) VALUES (?, ?)")) {
            pstmt.setString(1, key);
            pstmt.setString(2, value);
            pstmt.executeUpdate();
            return true;
        } catch (SQLException e) {
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                return false;
            }
            throw new StoreException("Failed to insert key " + key, e);
        }
    }

    @Override
    public boolean replace(String key, String value) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement pstmt = conn.prepareStatement(
                     "UPDATE kv_store SET document = ? WHERE store_key = ?")) {
            pstmt.setString(1, value);
            pstmt.setString(2, key);
            return pstmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to replace key " + key, e);
        }
    }

    @Override
    public boolean compareAndSet(String key, String expected, String value) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement pstmt = conn.prepareStatement(
                     "UPDATE kv_store SET document = ? WHERE store_key = ? AND document = ?")) {
            pstmt.setString(1, value);
            pstmt.setString(2, key);
            pstmt.setString(3, expected);
            return pstmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to compare-and-set key " + key, e);
        }
    }

    @Override
    public boolean remove(String key) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement pstmt = conn.prepareStatement(
                     "DELETE FROM kv_store WHERE store_key = ?")) {
            pstmt.setString(1, key);
            return pstmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to remove key " + key, e);
        }
    }

    @Override
    public List<String> keys(String prefix) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement pstmt = conn.prepareStatement(
                     "SELECT store_key FROM kv_store WHERE store_key LIKE ? ESCAPE '\\' ORDER BY store_key")) {
            pstmt.setString(1, escapeLike(prefix) + "%");
            List<String> keys = new ArrayList<>();
            try (ResultSet rs = pstmt.executeQuery()) {
                while (rs.next()) {
                    keys.add(rs.getString(1));
                }
            }
            return keys;
        } catch (SQLException e) {
            throw new StoreException("Failed to list keys with prefix " + prefix, e);
        }
    }

    @Override
    public long removeAll(Collection<String> keys) {
        if (keys.isEmpty()) {
            return 0;
        }
        try (Connection conn = dataSource.getConnection();
             PreparedStatement pstmt = conn.prepareStatement(
                     "DELETE FROM kv_store WHERE store_key = ?")) {
            for (String key : keys) {
                pstmt.setString(1, key);
                pstmt.addBatch();
            }
            long removed = 0;
            for (int count : pstmt.executeBatch()) {
                removed += Math.max(count, 0);
            }
            return removed;
        } catch (SQLException e) {
            throw new StoreException("Failed to remove " + keys.size() + " keys", e);
        }
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }
}
