package io.taskpatrol.storage;

import io.taskpatrol.model.CredentialView;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for tenant credentials. Secret blobs are stored exactly as handed in (already encrypted)
 * and only leave this class through {@link #findSecret(String)}.
 */
public final class CredentialStore {
    private final Database database;

    public CredentialStore(Database database) {
        this.database = database;
    }

    public void insert(NewCredential n) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement clear = c.prepareStatement(
                    "UPDATE credentials SET is_default=0,updated_at_ms=? WHERE tenant_id=? AND is_default=1");
                 PreparedStatement ins = c.prepareStatement(
                         "INSERT INTO credentials(credential_id,tenant_id,name,secret_blob,region,is_default,is_active,created_at_ms,updated_at_ms) VALUES(?,?,?,?,?,?,1,?,?)")) {
                if (n.isDefault()) {
                    clear.setLong(1, n.nowMs());
                    clear.setString(2, n.tenantId());
                    clear.executeUpdate();
                }
                ins.setString(1, n.credentialId());
                ins.setString(2, n.tenantId());
                ins.setString(3, n.name());
                ins.setString(4, n.secretBlob());
                ins.setString(5, n.region());
                ins.setInt(6, n.isDefault() ? 1 : 0);
                ins.setLong(7, n.nowMs());
                ins.setLong(8, n.nowMs());
                ins.executeUpdate();
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to insert credential", e);
        }
    }

    public Optional<StoredSecret> findSecret(String credentialId) {
        String sql = "SELECT credential_id,tenant_id,secret_blob,region,is_active FROM credentials WHERE credential_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, credentialId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new StoredSecret(
                        rs.getString("credential_id"),
                        rs.getString("tenant_id"),
                        rs.getString("secret_blob"),
                        rs.getString("region"),
                        rs.getInt("is_active") == 1
                ));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read credential", e);
        }
    }

    public Optional<CredentialView> find(String credentialId) {
        String sql = "SELECT credential_id,tenant_id,name,region,is_default,is_active,created_at_ms FROM credentials WHERE credential_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, credentialId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(toView(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read credential", e);
        }
    }

    public Optional<String> findDefaultCredentialId(String tenantId) {
        String sql = "SELECT credential_id FROM credentials WHERE tenant_id=? AND is_default=1 AND is_active=1";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, tenantId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(rs.getString("credential_id")) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read default credential", e);
        }
    }

    public List<CredentialView> list(String tenantId) {
        String sql = "SELECT credential_id,tenant_id,name,region,is_default,is_active,created_at_ms FROM credentials WHERE tenant_id=? ORDER BY created_at_ms ASC, credential_id ASC";
        List<CredentialView> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, tenantId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(toView(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list credentials", e);
        }
    }

    public boolean setDefault(String tenantId, String credentialId, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement clear = c.prepareStatement(
                    "UPDATE credentials SET is_default=0,updated_at_ms=? WHERE tenant_id=? AND is_default=1");
                 PreparedStatement set = c.prepareStatement(
                         "UPDATE credentials SET is_default=1,updated_at_ms=? WHERE tenant_id=? AND credential_id=?")) {
                clear.setLong(1, nowMs);
                clear.setString(2, tenantId);
                clear.executeUpdate();
                set.setLong(1, nowMs);
                set.setString(2, tenantId);
                set.setString(3, credentialId);
                if (set.executeUpdate() == 0) {
                    c.rollback();
                    return false;
                }
                c.commit();
                return true;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to set default credential", e);
        }
    }

    /**
     * Returns false when the tenant has no such credential.
     */
    public boolean setActive(String tenantId, String credentialId, boolean active, long nowMs) {
        String sql = "UPDATE credentials SET is_active=?,updated_at_ms=? WHERE tenant_id=? AND credential_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, active ? 1 : 0);
            ps.setLong(2, nowMs);
            ps.setString(3, tenantId);
            ps.setString(4, credentialId);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update credential state", e);
        }
    }

    /**
     * Points every task of {@code tenantId} that references {@code fromId} at {@code toId}. Both
     * credentials must belong to the tenant.
     */
    public int reassign(String tenantId, String fromId, String toId, long nowMs) {
        if (fromId.equals(toId)) {
            throw new IllegalArgumentException("Cannot reassign a credential to itself: " + fromId);
        }
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement owner = c.prepareStatement(
                    "SELECT COUNT(1) FROM credentials WHERE tenant_id=? AND credential_id IN (?,?)");
                 PreparedStatement upd = c.prepareStatement(
                         "UPDATE task_definitions SET credential_id=?,updated_at_ms=? WHERE tenant_id=? AND credential_id=?")) {
                owner.setString(1, tenantId);
                owner.setString(2, fromId);
                owner.setString(3, toId);
                try (ResultSet rs = owner.executeQuery()) {
                    if (!rs.next() || rs.getInt(1) != 2) {
                        throw new IllegalArgumentException("Both credentials must exist for tenant " + tenantId);
                    }
                }
                upd.setString(1, toId);
                upd.setLong(2, nowMs);
                upd.setString(3, tenantId);
                upd.setString(4, fromId);
                int moved = upd.executeUpdate();
                c.commit();
                return moved;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to reassign credential", e);
        }
    }

    /**
     * Deletes a credential. Refuses while any task still references it; the foreign key enforces the
     * same rule at the database level.
     */
    public boolean delete(String credentialId) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement refs = c.prepareStatement(
                    "SELECT COUNT(1) FROM task_definitions WHERE credential_id=?");
                 PreparedStatement del = c.prepareStatement("DELETE FROM credentials WHERE credential_id=?")) {
                refs.setString(1, credentialId);
                int referencing;
                try (ResultSet rs = refs.executeQuery()) {
                    referencing = rs.next() ? rs.getInt(1) : 0;
                }
                if (referencing > 0) {
                    throw new CredentialInUseException(credentialId, referencing);
                }
                del.setString(1, credentialId);
                boolean removed = del.executeUpdate() == 1;
                c.commit();
                return removed;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete credential", e);
        }
    }

    private CredentialView toView(ResultSet rs) throws SQLException {
        return new CredentialView(
                rs.getString("credential_id"),
                rs.getString("tenant_id"),
                rs.getString("name"),
                rs.getString("region"),
                rs.getInt("is_default") == 1,
                rs.getInt("is_active") == 1,
                rs.getLong("created_at_ms")
        );
    }

    public record NewCredential(String credentialId, String tenantId, String name, String secretBlob, String region,
                                boolean isDefault, long nowMs) {}

    public record StoredSecret(String credentialId, String tenantId, String secretBlob, String region, boolean active) {
        @Override
        public String toString() {
            return "StoredSecret[credentialId=" + credentialId + ", tenantId=" + tenantId + ", secretBlob=***]";
        }
    }
}
