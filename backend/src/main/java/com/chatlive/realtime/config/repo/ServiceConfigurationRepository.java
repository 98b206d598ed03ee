package com.chatlive.realtime.config.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

@Repository
public class ServiceConfigurationRepository {

    public record ServiceConfigurationRow(String serviceName, String host, Integer port, String username, String password,
                                          boolean enabled) {
    }

    private final JdbcTemplate jdbcTemplate;

    public ServiceConfigurationRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<ServiceConfigurationRow> findEnabled(String serviceName) {
        var sql = """
                select service_name, host, port, username, password, enabled
                from service_configuration
                where service_name = ? and enabled = true
                limit 1
                """;
        var list = jdbcTemplate.query(sql, (rs, rowNum) -> new ServiceConfigurationRow(
                rs.getString("service_name"),
                rs.getString("host"),
                rs.getObject("port", Integer.class),
                rs.getString("username"),
                rs.getString("password"),
                rs.getBoolean("enabled")
        ), serviceName);
        return list.stream().findFirst();
    }

    public void upsert(String serviceName, String host, Integer port, String username, String password, boolean enabled) {
        var updated = jdbcTemplate.update("""
                        update service_configuration
                        set host = ?, port = ?, username = ?, password = ?, enabled = ?, updated_at = ?
                        where service_name = ?
                        """,
                host, port, username, password, enabled, Timestamp.from(Instant.now()), serviceName);
        if (updated > 0) return;
        jdbcTemplate.update("""
                        insert into service_configuration(service_name, host, port, username, password, enabled, updated_at)
                        values (?, ?, ?, ?, ?, ?, ?)
                        """,
                serviceName, host, port, username, password, enabled, Timestamp.from(Instant.now()));
    }

    public void delete(String serviceName) {
        jdbcTemplate.update("delete from service_configuration where service_name = ?", serviceName);
    }
}
