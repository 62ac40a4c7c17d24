package com.flagship.property_acquisition.client;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to the {@code clients} table.
 */
@Repository
@RequiredArgsConstructor
public class ClientStore {

    private static final RowMapper<Client> ROW_MAPPER = (rs, rowNum) -> Client.builder()
            .id(rs.getObject("id", UUID.class))
            .authUserId(rs.getString("auth_user_id"))
            .fullName(rs.getString("full_name"))
            .email(rs.getString("email"))
            .phone(rs.getString("phone"))
            .build();

    private final JdbcTemplate jdbcTemplate;

    public Optional<Client> findById(UUID id) {
        return jdbcTemplate.query("SELECT * FROM clients WHERE id = ?", ROW_MAPPER, id)
                .stream()
                .findFirst();
    }

    public Optional<Client> findByAuthUserId(String authUserId) {
        return jdbcTemplate.query("SELECT * FROM clients WHERE auth_user_id = ?", ROW_MAPPER, authUserId)
                .stream()
                .findFirst();
    }

    public void insert(Client client) {
        jdbcTemplate.update(
            "INSERT INTO clients (id, auth_user_id, full_name, email, phone) VALUES (?, ?, ?, ?, ?)",
            client.getId(),
            client.getAuthUserId(),
            client.getFullName(),
            client.getEmail(),
            client.getPhone()
        );
    }
}
