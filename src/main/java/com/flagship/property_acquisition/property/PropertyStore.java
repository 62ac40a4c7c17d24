package com.flagship.property_acquisition.property;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to the {@code properties} table.
 *
 * Every mutating method is a single auto-committed conditional UPDATE that restates
 * the prior values it expects. Callers receive the affected row count: 1 means the
 * write won, 0 means the row no longer matched and someone else got there first.
 * No method here reads and writes in two steps.
 */
@Repository
@RequiredArgsConstructor
public class PropertyStore {

    private static final String AVAILABLE_HANDOVER = "('NOT_STARTED', 'AWAITING_START')";

    private static final RowMapper<Property> ROW_MAPPER = PropertyStore::mapRow;

    private final JdbcTemplate jdbcTemplate;

    public Optional<Property> findById(UUID propertyId) {
        return jdbcTemplate.query("SELECT * FROM properties WHERE id = ?", ROW_MAPPER, propertyId)
                .stream()
                .findFirst();
    }

    public void insert(Property property) {
        jdbcTemplate.update(
            "INSERT INTO properties (id, name, asking_price, handover_status, subdivision_status) " +
            "VALUES (?, ?, ?, ?, ?)",
            property.getId(),
            property.getName(),
            property.getAskingPrice(),
            property.getHandoverStatus().name(),
            property.getSubdivisionStatus().name()
        );
    }

    // ==================== Commitment ====================

    /**
     * Binds the property to a client. Clears any reservation in the same statement.
     * Wins only if nobody holds a commitment, the reservation (if any) belongs to the
     * same client, handover has not started and the property is not subdivided.
     */
    public int commit(UUID propertyId, UUID clientId, Instant commitmentDate) {
        return jdbcTemplate.update(
            "UPDATE properties SET committed_client_id = ?, commitment_date = ?, " +
            "reservation_status = NULL, reserved_by = NULL, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND committed_client_id IS NULL " +
            "AND (reserved_by IS NULL OR reserved_by = ?) " +
            "AND handover_status IN " + AVAILABLE_HANDOVER + " " +
            "AND subdivision_status <> 'SUBDIVIDED'",
            clientId,
            Timestamp.from(commitmentDate),
            propertyId,
            clientId
        );
    }

    /**
     * Releases a commitment held by the given client. Never touches a commitment
     * held by anyone else.
     */
    public int releaseCommitment(UUID propertyId, UUID clientId) {
        return jdbcTemplate.update(
            "UPDATE properties SET committed_client_id = NULL, commitment_date = NULL, " +
            "updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND committed_client_id = ?",
            propertyId,
            clientId
        );
    }

    // ==================== Reservation ====================

    public int reserve(UUID propertyId, UUID clientId) {
        return jdbcTemplate.update(
            "UPDATE properties SET reservation_status = 'RESERVED', reserved_by = ?, " +
            "updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND reservation_status IS NULL AND committed_client_id IS NULL " +
            "AND handover_status IN " + AVAILABLE_HANDOVER + " " +
            "AND subdivision_status <> 'SUBDIVIDED'",
            clientId,
            propertyId
        );
    }

    public int releaseReservation(UUID propertyId, UUID clientId) {
        return jdbcTemplate.update(
            "UPDATE properties SET reservation_status = NULL, reserved_by = NULL, " +
            "updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND reserved_by = ?",
            propertyId,
            clientId
        );
    }

    /**
     * Puts back a reservation released earlier in the same operation, provided no one
     * reserved or committed the property in between.
     */
    public int restoreReservation(UUID propertyId, UUID clientId) {
        return jdbcTemplate.update(
            "UPDATE properties SET reservation_status = 'RESERVED', reserved_by = ?, " +
            "updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND reservation_status IS NULL AND committed_client_id IS NULL",
            clientId,
            propertyId
        );
    }

    // ==================== Handover status ====================

    /**
     * Moves the handover status from {@code expected} to {@code next}.
     *
     * @param requireSubdivisionNotStarted also require that no subdivision is active or done
     */
    public int transitionHandoverStatus(UUID propertyId, HandoverStatus expected, HandoverStatus next,
                                        boolean requireSubdivisionNotStarted) {
        String sql = "UPDATE properties SET handover_status = ?, updated_at = CURRENT_TIMESTAMP " +
                "WHERE id = ? AND handover_status = ?" +
                (requireSubdivisionNotStarted ? " AND subdivision_status = 'NOT_STARTED'" : "");
        return jdbcTemplate.update(sql, next.name(), propertyId, expected.name());
    }

    // ==================== Subdivision ====================

    /**
     * Moves the subdivision status from {@code expected} to {@code next}.
     *
     * @param requireNoHandover also require that no handover is in progress or completed
     */
    public int transitionSubdivisionStatus(UUID propertyId, SubdivisionStatus expected, SubdivisionStatus next,
                                           boolean requireNoHandover) {
        String sql = "UPDATE properties SET subdivision_status = ?, updated_at = CURRENT_TIMESTAMP " +
                "WHERE id = ? AND subdivision_status = ?" +
                (requireNoHandover ? " AND handover_status NOT IN ('IN_PROGRESS', 'COMPLETED')" : "");
        return jdbcTemplate.update(sql, next.name(), propertyId, expected.name());
    }

    private static Property mapRow(ResultSet rs, int rowNum) throws SQLException {
        String reservation = rs.getString("reservation_status");
        return Property.builder()
                .id(rs.getObject("id", UUID.class))
                .name(rs.getString("name"))
                .askingPrice(rs.getBigDecimal("asking_price"))
                .handoverStatus(HandoverStatus.valueOf(rs.getString("handover_status")))
                .reservationStatus(reservation != null ? ReservationStatus.valueOf(reservation) : null)
                .reservedBy(rs.getObject("reserved_by", UUID.class))
                .committedClientId(rs.getObject("committed_client_id", UUID.class))
                .commitmentDate(toInstant(rs.getTimestamp("commitment_date")))
                .subdivisionStatus(SubdivisionStatus.valueOf(rs.getString("subdivision_status")))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
