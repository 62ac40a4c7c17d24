package com.flagship.property_acquisition.handover;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.property_acquisition.property.HandoverStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to the {@code handover_pipeline} table. Stages are stored as a JSONB
 * document serialized with the application ObjectMapper.
 *
 * The unique constraint on {@code property_id} turns a second concurrent insert into
 * a {@link org.springframework.dao.DuplicateKeyException}; stage updates are guarded
 * by the {@code version} column.
 */
@Repository
@RequiredArgsConstructor
public class HandoverPipelineStore {

    private static final TypeReference<List<PipelineStage>> STAGE_LIST = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public Optional<HandoverPipeline> findByPropertyId(UUID propertyId) {
        return jdbcTemplate.query("SELECT * FROM handover_pipeline WHERE property_id = ?",
                        this::mapRow, propertyId)
                .stream()
                .findFirst();
    }

    public void insert(HandoverPipeline pipeline) {
        jdbcTemplate.update(
            "INSERT INTO handover_pipeline (id, property_id, client_id, interest_id, trigger_event, buyer_name, " +
            "asking_price, deposit_received, current_stage, overall_progress, pipeline_stages, handover_status, " +
            "version, created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS JSONB), ?, ?, ?, ?)",
            pipeline.getId(),
            pipeline.getPropertyId(),
            pipeline.getClientId(),
            pipeline.getInterestId(),
            pipeline.getTriggerEvent().name(),
            pipeline.getBuyerName(),
            pipeline.getAskingPrice(),
            pipeline.getDepositReceived(),
            pipeline.getCurrentStage(),
            pipeline.getOverallProgress(),
            writeStages(pipeline.getPipelineStages()),
            pipeline.getHandoverStatus().name(),
            pipeline.getVersion(),
            Timestamp.from(pipeline.getCreatedAt()),
            Timestamp.from(pipeline.getUpdatedAt())
        );
    }

    /**
     * Writes the stage document and derived fields if the row still has {@code expectedVersion}.
     * The version is incremented on success.
     */
    public int update(HandoverPipeline pipeline, long expectedVersion) {
        return jdbcTemplate.update(
            "UPDATE handover_pipeline SET pipeline_stages = CAST(? AS JSONB), current_stage = ?, " +
            "overall_progress = ?, handover_status = ?, version = version + 1, updated_at = ? " +
            "WHERE id = ? AND version = ?",
            writeStages(pipeline.getPipelineStages()),
            pipeline.getCurrentStage(),
            pipeline.getOverallProgress(),
            pipeline.getHandoverStatus().name(),
            Timestamp.from(pipeline.getUpdatedAt()),
            pipeline.getId(),
            expectedVersion
        );
    }

    /**
     * Compensation only: removes a pipeline inserted by a handover start that lost its race.
     */
    public int delete(UUID pipelineId) {
        return jdbcTemplate.update("DELETE FROM handover_pipeline WHERE id = ?", pipelineId);
    }

    private String writeStages(List<PipelineStage> stages) {
        try {
            return objectMapper.writeValueAsString(stages);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize pipeline stages", e);
        }
    }

    private List<PipelineStage> readStages(String json) {
        try {
            return List.copyOf(objectMapper.readValue(json, STAGE_LIST));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt pipeline stage document", e);
        }
    }

    private HandoverPipeline mapRow(ResultSet rs, int rowNum) throws SQLException {
        return HandoverPipeline.builder()
                .id(rs.getObject("id", UUID.class))
                .propertyId(rs.getObject("property_id", UUID.class))
                .clientId(rs.getObject("client_id", UUID.class))
                .interestId(rs.getObject("interest_id", UUID.class))
                .triggerEvent(TriggerEvent.valueOf(rs.getString("trigger_event")))
                .buyerName(rs.getString("buyer_name"))
                .askingPrice(rs.getBigDecimal("asking_price"))
                .depositReceived(rs.getBigDecimal("deposit_received"))
                .currentStage(rs.getInt("current_stage"))
                .overallProgress(rs.getInt("overall_progress"))
                .pipelineStages(readStages(rs.getString("pipeline_stages")))
                .handoverStatus(HandoverStatus.valueOf(rs.getString("handover_status")))
                .version(rs.getLong("version"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
