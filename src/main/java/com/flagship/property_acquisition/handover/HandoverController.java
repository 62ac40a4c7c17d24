package com.flagship.property_acquisition.handover;

import com.flagship.property_acquisition.handover.dto.HandoverResponse;
import com.flagship.property_acquisition.handover.dto.HandoverStartResponse;
import com.flagship.property_acquisition.handover.dto.StartHandoverRequest;
import com.flagship.property_acquisition.handover.dto.UpdateStageRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Administrative handover endpoints.
 *
 * Starting a handover is idempotent: the first call answers 201 with the new pipeline,
 * every later or concurrent call answers 200 with ALREADY_IN_PROGRESS.
 */
@RestController
@RequestMapping("/api/properties/{propertyId}/handover")
@RequiredArgsConstructor
@Slf4j
public class HandoverController {

    private final HandoverTransitionOrchestrator orchestrator;
    private final HandoverStageService stageService;

    @PostMapping
    public ResponseEntity<HandoverStartResponse> startHandover(
            @PathVariable("propertyId") UUID propertyId,
            @Valid @RequestBody StartHandoverRequest request) {
        HandoverResult result = orchestrator.startHandover(
                propertyId, request.getClientId(), request.getTriggerEvent(), request.getNotes());
        HttpStatus status = result.isStarted() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(HandoverStartResponse.from(result));
    }

    @GetMapping
    public ResponseEntity<HandoverResponse> getHandover(@PathVariable("propertyId") UUID propertyId) {
        return ResponseEntity.ok(HandoverResponse.from(stageService.getHandover(propertyId)));
    }

    @PutMapping("/stages/{stageNumber}")
    public ResponseEntity<HandoverResponse> updateHandoverStage(
            @PathVariable("propertyId") UUID propertyId,
            @PathVariable("stageNumber") int stageNumber,
            @Valid @RequestBody UpdateStageRequest request) {
        HandoverPipeline pipeline = stageService.updateHandoverStage(
                propertyId, stageNumber, request.getStatus(), request.getNotes());
        return ResponseEntity.ok(HandoverResponse.from(pipeline));
    }
}
