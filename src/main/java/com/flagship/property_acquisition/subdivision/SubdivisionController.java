package com.flagship.property_acquisition.subdivision;

import com.flagship.property_acquisition.subdivision.dto.PropertyResponse;
import com.flagship.property_acquisition.subdivision.dto.SubdivisionStatusRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/properties/{propertyId}/subdivision")
@RequiredArgsConstructor
public class SubdivisionController {

    private final SubdivisionGate subdivisionGate;

    @PutMapping
    public ResponseEntity<PropertyResponse> setStatus(
            @PathVariable("propertyId") UUID propertyId,
            @Valid @RequestBody SubdivisionStatusRequest request) {
        return ResponseEntity.ok(PropertyResponse.from(
                subdivisionGate.setSubdivisionStatus(propertyId, request.getStatus())));
    }
}
