package com.freightplatform.loadservice.controller;

import com.freightplatform.loadservice.dto.CreateLoadRequest;
import com.freightplatform.loadservice.dto.CurrentStatusResponse;
import com.freightplatform.loadservice.dto.StatusCountFilter;
import com.freightplatform.loadservice.dto.StatusUpdateRequest;
import com.freightplatform.loadservice.model.Load;
import com.freightplatform.loadservice.model.LoadStatus;
import com.freightplatform.loadservice.model.StatusHistoryRecord;
import com.freightplatform.loadservice.service.LoadLifecycleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

@RestController
@RequestMapping("/loads")
@RequiredArgsConstructor
public class LoadStatusController {

    private final LoadLifecycleService lifecycleService;

    @PostMapping
    public ResponseEntity<Load> createLoad(@RequestBody @Valid CreateLoadRequest request) {
        return new ResponseEntity<>(lifecycleService.createLoad(request), HttpStatus.CREATED);
    }

    @GetMapping("/{loadId}")
    public ResponseEntity<Load> getLoad(@PathVariable UUID loadId) {
        return ResponseEntity.ok(lifecycleService.getLoad(loadId));
    }

    @DeleteMapping("/{loadId}")
    public ResponseEntity<Void> deleteLoad(@PathVariable UUID loadId) {
        lifecycleService.deleteLoad(loadId);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{loadId}/status")
    public ResponseEntity<Load> updateStatus(
            @PathVariable UUID loadId,
            @RequestBody @Valid StatusUpdateRequest request
    ) {
        return ResponseEntity.ok(lifecycleService.updateStatus(loadId, request));
    }

    @GetMapping("/{loadId}/status")
    public ResponseEntity<CurrentStatusResponse> getCurrentStatus(@PathVariable UUID loadId) {
        return ResponseEntity.ok(new CurrentStatusResponse(loadId, lifecycleService.getCurrentStatus(loadId)));
    }

    @GetMapping("/{loadId}/status/history")
    public ResponseEntity<List<StatusHistoryRecord>> getStatusHistory(@PathVariable UUID loadId) {
        return ResponseEntity.ok(lifecycleService.getStatusHistory(loadId));
    }

    @GetMapping("/status-counts")
    public ResponseEntity<Map<LoadStatus, Long>> getStatusCounts(@RequestParam(required = false) UUID shipperId) {
        return ResponseEntity.ok(lifecycleService.getStatusCounts(new StatusCountFilter(shipperId)));
    }

    @GetMapping("/transition-rules")
    public ResponseEntity<Map<LoadStatus, Set<LoadStatus>>> getTransitionRules() {
        return ResponseEntity.ok(lifecycleService.getTransitionRules());
    }
}
