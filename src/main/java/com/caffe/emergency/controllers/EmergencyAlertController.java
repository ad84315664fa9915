package com.caffe.emergency.controllers;

import com.caffe.emergency.dto.AlertStatisticsDTO;
import com.caffe.emergency.dto.CreateAlertRequest;
import com.caffe.emergency.dto.ResolveAlertRequest;
import com.caffe.emergency.dto.SystemTestResultDTO;
import com.caffe.emergency.model.Alert;
import com.caffe.emergency.model.ChannelConfig;
import com.caffe.emergency.model.EscalationRule;
import com.caffe.emergency.service.EmergencyAlertEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/emergency")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class EmergencyAlertController {

    private final EmergencyAlertEngine engine;

    // Create alert
    @PostMapping("/alerts")
    public ResponseEntity<Alert> createAlert(@RequestBody CreateAlertRequest request) {
        return ResponseEntity.ok(engine.createAlert(request));
    }

    @PatchMapping("/alerts/{id}/acknowledge")
    public ResponseEntity<Void> acknowledgeAlert(@PathVariable String id, @RequestParam String actorId) {
        engine.acknowledgeAlert(id, actorId);
        return ResponseEntity.noContent().build();
    }

    @PatchMapping("/alerts/{id}/resolve")
    public ResponseEntity<Void> resolveAlert(@PathVariable String id,
                                             @RequestParam String actorId,
                                             @RequestBody(required = false) ResolveAlertRequest request) {
        engine.resolveAlert(id, actorId, request != null ? request.getResolution() : null);
        return ResponseEntity.noContent().build();
    }

    // Manual escalation
    @PatchMapping("/alerts/{id}/escalate")
    public ResponseEntity<Void> escalateAlert(@PathVariable String id, @RequestParam String actorId) {
        engine.escalateAlert(id, actorId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/alerts/{id}")
    public ResponseEntity<Alert> getAlert(@PathVariable String id) {
        return ResponseEntity.ok(engine.getAlert(id));
    }

    @GetMapping("/alerts/active")
    public ResponseEntity<List<Alert>> listActiveAlerts() {
        return ResponseEntity.ok(engine.listActiveAlerts());
    }

    // Full history, newest first
    @GetMapping("/alerts")
    public ResponseEntity<List<Alert>> listAllAlerts() {
        return ResponseEntity.ok(engine.listAllAlerts());
    }

    @GetMapping("/statistics")
    public ResponseEntity<AlertStatisticsDTO> getStatistics() {
        return ResponseEntity.ok(engine.getStatistics());
    }

    @GetMapping("/channels")
    public ResponseEntity<List<ChannelConfig>> listChannels() {
        return ResponseEntity.ok(engine.listChannels());
    }

    @GetMapping("/escalation-rules")
    public ResponseEntity<List<EscalationRule>> listEscalationRules() {
        return ResponseEntity.ok(engine.listEscalationRules());
    }

    @PostMapping("/test")
    public ResponseEntity<SystemTestResultDTO> testEmergencySystem(@RequestParam(defaultValue = "system") String actorId) {
        return ResponseEntity.ok(engine.testEmergencySystem(actorId));
    }
}
