package com.caffe.emergency.controllers;

import com.caffe.emergency.dto.AlertStatisticsDTO;
import com.caffe.emergency.dto.CreateAlertRequest;
import com.caffe.emergency.dto.SystemTestResultDTO;
import com.caffe.emergency.exception.AlertNotFoundException;
import com.caffe.emergency.exception.InvalidAlertStateException;
import com.caffe.emergency.exception.PersistenceException;
import com.caffe.emergency.exception.ValidationException;
import com.caffe.emergency.model.*;
import com.caffe.emergency.service.EmergencyAlertEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(EmergencyAlertController.class)
@DisplayName("EmergencyAlertController Tests")
class EmergencyAlertControllerTest {

    private static final String ALERT_ID = "alert_1725364800000_k3j9x2m1q";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private EmergencyAlertEngine engine;

    private static Alert alert(AlertStatus status) {
        return Alert.builder()
                .id(ALERT_ID)
                .title("Violence at polling station")
                .description("Two groups clashing outside")
                .category("violence")
                .severity(AlertSeverity.CRITICAL)
                .location(AlertLocation.builder().parish("St. James").pollingStation("SJ-08").build())
                .status(status)
                .channels(EnumSet.of(NotificationChannel.SMS))
                .recipients(List.of())
                .createdBy("observer-3")
                .createdAt(Instant.parse("2024-09-03T12:00:00Z"))
                .build();
    }

    @Test
    @DisplayName("POST /alerts creates an alert and returns it with wire values")
    void createAlert() throws Exception {
        given(engine.createAlert(any(CreateAlertRequest.class))).willReturn(alert(AlertStatus.ACTIVE));

        mockMvc.perform(post("/api/emergency/alerts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"title":"Violence at polling station","severity":"critical",
                                 "parish":"St. James","channels":["sms","call"],"createdBy":"observer-3"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(ALERT_ID))
                .andExpect(jsonPath("$.severity").value("critical"))
                .andExpect(jsonPath("$.status").value("active"))
                .andExpect(jsonPath("$.location.parish").value("St. James"));

        then(engine).should().createAlert(argThat(request -> request.getSeverity() == AlertSeverity.CRITICAL
                && request.getChannels().contains(NotificationChannel.VOICE)));
    }

    @Test
    @DisplayName("invalid input maps to 400 with code E001")
    void validationError() throws Exception {
        given(engine.createAlert(any())).willThrow(new ValidationException("location.parish is required"));

        mockMvc.perform(post("/api/emergency/alerts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"severity\":\"low\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("E001"));
    }

    @Test
    @DisplayName("unknown severity in the body is a 400")
    void unreadableBody() throws Exception {
        mockMvc.perform(post("/api/emergency/alerts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"severity\":\"apocalyptic\",\"parish\":\"Kingston\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("E001"));
    }

    @Test
    @DisplayName("acknowledge returns 204")
    void acknowledge() throws Exception {
        given(engine.acknowledgeAlert(ALERT_ID, "coord-1")).willReturn(alert(AlertStatus.ACKNOWLEDGED));

        mockMvc.perform(patch("/api/emergency/alerts/{id}/acknowledge", ALERT_ID).param("actorId", "coord-1"))
                .andExpect(status().isNoContent());
    }

    @Test
    @DisplayName("acknowledging a resolved alert is a 409 with code E003")
    void acknowledgeResolved() throws Exception {
        given(engine.acknowledgeAlert(ALERT_ID, "coord-1"))
                .willThrow(new InvalidAlertStateException("acknowledge", ALERT_ID, AlertStatus.RESOLVED));

        mockMvc.perform(patch("/api/emergency/alerts/{id}/acknowledge", ALERT_ID).param("actorId", "coord-1"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("E003"));
    }

    @Test
    @DisplayName("resolve passes the resolution text through")
    void resolve() throws Exception {
        given(engine.resolveAlert(ALERT_ID, "coord-1", "Police restored order")).willReturn(alert(AlertStatus.RESOLVED));

        mockMvc.perform(patch("/api/emergency/alerts/{id}/resolve", ALERT_ID)
                        .param("actorId", "coord-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resolution\":\"Police restored order\"}"))
                .andExpect(status().isNoContent());

        then(engine).should().resolveAlert(ALERT_ID, "coord-1", "Police restored order");
    }

    @Test
    @DisplayName("unknown alert is a 404 with code E002")
    void notFound() throws Exception {
        given(engine.getAlert("alert_missing")).willThrow(new AlertNotFoundException("alert_missing"));

        mockMvc.perform(get("/api/emergency/alerts/{id}", "alert_missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("E002"));
    }

    @Test
    @DisplayName("ledger failure is a 500 with code S001")
    void ledgerFailure() throws Exception {
        given(engine.escalateAlert(ALERT_ID, "coord-1"))
                .willThrow(new PersistenceException("emergency_alert_escalated for " + ALERT_ID,
                        new IllegalStateException("connection refused")));

        mockMvc.perform(patch("/api/emergency/alerts/{id}/escalate", ALERT_ID).param("actorId", "coord-1"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("S001"));
    }

    @Test
    @DisplayName("active alerts are listed")
    void activeAlerts() throws Exception {
        given(engine.listActiveAlerts()).willReturn(List.of(alert(AlertStatus.ESCALATED)));

        mockMvc.perform(get("/api/emergency/alerts/active"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].status").value("escalated"));
    }

    @Test
    @DisplayName("statistics include every severity key")
    void statistics() throws Exception {
        Map<String, Long> breakdown = new LinkedHashMap<>();
        breakdown.put("critical", 1L);
        breakdown.put("high", 0L);
        breakdown.put("medium", 0L);
        breakdown.put("low", 2L);
        given(engine.getStatistics()).willReturn(AlertStatisticsDTO.builder()
                .activeAlerts(2).totalAlerts(3).recentAlerts(3).avgResponseTime(4.5)
                .successRate(90.0).severityBreakdown(breakdown).build());

        mockMvc.perform(get("/api/emergency/statistics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.activeAlerts").value(2))
                .andExpect(jsonPath("$.avgResponseTime").value(4.5))
                .andExpect(jsonPath("$.severityBreakdown.low").value(2))
                .andExpect(jsonPath("$.severityBreakdown.high").value(0));
    }

    @Test
    @DisplayName("system test defaults the actor to system")
    void systemTest() throws Exception {
        given(engine.testEmergencySystem("system"))
                .willReturn(new SystemTestResultDTO(true, "Emergency system test completed successfully"));

        mockMvc.perform(post("/api/emergency/test"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));
    }
}
