package com.freightplatform.loadservice;

import com.freightplatform.loadservice.controller.LoadStatusController;
import com.freightplatform.loadservice.core.config.GlobalExceptionHandler;
import com.freightplatform.loadservice.core.exceptions.InvalidStatusTransitionException;
import com.freightplatform.loadservice.core.exceptions.LoadNotFoundException;
import com.freightplatform.loadservice.core.exceptions.LoadPersistenceException;
import com.freightplatform.loadservice.core.statemachine.TransitionRuleTable;
import com.freightplatform.loadservice.dto.StatusCountFilter;
import com.freightplatform.loadservice.dto.StatusUpdateRequest;
import com.freightplatform.loadservice.model.Load;
import com.freightplatform.loadservice.model.LoadStatus;
import com.freightplatform.loadservice.service.LoadLifecycleService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class LoadStatusControllerTest {

    @Mock
    private LoadLifecycleService lifecycleService;

    private MockMvc mockMvc;
    private UUID loadId;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new LoadStatusController(lifecycleService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
        loadId = UUID.randomUUID();
    }

    @Test
    @DisplayName("PUT status returns the updated load")
    void updateStatus() throws Exception {
        when(lifecycleService.updateStatus(eq(loadId), any())).thenReturn(loadIn(LoadStatus.RESERVED));

        mockMvc.perform(put("/loads/{id}/status", loadId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"status": "RESERVED", "actor": "dispatcher-1",
                                 "details": {"reason": "carrier hold"}, "latitude": 41.8, "longitude": -87.6}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RESERVED"))
                .andExpect(jsonPath("$.id").value(loadId.toString()));

        ArgumentCaptor<StatusUpdateRequest> captor = ArgumentCaptor.forClass(StatusUpdateRequest.class);
        verify(lifecycleService).updateStatus(eq(loadId), captor.capture());
        assertThat(captor.getValue().status()).isEqualTo(LoadStatus.RESERVED);
        assertThat(captor.getValue().details()).containsEntry("reason", "carrier hold");
    }

    @Test
    @DisplayName("Rejected transition maps to 409 with from and to")
    void invalidTransition() throws Exception {
        when(lifecycleService.updateStatus(eq(loadId), any()))
                .thenThrow(new InvalidStatusTransitionException(loadId, LoadStatus.PENDING, LoadStatus.ASSIGNED));

        mockMvc.perform(put("/loads/{id}/status", loadId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"ASSIGNED\", \"actor\": \"ops\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.from").value("PENDING"))
                .andExpect(jsonPath("$.to").value("ASSIGNED"));
    }

    @Test
    void missingActorIsBadRequest() throws Exception {
        mockMvc.perform(put("/loads/{id}/status", loadId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"PENDING\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(lifecycleService);
    }

    @Test
    void serviceArgumentErrorIsBadRequest() throws Exception {
        when(lifecycleService.updateStatus(eq(loadId), any()))
                .thenThrow(new IllegalArgumentException("Latitude and longitude must be provided together"));

        mockMvc.perform(put("/loads/{id}/status", loadId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"PENDING\", \"actor\": \"ops\", \"latitude\": 10.0}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void unknownLoadIsNotFound() throws Exception {
        when(lifecycleService.getLoad(loadId)).thenThrow(new LoadNotFoundException(loadId));

        mockMvc.perform(get("/loads/{id}", loadId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.loadId").value(loadId.toString()));
    }

    @Test
    void persistenceFailureIsServerError() throws Exception {
        when(lifecycleService.getCurrentStatus(loadId))
                .thenThrow(new LoadPersistenceException("Could not read current status", new QueryTimeoutException("slow")));

        mockMvc.perform(get("/loads/{id}/status", loadId))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.title").value("Persistence Error"));
    }

    @Test
    void currentStatus() throws Exception {
        when(lifecycleService.getCurrentStatus(loadId)).thenReturn(LoadStatus.IN_TRANSIT);

        mockMvc.perform(get("/loads/{id}/status", loadId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.loadId").value(loadId.toString()))
                .andExpect(jsonPath("$.status").value("IN_TRANSIT"));
    }

    @Test
    void history() throws Exception {
        when(lifecycleService.getStatusHistory(loadId)).thenReturn(List.of());

        mockMvc.perform(get("/loads/{id}/status/history", loadId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());
    }

    @Test
    void statusCountsWithShipperFilter() throws Exception {
        UUID shipperId = UUID.randomUUID();
        Map<LoadStatus, Long> counts = new EnumMap<>(LoadStatus.class);
        counts.put(LoadStatus.RESERVED, 4L);
        when(lifecycleService.getStatusCounts(new StatusCountFilter(shipperId))).thenReturn(counts);

        mockMvc.perform(get("/loads/status-counts").param("shipperId", shipperId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.RESERVED").value(4));
    }

    @Test
    void transitionRules() throws Exception {
        when(lifecycleService.getTransitionRules()).thenReturn(TransitionRuleTable.asMap());

        mockMvc.perform(get("/loads/transition-rules"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.COMPLETED").isEmpty())
                .andExpect(jsonPath("$.EXPIRED[0]").value("AVAILABLE"));
    }

    @Test
    void createLoad() throws Exception {
        when(lifecycleService.createLoad(any())).thenReturn(loadIn(LoadStatus.CREATED));

        mockMvc.perform(post("/loads")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"shipperId\": \"" + UUID.randomUUID() + "\", \"equipmentType\": \"REFRIGERATED\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("CREATED"));
    }

    @Test
    void deleteLoad() throws Exception {
        mockMvc.perform(delete("/loads/{id}", loadId))
                .andExpect(status().isNoContent());

        verify(lifecycleService).deleteLoad(loadId);
    }

    private Load loadIn(LoadStatus status) {
        Load load = Load.builder().shipperId(UUID.randomUUID()).build();
        ReflectionTestUtils.setField(load, "id", loadId);
        ReflectionTestUtils.setField(load, "status", status);
        return load;
    }
}
