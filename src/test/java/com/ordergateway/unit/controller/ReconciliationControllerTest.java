package com.ordergateway.unit.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ordergateway.api.controller.ReconciliationController;
import com.ordergateway.config.ApiResponseAdvice;
import com.ordergateway.domain.model.ReconciliationResult;
import com.ordergateway.exception.GlobalExceptionHandler;
import com.ordergateway.service.BrokerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class ReconciliationControllerTest {

    private MockMvc mockMvc;

    @Mock
    private BrokerService brokerService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        mockMvc = MockMvcBuilders.standaloneSetup(new ReconciliationController(brokerService))
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    @Test
    void reconcile_returnsResult() throws Exception {
        when(brokerService.reconcile())
                .thenReturn(ReconciliationResult.builder()
                        .trigger("MANUAL")
                        .ordersUpdated(2)
                        .shadowOrdersCreated(1)
                        .build());

        mockMvc.perform(post("/api/reconciliation"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.trigger").value("MANUAL"))
                .andExpect(jsonPath("$.data.ordersUpdated").value(2))
                .andExpect(jsonPath("$.data.success").value(true));
    }

    @Test
    void reconcile_failedPassIsStill200() throws Exception {
        when(brokerService.reconcile())
                .thenReturn(ReconciliationResult.builder()
                        .trigger("MANUAL")
                        .success(false)
                        .failureMessage("paper venue unavailable")
                        .build());

        mockMvc.perform(post("/api/reconciliation"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.success").value(false))
                .andExpect(jsonPath("$.data.failureMessage").value("paper venue unavailable"));
    }
}
