package com.ordergateway.unit.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ordergateway.api.controller.TradeController;
import com.ordergateway.config.ApiResponseAdvice;
import com.ordergateway.domain.enums.OrderSide;
import com.ordergateway.domain.model.Trade;
import com.ordergateway.exception.GlobalExceptionHandler;
import com.ordergateway.exception.ResourceNotFoundException;
import com.ordergateway.service.BrokerService;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class TradeControllerTest {

    private MockMvc mockMvc;

    @Mock
    private BrokerService brokerService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        mockMvc = MockMvcBuilders.standaloneSetup(new TradeController(brokerService))
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    private Trade sampleTrade() {
        return Trade.builder()
                .id("A-F1")
                .orderId("A")
                .instrument("AAPL")
                .side(OrderSide.BUY)
                .size(new BigDecimal("10"))
                .fillPrice(new BigDecimal("100"))
                .unrealizedPnl(new BigDecimal("30"))
                .strategyTag("momentum")
                .build();
    }

    @Test
    void listTrades_returnsTradesWithPnl() throws Exception {
        when(brokerService.getTrades("AAPL")).thenReturn(List.of(sampleTrade()));

        mockMvc.perform(get("/api/trades").param("instrument", "AAPL"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].id").value("A-F1"))
                .andExpect(jsonPath("$.data[0].direction").value(1))
                .andExpect(jsonPath("$.data[0].unrealizedPnl").value(30));
    }

    @Test
    void getTrade_returnsTrade() throws Exception {
        when(brokerService.getTradeDetails("A-F1")).thenReturn(sampleTrade());

        mockMvc.perform(get("/api/trades/A-F1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.orderId").value("A"));
    }

    @Test
    void getTrade_unknownReturns404() throws Exception {
        when(brokerService.getTradeDetails("X")).thenThrow(new ResourceNotFoundException("Trade", "X"));

        mockMvc.perform(get("/api/trades/X")).andExpect(status().isNotFound());
    }
}
