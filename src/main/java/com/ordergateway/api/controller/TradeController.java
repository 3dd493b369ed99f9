package com.ordergateway.api.controller;

import com.ordergateway.domain.model.Trade;
import com.ordergateway.service.BrokerService;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for fills recorded during the session.
 *
 * <ul>
 *   <li>GET /api/trades?instrument= -- all trades, with unrealised P&amp;L from the current mark</li>
 *   <li>GET /api/trades/{tradeId} -- one trade</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/trades")
public class TradeController {

    private final BrokerService brokerService;

    public TradeController(BrokerService brokerService) {
        this.brokerService = brokerService;
    }

    @GetMapping
    public ResponseEntity<List<Trade>> listTrades(@RequestParam(required = false) String instrument) {
        return ResponseEntity.ok(brokerService.getTrades(instrument));
    }

    @GetMapping("/{tradeId}")
    public ResponseEntity<Trade> getTrade(@PathVariable String tradeId) {
        return ResponseEntity.ok(brokerService.getTradeDetails(tradeId));
    }
}
