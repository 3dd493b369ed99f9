package com.ordergateway.api.controller;

import com.ordergateway.domain.model.AccountSummary;
import com.ordergateway.service.BrokerService;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for venue account figures. Every call reads the venue.
 *
 * <ul>
 *   <li>GET /api/account -- equity, cash, portfolio value, buying power</li>
 *   <li>GET /api/account/nav -- net asset value (portfolio value)</li>
 *   <li>GET /api/account/balance -- the figure selected by gateway.account.balance-source</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/account")
public class AccountController {

    private final BrokerService brokerService;

    public AccountController(BrokerService brokerService) {
        this.brokerService = brokerService;
    }

    @GetMapping
    public ResponseEntity<AccountSummary> getAccount() {
        return ResponseEntity.ok(brokerService.getAccount());
    }

    @GetMapping("/nav")
    public ResponseEntity<Map<String, Object>> getNav() {
        BigDecimal nav = brokerService.getNav();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("nav", nav);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/balance")
    public ResponseEntity<Map<String, Object>> getBalance() {
        BigDecimal balance = brokerService.getBalance();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("balance", balance);
        body.put("source", brokerService.getBalanceSource());
        return ResponseEntity.ok(body);
    }
}
