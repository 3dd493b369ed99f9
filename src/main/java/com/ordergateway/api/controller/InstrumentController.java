package com.ordergateway.api.controller;

import com.ordergateway.service.BrokerService;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Size precision per instrument.
 *
 * <ul>
 *   <li>GET /api/instruments/{instrument}/precision -- decimal places an order size may carry</li>
 *   <li>POST /api/instruments/{instrument}/precision/refresh -- re-read asset metadata on next use</li>
 *   <li>POST /api/instruments/precision/refresh -- clear the whole precision cache</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/instruments")
public class InstrumentController {

    private final BrokerService brokerService;

    public InstrumentController(BrokerService brokerService) {
        this.brokerService = brokerService;
    }

    @GetMapping("/{instrument}/precision")
    public ResponseEntity<Map<String, Object>> getPrecision(@PathVariable String instrument) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("instrument", instrument);
        body.put("precision", brokerService.getPrecision(instrument));
        return ResponseEntity.ok(body);
    }

    @PostMapping("/{instrument}/precision/refresh")
    public ResponseEntity<Map<String, Object>> refreshPrecision(@PathVariable String instrument) {
        brokerService.refreshPrecision(instrument);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("instrument", instrument);
        body.put("refreshed", true);
        return ResponseEntity.ok(body);
    }

    @PostMapping("/precision/refresh")
    public ResponseEntity<Map<String, Object>> refreshAllPrecision() {
        brokerService.refreshPrecision(null);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("refreshed", true);
        return ResponseEntity.ok(body);
    }
}
