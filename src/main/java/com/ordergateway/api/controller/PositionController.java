package com.ordergateway.api.controller;

import com.ordergateway.domain.model.Position;
import com.ordergateway.service.BrokerService;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /api/positions?instrument= -- venue positions as of the last reconciliation pass.
 */
@RestController
@RequestMapping("/api/positions")
public class PositionController {

    private final BrokerService brokerService;

    public PositionController(BrokerService brokerService) {
        this.brokerService = brokerService;
    }

    @GetMapping
    public ResponseEntity<List<Position>> listPositions(@RequestParam(required = false) String instrument) {
        return ResponseEntity.ok(brokerService.getPositions(instrument));
    }
}
