package com.ordergateway.api.controller;

import com.ordergateway.domain.model.ReconciliationResult;
import com.ordergateway.service.BrokerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST /api/reconciliation -- runs a reconciliation pass now and returns its result.
 * A failed pass is reported in the body ({@code success=false}), not as an HTTP error.
 */
@RestController
@RequestMapping("/api/reconciliation")
public class ReconciliationController {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationController.class);

    private final BrokerService brokerService;

    public ReconciliationController(BrokerService brokerService) {
        this.brokerService = brokerService;
    }

    @PostMapping
    public ResponseEntity<ReconciliationResult> reconcile() {
        log.info("Manual reconciliation requested");
        return ResponseEntity.ok(brokerService.reconcile());
    }
}
