package com.purchasingpower.ptcaudit.controller;

import com.purchasingpower.ptcaudit.exception.InvalidRunIdentifierException;
import com.purchasingpower.ptcaudit.exception.ReconciliationException;
import com.purchasingpower.ptcaudit.exception.RunNotFoundException;
import com.purchasingpower.ptcaudit.model.dto.ReconciliationReport;
import com.purchasingpower.ptcaudit.report.ReconciliationReportFormatter;
import com.purchasingpower.ptcaudit.report.ReportMode;
import com.purchasingpower.ptcaudit.service.ReconciliationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST API for run reconciliation.
 *
 * Endpoints:
 * - GET /api/v1/runs/{id}/reconciliation - Structured report as JSON
 * - GET /api/v1/runs/{id}/reconciliation/text - Rendered verify, billing or calling report
 *
 * {id} is a result id (ar-/sk-) or a canvas id (c-); title narrows a canvas to one run.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/runs")
@RequiredArgsConstructor
public class ReconciliationController {

    private final ReconciliationService reconciliationService;
    private final ReconciliationReportFormatter formatter;

    /**
     * Attributed call tree, billing and verification for one run
     */
    @GetMapping("/{id}/reconciliation")
    public ResponseEntity<?> getReconciliation(
            @PathVariable String id,
            @RequestParam(required = false) String title) {
        try {
            ReconciliationReport report = reconciliationService.reconcile(id, title, true);
            return ResponseEntity.ok(report);

        } catch (RunNotFoundException e) {
            log.warn("Reconciliation requested for unknown run: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (InvalidRunIdentifierException e) {
            log.warn("Rejected run identifier: {}", e.getIdentifier());
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (ReconciliationException e) {
            log.error("Reconciliation failed for {}", e.getResultId(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * Same report rendered as plain text
     */
    @GetMapping(value = "/{id}/reconciliation/text", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> getReconciliationText(
            @PathVariable String id,
            @RequestParam(required = false) String title,
            @RequestParam(defaultValue = "false") boolean full,
            @RequestParam(defaultValue = "verify") String mode) {
        ReportMode reportMode;
        try {
            reportMode = ReportMode.fromValue(mode);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown report mode: {}", mode);
            return ResponseEntity.badRequest().body("Unknown mode '" + mode + "', expected verify, billing or calling\n");
        }

        try {
            ReconciliationReport report = reportMode == ReportMode.CALLING
                    ? reconciliationService.traceCalls(id, title)
                    : reconciliationService.reconcile(id, title, full);
            return ResponseEntity.ok(formatter.render(report, reportMode, full));

        } catch (RunNotFoundException e) {
            log.warn("Reconciliation requested for unknown run: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.getMessage() + "\n");
        } catch (InvalidRunIdentifierException e) {
            log.warn("Rejected run identifier: {}", e.getIdentifier());
            return ResponseEntity.badRequest().body(e.getMessage() + "\n");
        } catch (ReconciliationException e) {
            log.error("Reconciliation failed for {}", e.getResultId(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(e.getMessage() + "\n");
        }
    }
}
