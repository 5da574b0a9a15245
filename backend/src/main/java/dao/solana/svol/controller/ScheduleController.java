package dao.solana.svol.controller;

import dao.solana.svol.exception.ScheduleValidationException;
import dao.solana.svol.model.FundingRequest;
import dao.solana.svol.model.Schedule;
import dao.solana.svol.model.ScheduleRequest;
import dao.solana.svol.model.TransferOp;
import dao.solana.svol.service.PendingApprovalRegistry;
import dao.solana.svol.service.ScheduleRun;
import dao.solana.svol.service.ScheduleService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/schedules")
public class ScheduleController {

    private final ScheduleService scheduleService;
    private final PendingApprovalRegistry approvals;

    public ScheduleController(ScheduleService scheduleService, PendingApprovalRegistry approvals) {
        this.scheduleService = scheduleService;
        this.approvals = approvals;
    }

    /**
     * POST /api/schedules
     * Generate a new schedule
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> createSchedule(@Valid @RequestBody ScheduleRequest req) {
        Map<String, Object> response = new LinkedHashMap<>();
        try {
            Schedule schedule = scheduleService.create(req);
            response.put("status", "SUCCESS");
            response.put("schedule", buildScheduleInfo(schedule));
            return ResponseEntity.status(201).body(response);
        } catch (ScheduleValidationException e) {
            response.put("status", "INVALID");
            response.put("error", e.getMessage());
            return ResponseEntity.badRequest().body(response);
        }
    }

    /**
     * POST /api/schedules/{id}/funding
     * Rescale a pending schedule to the amount actually funded
     */
    @PostMapping("/{id}/funding")
    public ResponseEntity<Map<String, Object>> applyFunding(@PathVariable String id,
                                                            @Valid @RequestBody FundingRequest req) {
        Map<String, Object> response = new LinkedHashMap<>();
        try {
            Schedule schedule = scheduleService.applyFunding(id, req.getActualFunded());
            response.put("status", "SUCCESS");
            response.put("schedule", buildScheduleInfo(schedule));
            return ResponseEntity.ok(response);
        } catch (ScheduleValidationException e) {
            response.put("status", "INVALID");
            response.put("error", e.getMessage());
            return ResponseEntity.badRequest().body(response);
        } catch (IllegalArgumentException e) {
            return notFound(response, e);
        } catch (IllegalStateException e) {
            return conflict(response, e);
        }
    }

    /**
     * POST /api/schedules/{id}/start
     */
    @PostMapping("/{id}/start")
    public ResponseEntity<Map<String, Object>> start(@PathVariable String id) {
        Map<String, Object> response = new LinkedHashMap<>();
        try {
            ScheduleRun run = scheduleService.start(id);
            response.put("status", "STARTED");
            response.put("scheduleId", run.getScheduleId());
            response.put("startedAt", run.getStartedAt().toString());
            return ResponseEntity.accepted().body(response);
        } catch (IllegalArgumentException e) {
            return notFound(response, e);
        } catch (IllegalStateException e) {
            return conflict(response, e);
        }
    }

    /**
     * POST /api/schedules/{id}/stop
     */
    @PostMapping("/{id}/stop")
    public ResponseEntity<Map<String, Object>> stop(@PathVariable String id) {
        Map<String, Object> response = new LinkedHashMap<>();
        try {
            boolean requested = scheduleService.stop(id);
            response.put("status", requested ? "STOP_REQUESTED" : "NOT_RUNNING");
            response.put("scheduleId", id);
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            return notFound(response, e);
        }
    }

    /**
     * GET /api/schedules/{id}
     */
    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> getSchedule(@PathVariable String id) {
        Map<String, Object> response = new LinkedHashMap<>();
        try {
            Schedule schedule = scheduleService.get(id);
            response.put("status", "SUCCESS");
            response.put("schedule", buildScheduleInfo(schedule));
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            return notFound(response, e);
        }
    }

    /**
     * POST /api/schedules/{id}/approvals/{approvalId}?approved=true|false
     * Answer a pending fee spike approval
     */
    @PostMapping("/{id}/approvals/{approvalId}")
    public ResponseEntity<Map<String, Object>> resolveApproval(@PathVariable String id,
                                                               @PathVariable String approvalId,
                                                               @RequestParam boolean approved) {
        Map<String, Object> response = new LinkedHashMap<>();
        boolean belongsToSchedule = approvals.pendingFor(id).stream()
                .anyMatch(p -> p.approvalId().equals(approvalId));
        if (!belongsToSchedule || !approvals.resolve(approvalId, approved)) {
            response.put("status", "NOT_FOUND");
            response.put("error", "No pending approval " + approvalId + " for schedule " + id);
            return ResponseEntity.status(404).body(response);
        }
        response.put("status", approved ? "APPROVED" : "REJECTED");
        response.put("approvalId", approvalId);
        return ResponseEntity.ok(response);
    }

    static Map<String, Object> buildScheduleInfo(Schedule schedule) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("id", schedule.getId());
        info.put("motherWallet", schedule.getMotherWallet());
        info.put("childWallets", schedule.getChildWallets());
        info.put("tokenMint", schedule.getTokenMint());
        info.put("tokenDecimals", schedule.getTokenDecimals());
        info.put("totalVolume", schedule.getTotalVolume().toPlainString());
        info.put("serviceFeeTotal", schedule.getServiceFeeTotal().toPlainString());
        info.put("status", schedule.getStatus().name());
        info.put("createdAt", schedule.getCreatedAt() != null ? schedule.getCreatedAt().toString() : null);
        info.put("completedAt", schedule.getCompletedAt() != null ? schedule.getCompletedAt().toString() : null);

        List<Map<String, Object>> transfers = new ArrayList<>();
        List<TransferOp> ops = schedule.getTransfers();
        for (int i = 0; i < ops.size(); i++) {
            transfers.add(buildTransferInfo(ops.get(i), i));
        }
        info.put("transferCount", transfers.size());
        info.put("transfers", transfers);
        return info;
    }

    private static Map<String, Object> buildTransferInfo(TransferOp t, int index) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("index", index);
        info.put("from", t.getFrom());
        info.put("to", t.getTo());
        info.put("amount", t.getAmount().toPlainString());
        info.put("serviceFee", t.isServiceFee());
        info.put("scheduledAt", t.getScheduledAt().toString());
        info.put("status", t.getStatus().name());
        info.put("executedAt", t.getExecutedAt() != null ? t.getExecutedAt().toString() : null);
        info.put("txHash", t.getTxHash());
        info.put("retryCount", t.getRetryCount());
        info.put("fee", t.getFeeLamports());
        info.put("error", t.getErrorMessage());
        return info;
    }

    private static ResponseEntity<Map<String, Object>> notFound(Map<String, Object> response, Exception e) {
        response.put("status", "NOT_FOUND");
        response.put("error", e.getMessage());
        return ResponseEntity.status(404).body(response);
    }

    private static ResponseEntity<Map<String, Object>> conflict(Map<String, Object> response, Exception e) {
        response.put("status", "CONFLICT");
        response.put("error", e.getMessage());
        return ResponseEntity.status(409).body(response);
    }
}
