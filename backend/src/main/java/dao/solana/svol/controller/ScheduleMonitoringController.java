package dao.solana.svol.controller;

import dao.solana.svol.config.SchedulerProperties;
import dao.solana.svol.event.ScheduleProgressTracker;
import dao.solana.svol.event.TransferEvent;
import dao.solana.svol.model.Schedule;
import dao.solana.svol.model.ScheduleStatus;
import dao.solana.svol.model.TransferOp;
import dao.solana.svol.model.TransferStatus;
import dao.solana.svol.service.FeeOracle;
import dao.solana.svol.service.PendingApprovalRegistry;
import dao.solana.svol.service.ScheduleRunService;
import dao.solana.svol.service.ScheduleService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view over schedules, runs, the fee window and pending approvals.
 */
@Slf4j
@RestController
@RequestMapping("/api/monitor")
public class ScheduleMonitoringController {

    private final ScheduleService scheduleService;
    private final ScheduleRunService runService;
    private final ScheduleProgressTracker progressTracker;
    private final PendingApprovalRegistry approvals;
    private final FeeOracle feeOracle;
    private final SchedulerProperties schedulerProps;

    public ScheduleMonitoringController(ScheduleService scheduleService,
                                        ScheduleRunService runService,
                                        ScheduleProgressTracker progressTracker,
                                        PendingApprovalRegistry approvals,
                                        FeeOracle feeOracle,
                                        SchedulerProperties schedulerProps) {
        this.scheduleService = scheduleService;
        this.runService = runService;
        this.progressTracker = progressTracker;
        this.approvals = approvals;
        this.feeOracle = feeOracle;
        this.schedulerProps = schedulerProps;
    }

    /**
     * GET /api/monitor/stats
     */
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        Map<String, Object> response = new LinkedHashMap<>();

        List<Schedule> schedules = scheduleService.getSchedules();
        List<TransferOp> transfers = schedules.stream().flatMap(s -> s.getTransfers().stream()).toList();

        Map<String, Object> scheduleStats = new LinkedHashMap<>();
        scheduleStats.put("total", schedules.size());
        for (ScheduleStatus s : ScheduleStatus.values()) {
            scheduleStats.put(s.name().toLowerCase(), schedules.stream().filter(x -> x.getStatus() == s).count());
        }
        scheduleStats.put("activeRuns", runService.activeRuns().size());

        Map<String, Object> transferStats = new LinkedHashMap<>();
        transferStats.put("total", transfers.size());
        for (TransferStatus s : TransferStatus.values()) {
            transferStats.put(s.name().toLowerCase(), transfers.stream().filter(t -> t.getStatus() == s).count());
        }

        response.put("status", "SUCCESS");
        response.put("execution", Map.of(
                "maxRetries", schedulerProps.getExecution().getMaxRetries(),
                "maxParallelRuns", schedulerProps.getExecution().getMaxParallelRuns(),
                "dryRun", schedulerProps.getExecution().isDryRun(),
                "spikeCheckEnabled", schedulerProps.getExecution().isSpikeCheckEnabled()
        ));
        response.put("fees", Map.of(
                "samples", feeOracle.sampleCount(),
                "average", feeOracle.averageFee().toPlainString(),
                "recommended", feeOracle.recommendedFee(),
                "spikeLimit", feeOracle.spikeLimit().toPlainString()
        ));
        response.put("schedules", scheduleStats);
        response.put("transfers", transferStats);
        response.put("pendingApprovals", approvals.pending().size());
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/monitor/schedules
     * All schedules with their last reported progress
     */
    @GetMapping("/schedules")
    public ResponseEntity<Map<String, Object>> getSchedules() {
        Map<String, Object> response = new LinkedHashMap<>();
        try {
            List<Map<String, Object>> infos = new ArrayList<>();
            for (Schedule schedule : scheduleService.getSchedules()) {
                Map<String, Object> info = new LinkedHashMap<>();
                info.put("id", schedule.getId());
                info.put("status", schedule.getStatus().name());
                info.put("transferCount", schedule.getTransfers().size());
                info.put("completed", schedule.countByStatus(TransferStatus.COMPLETED));
                info.put("failed", schedule.countByStatus(TransferStatus.FAILED));
                info.put("pending", schedule.countByStatus(TransferStatus.PENDING));
                info.put("running", runService.find(schedule.getId()).map(r -> !r.isFinished()).orElse(false));
                info.put("lastProgress", progressTracker.lastProgress(schedule.getId()).map(TransferEvent::data).orElse(null));
                infos.add(info);
            }
            response.put("status", "SUCCESS");
            response.put("totalSchedules", infos.size());
            response.put("schedules", infos);
        } catch (Exception e) {
            log.error("Error getting schedules", e);
            response.put("status", "ERROR");
            response.put("error", e.getMessage());
            return ResponseEntity.status(500).body(response);
        }
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/monitor/approvals
     * Fee spike approvals waiting for an answer
     */
    @GetMapping("/approvals")
    public ResponseEntity<Map<String, Object>> getPendingApprovals() {
        Map<String, Object> response = new LinkedHashMap<>();
        List<Map<String, Object>> infos = new ArrayList<>();
        for (PendingApprovalRegistry.PendingApproval p : approvals.pending()) {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("approvalId", p.approvalId());
            info.put("scheduleId", p.context().scheduleId());
            info.put("from", p.context().from());
            info.put("to", p.context().to());
            info.put("amount", p.context().amount().toPlainString());
            info.put("estimatedFee", p.context().estimatedFee());
            info.put("averageFee", p.context().averageFee().toPlainString());
            info.put("spikeMultiplier", p.context().spikeMultiplier().toPlainString());
            info.put("requestedAt", p.requestedAt().toString());
            infos.add(info);
        }
        response.put("status", "SUCCESS");
        response.put("approvals", infos);
        return ResponseEntity.ok(response);
    }
}
