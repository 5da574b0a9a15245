package dao.solana.svol.service;

import dao.solana.svol.model.Schedule;
import dao.solana.svol.model.ScheduleRequest;
import dao.solana.svol.repository.ScheduleRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Entry point used by the REST layer: generate, fund, start and stop schedules.
 */
@Slf4j
@Service
public class ScheduleService {

    private final ScheduleGenerator generator;
    private final FeeCollector feeCollector;
    private final ScheduleRunService runService;
    private final ScheduleRepository repository;

    public ScheduleService(ScheduleGenerator generator,
                           FeeCollector feeCollector,
                           ScheduleRunService runService,
                           ScheduleRepository repository) {
        this.generator = generator;
        this.feeCollector = feeCollector;
        this.runService = runService;
        this.repository = repository;
    }

    public Schedule create(ScheduleRequest request) {
        Schedule schedule = generator.generateSchedule(request);
        if (!generator.verifyTransfers(schedule.getTransfers(), schedule.getTotalVolume().subtract(schedule.getServiceFeeTotal()))) {
            throw new IllegalStateException("Generated schedule " + schedule.getId() + " failed verification");
        }
        repository.save(schedule);
        return schedule;
    }

    /**
     * Resize a pending schedule to the amount that actually reached the child wallets.
     * Holds the schedule's lock, which {@link ScheduleRunService#start} also takes.
     */
    public Schedule applyFunding(String scheduleId, BigDecimal actualFunded) {
        Schedule schedule = get(scheduleId);
        synchronized (schedule) {
            if (runService.find(scheduleId).isPresent()) {
                throw new IllegalStateException("Schedule " + scheduleId + " has already been started");
            }
            feeCollector.adjustSchedule(schedule, actualFunded);
            if (!generator.verifyTransfers(schedule.getTransfers(),
                    schedule.getTotalVolume().subtract(schedule.getServiceFeeTotal()))) {
                throw new IllegalStateException("Adjusted schedule " + scheduleId + " failed verification");
            }
        }
        repository.save(schedule);
        return schedule;
    }

    public ScheduleRun start(String scheduleId) {
        return runService.start(get(scheduleId));
    }

    public boolean stop(String scheduleId) {
        get(scheduleId);
        return runService.stop(scheduleId);
    }

    /**
     * @throws IllegalArgumentException if no such schedule exists
     */
    public Schedule get(String scheduleId) {
        return repository.findById(scheduleId)
                .orElseThrow(() -> new IllegalArgumentException("Schedule not found: " + scheduleId));
    }

    public List<Schedule> getSchedules() {
        return repository.findAll();
    }
}
