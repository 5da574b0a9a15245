package dao.solana.svol.scheduler;

import dao.solana.svol.config.FeeProperties;
import dao.solana.svol.service.FeeOracle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class FeeRefreshScheduler {

    private final FeeOracle feeOracle;
    private final FeeProperties feeProps;

    public FeeRefreshScheduler(FeeOracle feeOracle, FeeProperties feeProps) {
        this.feeOracle = feeOracle;
        this.feeProps = feeProps;
    }

    @Scheduled(fixedDelayString = "${fee.oracle.refresh-interval-ms:60000}")
    public void refreshFeeSample() {
        if (!feeProps.getOracle().isRefreshEnabled()) {
            return;
        }
        feeOracle.refresh();
        log.debug("Fee window: samples={}, recommended={}", feeOracle.sampleCount(), feeOracle.recommendedFee());
    }
}
