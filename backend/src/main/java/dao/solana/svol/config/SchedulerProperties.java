package dao.solana.svol.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {

    private GenerationConfig generation = new GenerationConfig();
    private ExecutionConfig execution = new ExecutionConfig();

    @Data
    public static class GenerationConfig {
        /**
         * Shortest gap between two consecutive transfers, in seconds.
         */
        private long minIntervalSeconds = 1;

        /**
         * Longest gap between two consecutive transfers, in seconds.
         */
        private long maxIntervalSeconds = 100;

        /**
         * Probability that a gap is drawn from [min, 2 * min] instead of [min, max].
         */
        private double clusterProbability = 0.2;

        /**
         * Shape of the Pareto amount distribution.
         */
        private double paretoShape = 1.5;

        /**
         * Sigma of the log-normal amount distribution.
         */
        private double logNormalSigma = 0.75;

        /**
         * Upper bound on transfers per schedule unless 2 * wallets is larger.
         */
        private int maxTransfers = 50;

        /**
         * Number of recently used wallets a new pair avoids when possible.
         */
        private int recentWalletWindow = 3;
    }

    @Data
    public static class ExecutionConfig {
        /**
         * Retries after the first attempt of a transfer.
         * Default: 3
         */
        private int maxRetries = 3;

        /**
         * Base of the exponential backoff between attempts (in milliseconds).
         * Default: 2000ms
         */
        private long retryBackoffMs = 2000;

        /**
         * Backoff cap (in milliseconds).
         */
        private long maxBackoffMs = 30_000;

        /**
         * How long to wait for a submitted transaction to be confirmed.
         */
        private long confirmationTimeoutSeconds = 30;

        /**
         * Enable/disable the fee spike gate before each transfer.
         */
        private boolean spikeCheckEnabled = true;

        /**
         * On a fee spike, ask for approval instead of failing the transfer.
         */
        private boolean requireApprovalOnSpike = true;

        /**
         * How long a pending approval may wait before it counts as rejected.
         */
        private long approvalTimeoutSeconds = 300;

        /**
         * Skip the chain entirely and report every transfer as confirmed.
         */
        private boolean dryRun = false;

        /**
         * Max number of schedules running at the same time.
         * Default: 4
         */
        private int maxParallelRuns = 4;
    }
}
