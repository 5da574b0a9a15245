package dao.solana.svol.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;

@Configuration
@ConfigurationProperties(prefix = "fee")
@Data
public class FeeProperties {

    private Oracle oracle = new Oracle();
    private Service service = new Service();

    @Data
    public static class Oracle {
        /**
         * Number of recent fee samples kept for averaging (oldest evicted first).
         */
        private int windowSize = 20;

        /**
         * Fee recommended while no sample has been observed yet.
         */
        private long defaultFee = 5000;

        /**
         * Multiplier applied to the window mean for the recommended fee.
         */
        private BigDecimal safetyMargin = new BigDecimal("1.1");

        /**
         * A fee above mean * spikeThreshold is a spike. Must be >= 1.0.
         */
        private BigDecimal spikeThreshold = new BigDecimal("1.5");

        /**
         * Enable/disable the periodic fee sample refresh.
         */
        private boolean refreshEnabled = true;

        /**
         * How often to pull a new fee sample (in milliseconds)
         * Default: 60000ms (1 minute)
         */
        private long refreshIntervalMs = 60_000;
    }

    @Data
    public static class Service {
        /**
         * Service fee as a fraction of volume, 0.001 = 0.1%.
         */
        private BigDecimal rate = new BigDecimal("0.001");

        /**
         * Wallet receiving service fee transfers (base58). Blank disables fee transfers.
         */
        private String wallet;
    }
}
