package dao.solana.svol.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "chain")
@Data
public class ChainProperties {

    /**
     * Which backend transfers are sent to.
     * SIMULATED: in-process gateway, nothing leaves the JVM.
     * RPC: Solana JSON-RPC endpoint below.
     */
    private Mode mode = Mode.SIMULATED;

    /**
     * Solana JSON-RPC endpoint
     * Example: https://api.devnet.solana.com
     */
    private String rpcEndpoint = "https://api.devnet.solana.com";

    /**
     * Commitment level required before a transfer counts as confirmed.
     */
    private String commitment = "confirmed";

    /**
     * Sentinel mint meaning "native SOL transfer".
     */
    private String nativeMint = "11111111111111111111111111111111";

    /**
     * Signature status polling settings (to reduce RPC load).
     */
    private Polling polling = new Polling();

    /**
     * Baseline fee sample reported by the simulated gateway (micro-lamports per CU).
     */
    private long simulatedBaseFee = 5000;

    public enum Mode {
        SIMULATED,
        RPC
    }

    @Data
    public static class Polling {
        /**
         * Initial poll interval for getSignatureStatuses.
         */
        private long confirmPollInitialMs = 400;
        /**
         * Maximum poll interval for getSignatureStatuses (backoff cap).
         */
        private long confirmPollMaxMs = 2000;
    }
}
