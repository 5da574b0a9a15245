package dao.solana.svol.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "token")
@Data
public class TokenProperties {

    /**
     * Decimals assumed for a mint when the request does not carry them.
     * SOL and most pump.fun style mints use 9 and 6 respectively.
     */
    private int defaultDecimals = 9;
}
