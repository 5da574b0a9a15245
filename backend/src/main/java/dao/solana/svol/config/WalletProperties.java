package dao.solana.svol.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "wallet")
@Data
public class WalletProperties {

    /**
     * Base58 encoded 64-byte secret keys loaded into the in-memory key provider at startup.
     * Keep these out of version control; the usual source is an environment variable.
     */
    private List<String> secretKeys = new ArrayList<>();
}
