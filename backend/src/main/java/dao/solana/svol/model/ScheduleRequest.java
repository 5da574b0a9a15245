package dao.solana.svol.model;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

@Data
public class ScheduleRequest {

    @NotBlank
    private String motherWallet;

    @NotEmpty
    private List<String> childWallets;

    /** Optional: number of wallets expected; generation fails if fewer addresses are supplied. */
    private Integer walletCount;

    @NotBlank
    private String tokenMint;

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal totalVolume;   // token units, not base units

    @Min(0)
    @Max(18)
    private Integer tokenDecimals;

    private Long startTime;           // unix seconds, defaults to now

    private Long minIntervalSeconds;

    private Long maxIntervalSeconds;
}
