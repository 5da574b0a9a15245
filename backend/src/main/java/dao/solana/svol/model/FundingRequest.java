package dao.solana.svol.model;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class FundingRequest {

    /** Amount actually funded to the child wallets, in token units. */
    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal actualFunded;
}
