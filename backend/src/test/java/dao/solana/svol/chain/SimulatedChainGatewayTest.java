package dao.solana.svol.chain;

import dao.solana.svol.TestKeys;
import dao.solana.svol.config.SchedulerProperties;
import dao.solana.svol.event.EventBus;
import dao.solana.svol.model.TransferOp;
import dao.solana.svol.model.TransferResult;
import dao.solana.svol.service.FeeOracle;
import dao.solana.svol.service.TransactionExecutor;
import dao.solana.svol.wallet.SigningSecret;
import org.bitcoinj.core.Base58;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SimulatedChainGatewayTest {

    @Test
    @DisplayName("Test fee samples stay within 10% of the base fee")
    void testFeeSamples() {
        SimulatedChainGateway chain = new SimulatedChainGateway(5000);

        for (int i = 0; i < 200; i++) {
            long fee = chain.latestFeeSample();
            assertTrue(fee >= 4500 && fee <= 5500, "fee " + fee);
        }
        assertEquals(32, Base58.decode(chain.recentBlockhash()).length);
    }

    @Test
    @DisplayName("Test only submitted transactions confirm")
    void testConfirm() {
        SimulatedChainGateway chain = new SimulatedChainGateway(5000);

        String sig = chain.submit(new SignedTransaction("sig-1", new byte[]{1}, "a", "b", 1));

        assertTrue(chain.confirm(sig, Duration.ofSeconds(1)).confirmed());
        assertFalse(chain.confirm("other", Duration.ofSeconds(1)).confirmed());
        assertEquals(1, chain.submittedCount());
    }

    @Test
    @DisplayName("Test a transfer signed by the real factory goes through the simulated chain")
    void testEndToEndSimulated() {
        // Arrange
        SimulatedChainGateway chain = new SimulatedChainGateway(5000);
        SolanaTransactionFactory factory = new SolanaTransactionFactory(chain, SolanaTransactionFactory.SYSTEM_PROGRAM);
        Clock clock = Clock.systemUTC();
        FeeOracle oracle = new FeeOracle(chain, 20, 5000, new BigDecimal("1.1"), new BigDecimal("1.5"), clock);
        TransactionExecutor executor = new TransactionExecutor(chain, factory, oracle, new EventBus(1), null,
                new SchedulerProperties.ExecutionConfig(), clock);
        TestKeys.Generated sender = TestKeys.generate();
        TransferOp op = new TransferOp(sender.address(), TestKeys.randomAddress(), new BigDecimal("0.25"),
                SolanaTransactionFactory.SYSTEM_PROGRAM, 9, clock.instant());

        // Act
        TransferResult result;
        try (SigningSecret secret = new SigningSecret(sender.secretKey())) {
            result = executor.execute(op, secret);
        }

        // Assert
        assertTrue(result.isConfirmed());
        assertEquals(1, chain.submittedCount());
        assertEquals(64, Base58.decode(result.txHash()).length);
    }
}
