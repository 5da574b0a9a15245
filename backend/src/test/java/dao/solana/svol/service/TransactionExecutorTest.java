package dao.solana.svol.service;

import dao.solana.svol.TestKeys;
import dao.solana.svol.chain.ChainGateway;
import dao.solana.svol.chain.ConfirmationResult;
import dao.solana.svol.chain.SignedTransaction;
import dao.solana.svol.chain.TransactionFactory;
import dao.solana.svol.config.SchedulerProperties;
import dao.solana.svol.event.EventBus;
import dao.solana.svol.event.EventType;
import dao.solana.svol.event.TransferEvent;
import dao.solana.svol.exception.ChainRpcException;
import dao.solana.svol.exception.GasSpikeException;
import dao.solana.svol.exception.InsufficientFundsException;
import dao.solana.svol.model.ApprovalContext;
import dao.solana.svol.model.ExecutionOutcome;
import dao.solana.svol.model.TransferOp;
import dao.solana.svol.model.TransferResult;
import dao.solana.svol.wallet.SigningSecret;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TransactionExecutorTest {

    private static final Instant NOW = Instant.parse("2026-02-01T00:00:00Z");
    private static final String NATIVE_MINT = "11111111111111111111111111111111";

    @Mock
    private ChainGateway chain;

    @Mock
    private TransactionFactory factory;

    @Mock
    private EventBus eventBus;

    private final AtomicLong liveFee = new AtomicLong(5000);
    private Clock clock;
    private FeeOracle feeOracle;
    private SchedulerProperties.ExecutionConfig config;
    private TransferOp transfer;
    private SigningSecret signer;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
        feeOracle = new FeeOracle(liveFee::get, 20, 5000, new BigDecimal("1.1"), new BigDecimal("1.5"), clock);
        config = new SchedulerProperties.ExecutionConfig();
        config.setRetryBackoffMs(0);
        config.setMaxBackoffMs(0);
        config.setConfirmationTimeoutSeconds(1);
        config.setApprovalTimeoutSeconds(1);

        TestKeys.Generated keys = TestKeys.generate();
        signer = new SigningSecret(keys.secretKey());
        transfer = new TransferOp(keys.address(), TestKeys.randomAddress(), new BigDecimal("1.5"), NATIVE_MINT, 9, NOW);
        transfer.markInProgress();
    }

    private TransactionExecutor executor(ApprovalCallback callback) {
        return new TransactionExecutor(chain, factory, feeOracle, eventBus, callback, config, clock);
    }

    private void stubBuild() {
        when(chain.recentBlockhash()).thenReturn("blockhash");
        when(factory.build(any(), any(), anyLong(), anyString())).thenAnswer(inv -> {
            long fee = inv.getArgument(2);
            return new SignedTransaction("sig-" + fee, new byte[]{1, 2, 3}, transfer.getFrom(), transfer.getTo(), fee);
        });
    }

    // quiet window, then a live fee above the 7500 spike limit
    private void seedQuietWindow() {
        for (int i = 0; i < 5; i++) feeOracle.recordObservation(1000);
        liveFee.set(9000);
    }

    private List<EventType> publishedTypes() {
        ArgumentCaptor<TransferEvent> captor = ArgumentCaptor.forClass(TransferEvent.class);
        verify(eventBus, atLeastOnce()).publish(captor.capture());
        return captor.getAllValues().stream().map(TransferEvent::type).toList();
    }

    @Test
    @DisplayName("Test confirmed on the first attempt at the recommended fee")
    void testConfirmedFirstAttempt() {
        // Arrange
        stubBuild();
        when(chain.submit(any())).thenAnswer(inv -> ((SignedTransaction) inv.getArgument(0)).signature());
        when(chain.confirm(anyString(), any())).thenReturn(ConfirmationResult.ok());

        // Act
        TransferResult result = executor(null).execute(transfer, signer);

        // Assert
        // empty window: sample 5000 is recorded, recommended becomes 5000 * 1.1
        assertEquals(ExecutionOutcome.CONFIRMED, result.outcome());
        assertEquals("sig-5500", result.txHash());
        assertEquals(5500L, result.feeUsed());
        assertEquals(0, result.retryCount());
        assertEquals(List.of(EventType.TRANSACTION_SENT, EventType.TRANSACTION_CONFIRMED), publishedTypes());
    }

    @Test
    @DisplayName("Test retry escalates the fee by 25% and then 50% over the previous attempt")
    void testRetryEscalatesFee() {
        // Arrange
        stubBuild();
        when(chain.submit(any()))
                .thenThrow(new ChainRpcException("node is behind"))
                .thenThrow(new ChainRpcException("blockhash not found"))
                .thenAnswer(inv -> ((SignedTransaction) inv.getArgument(0)).signature());
        when(chain.confirm(anyString(), any())).thenReturn(ConfirmationResult.ok());

        // Act
        TransferResult result = executor(null).execute(transfer, signer);

        // Assert
        assertTrue(result.isConfirmed());
        assertEquals(2, result.retryCount());
        verify(factory).build(any(), any(), eq(5500L), anyString());
        verify(factory).build(any(), any(), eq(6875L), anyString());
        verify(factory).build(any(), any(), eq(10313L), anyString());
        assertEquals(10313L, result.feeUsed());
        assertEquals(2, publishedTypes().stream().filter(t -> t == EventType.TRANSACTION_RETRY).count());
    }

    @Test
    @DisplayName("Test insufficient funds fails immediately without retrying")
    void testInsufficientFundsNotRetried() {
        // Arrange
        stubBuild();
        when(chain.submit(any())).thenThrow(new ChainRpcException(
                "Transaction simulation failed: Attempt to debit an account but found no record of a prior credit."));

        // Act
        TransferResult result = executor(null).execute(transfer, signer);

        // Assert
        assertEquals(ExecutionOutcome.FAILED, result.outcome());
        assertEquals(0, result.retryCount());
        assertTrue(result.reason().startsWith("Insufficient funds"));
        verify(chain, times(1)).submit(any());
        assertEquals(List.of(EventType.TRANSACTION_FAILED), publishedTypes());
    }

    @Test
    @DisplayName("Test on-chain failure with an insufficient funds error is not retried either")
    void testInsufficientFundsOnConfirmation() {
        stubBuild();
        when(chain.submit(any())).thenReturn("sig");
        when(chain.confirm(anyString(), any())).thenReturn(ConfirmationResult.failed("{InstructionError=[1, InsufficientFunds]}"));

        TransferResult result = executor(null).execute(transfer, signer);

        assertEquals(ExecutionOutcome.FAILED, result.outcome());
        verify(chain, times(1)).submit(any());
    }

    @Test
    @DisplayName("Test confirmation timeouts are retried until retries run out")
    void testTimeoutRetried() {
        // Arrange
        config.setMaxRetries(2);
        stubBuild();
        when(chain.submit(any())).thenReturn("sig");
        when(chain.confirm(anyString(), any())).thenReturn(ConfirmationResult.timedOut());

        // Act
        TransferResult result = executor(null).execute(transfer, signer);

        // Assert
        assertEquals(ExecutionOutcome.FAILED, result.outcome());
        assertEquals(2, result.retryCount());
        verify(chain, times(3)).submit(any());
        assertTrue(result.reason().contains("sig"));
    }

    @Test
    @DisplayName("Test a transfer the factory rejects fails without touching the network again")
    void testInvalidTransferNotRetried() {
        when(chain.recentBlockhash()).thenReturn("blockhash");
        when(factory.build(any(), any(), anyLong(), anyString()))
                .thenThrow(new IllegalArgumentException("Signer does not match sender"));

        TransferResult result = executor(null).execute(transfer, signer);

        assertEquals(ExecutionOutcome.FAILED, result.outcome());
        assertEquals("Signer does not match sender", result.reason());
        verify(chain, never()).submit(any());
        verify(chain, times(1)).recentBlockhash();
    }

    @Test
    @DisplayName("Test fee spike without an approval path raises GasSpikeException")
    void testSpikeWithoutCallback() {
        // Arrange
        seedQuietWindow();

        // Act & Assert
        GasSpikeException e = assertThrows(GasSpikeException.class, () -> executor(null).execute(transfer, signer));
        assertEquals(9000L, e.getCurrentFee());
        verifyNoInteractions(chain, factory);
    }

    @Test
    @DisplayName("Test fee spike with approvals switched off raises GasSpikeException even with a callback")
    void testSpikeWithApprovalDisabled() {
        seedQuietWindow();
        config.setRequireApprovalOnSpike(false);

        assertThrows(GasSpikeException.class, () ->
                executor(ctx -> CompletableFuture.completedFuture(true)).execute(transfer, signer));
    }

    @Test
    @DisplayName("Test rejected approval aborts the transfer")
    void testSpikeRejected() {
        // Arrange
        seedQuietWindow();
        AtomicReference<ApprovalContext> asked = new AtomicReference<>();
        ApprovalCallback reject = ctx -> {
            asked.set(ctx);
            return CompletableFuture.completedFuture(false);
        };

        // Act
        TransferResult result = executor(reject).execute(transfer, signer);

        // Assert
        assertEquals(ExecutionOutcome.ABORTED, result.outcome());
        assertEquals(9000L, asked.get().estimatedFee());
        assertEquals(transfer.getFrom(), asked.get().from());
        verifyNoInteractions(chain, factory);
    }

    @Test
    @DisplayName("Test unanswered approval counts as rejected after the timeout")
    void testSpikeApprovalTimeout() {
        seedQuietWindow();

        TransferResult result = executor(ctx -> new CompletableFuture<>()).execute(transfer, signer);

        assertEquals(ExecutionOutcome.ABORTED, result.outcome());
    }

    @Test
    @DisplayName("Test approved spike is sent at the spiking fee")
    void testSpikeApproved() {
        // Arrange
        seedQuietWindow();
        stubBuild();
        when(chain.submit(any())).thenReturn("sig");
        when(chain.confirm(anyString(), any())).thenReturn(ConfirmationResult.ok());

        // Act
        TransferResult result = executor(ctx -> CompletableFuture.completedFuture(true)).execute(transfer, signer);

        // Assert
        assertTrue(result.isConfirmed());
        assertEquals(9000L, result.feeUsed());
    }

    @Test
    @DisplayName("Test dry run confirms without touching the chain")
    void testDryRun() {
        config.setDryRun(true);

        TransferResult result = executor(null).execute(transfer, signer);

        assertTrue(result.isConfirmed());
        assertTrue(result.txHash().startsWith("dryrun-"));
        verifyNoInteractions(chain, factory);
    }

    @Test
    @DisplayName("Test errors are classified as insufficient funds by message or cause")
    void testClassify() {
        RuntimeException wrapped = new RuntimeException("send failed",
                new ChainRpcException("custom program error: InsufficientFundsForRent"));

        assertInstanceOf(InsufficientFundsException.class, TransactionExecutor.classify(wrapped));
        RuntimeException other = new ChainRpcException("connection reset");
        assertSame(other, TransactionExecutor.classify(other));
    }
}
