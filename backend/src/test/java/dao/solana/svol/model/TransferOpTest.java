package dao.solana.svol.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TransferOpTest {

    private static final Instant AT = Instant.parse("2026-01-01T00:00:00Z");

    private static TransferOp op() {
        return new TransferOp("a", "b", new BigDecimal("1.5"), "mint", 6, AT);
    }

    @Test
    @DisplayName("Test status moves forward to COMPLETED and then stays put")
    void testCompletedIsTerminal() {
        TransferOp op = op();

        op.markInProgress();
        op.recordAttempt(5000L, 1);
        op.markCompleted("tx-1", AT.plusSeconds(5));

        assertEquals(TransferStatus.COMPLETED, op.getStatus());
        assertEquals("tx-1", op.getTxHash());
        assertEquals(1, op.getRetryCount());
        assertThrows(IllegalStateException.class, () -> op.markFailed("late", AT));
        assertThrows(IllegalStateException.class, op::markInProgress);
        assertThrows(IllegalStateException.class, () -> op.recordAttempt(1L, 2));
        assertEquals(TransferStatus.COMPLETED, op.getStatus());
    }

    @Test
    @DisplayName("Test a pending transfer cannot be completed or failed directly")
    void testNoSkippingInProgress() {
        TransferOp op = op();

        assertThrows(IllegalStateException.class, () -> op.markCompleted("tx", AT));
        assertThrows(IllegalStateException.class, () -> op.markFailed("err", AT));
        assertTrue(op.isPending());
    }

    @Test
    @DisplayName("Test amounts can only be rescaled before execution and must stay positive")
    void testRescale() {
        TransferOp op = op();

        op.rescale(new BigDecimal("2.25"));
        assertEquals(new BigDecimal("2.25"), op.getAmount());
        assertThrows(IllegalArgumentException.class, () -> op.rescale(BigDecimal.ZERO));

        op.markInProgress();
        assertThrows(IllegalStateException.class, () -> op.rescale(BigDecimal.ONE));
    }

    @Test
    @DisplayName("Test self transfers and non-positive amounts are rejected")
    void testConstructorValidation() {
        assertThrows(IllegalArgumentException.class, () -> new TransferOp("a", "a", BigDecimal.ONE, "mint", 6, AT));
        assertThrows(IllegalArgumentException.class, () -> new TransferOp("a", "b", BigDecimal.ZERO, "mint", 6, AT));
        assertThrows(IllegalArgumentException.class, () -> new TransferOp("a", "b", new BigDecimal("-1"), "mint", 6, AT));
    }

    @Test
    @DisplayName("Test schedule finishes COMPLETED only when every transfer completed")
    void testScheduleFinish() {
        Schedule schedule = new Schedule("s", "m", List.of("a", "b"), "mint", 6, new BigDecimal("3"), BigDecimal.ZERO, AT);
        TransferOp first = op();
        TransferOp second = new TransferOp("b", "a", new BigDecimal("1.5"), "mint", 6, AT.plusSeconds(1));
        schedule.addTransfers(List.of(first, second));
        assertEquals("s", first.getScheduleId());

        first.markInProgress();
        first.markCompleted("tx", AT);
        schedule.markInProgress();

        assertEquals(ScheduleStatus.FAILED, schedule.finish(AT));
        assertThrows(IllegalStateException.class, () -> schedule.addTransfer(op()));
    }
}
