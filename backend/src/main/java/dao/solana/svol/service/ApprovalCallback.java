package dao.solana.svol.service;

import dao.solana.svol.model.ApprovalContext;

import java.util.concurrent.CompletionStage;

/**
 * Asks a human whether a transfer may go out at a spiked fee.
 * Completing with false, or not completing in time, rejects the transfer.
 */
@FunctionalInterface
public interface ApprovalCallback {

    CompletionStage<Boolean> requestApproval(ApprovalContext context);
}
