package dao.solana.svol.chain;

import dao.solana.svol.exception.ChainRpcException;
import dao.solana.svol.model.TransferOp;
import dao.solana.svol.util.TokenAmounts;
import dao.solana.svol.wallet.SigningSecret;
import org.bitcoinj.core.Base58;
import org.p2p.solanaj.core.Account;
import org.p2p.solanaj.core.PublicKey;
import org.p2p.solanaj.core.Transaction;
import org.p2p.solanaj.programs.ComputeBudgetProgram;
import org.p2p.solanaj.programs.SystemProgram;
import org.p2p.solanaj.programs.TokenProgram;

import java.util.Arrays;

/**
 * Builds legacy-format Solana transactions for a single transfer:
 * a ComputeBudget SetComputeUnitPrice carrying the fee, followed by either a System transfer
 * (native mint) or an SPL Token TransferChecked.
 */
public class SolanaTransactionFactory implements TransactionFactory {

    public static final String SYSTEM_PROGRAM = "11111111111111111111111111111111";
    public static final String TOKEN_PROGRAM = "TokenkegQfeZyiNwAJbNbGKPFXCWuBvf9Ss623VQ5DA";
    public static final String COMPUTE_BUDGET_PROGRAM = "ComputeBudget111111111111111111111111111111";

    private static final int SIGNATURE_LENGTH = 64;

    private final ChainGateway chain;
    private final String nativeMint;

    public SolanaTransactionFactory(ChainGateway chain, String nativeMint) {
        this.chain = chain;
        this.nativeMint = nativeMint;
    }

    @Override
    public SignedTransaction build(TransferOp transfer, SigningSecret signer, long feeUnits, String recentBlockhash) {
        if (!signer.address().equals(transfer.getFrom())) {
            throw new IllegalArgumentException("Signing key " + signer.address()
                    + " does not belong to sender " + transfer.getFrom());
        }

        PublicKey owner = new PublicKey(transfer.getFrom());
        Transaction tx = new Transaction();
        tx.addInstruction(ComputeBudgetProgram.setComputeUnitPrice(Math.toIntExact(feeUnits)));

        if (isNative(transfer.getTokenMint())) {
            long lamports = TokenAmounts.toBaseUnits(transfer.getAmount(), TokenAmounts.NATIVE_DECIMALS).longValueExact();
            tx.addInstruction(SystemProgram.transfer(owner, new PublicKey(transfer.getTo()), lamports));
        } else {
            String source = chain.findTokenAccount(transfer.getFrom(), transfer.getTokenMint())
                    .orElseThrow(() -> new ChainRpcException("No token account found for sender "
                            + transfer.getFrom() + " and token " + transfer.getTokenMint()));
            String destination = chain.findTokenAccount(transfer.getTo(), transfer.getTokenMint())
                    .orElseThrow(() -> new ChainRpcException("No token account found for recipient "
                            + transfer.getTo() + " and token " + transfer.getTokenMint()));
            long units = TokenAmounts.toBaseUnits(transfer.getAmount(), transfer.getTokenDecimals()).longValueExact();
            tx.addInstruction(TokenProgram.transferChecked(
                    new PublicKey(source),
                    new PublicKey(destination),
                    units,
                    (byte) transfer.getTokenDecimals(),
                    owner,
                    new PublicKey(transfer.getTokenMint())));
        }

        Account account = signer.toAccount();
        tx.setRecentBlockHash(recentBlockhash);
        tx.sign(account);
        byte[] wire = tx.serialize();

        // one signature: compact-u16 count byte, then the 64-byte fee payer signature
        byte[] signature = Arrays.copyOfRange(wire, 1, 1 + SIGNATURE_LENGTH);
        return new SignedTransaction(Base58.encode(signature), wire,
                transfer.getFrom(), transfer.getTo(), feeUnits);
    }

    public boolean isNative(String mint) {
        return nativeMint.equals(mint);
    }
}
