package dao.solana.svol.event;

@FunctionalInterface
public interface EventHandler {

    void handle(TransferEvent event) throws Exception;
}
