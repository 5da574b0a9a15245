package dao.solana.svol.event;

/**
 * Handle returned by {@link EventBus#subscribe}; closing it removes the handler.
 */
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
