package dao.solana.svol.service;

import org.apache.commons.math3.random.RandomGenerator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Picks sender/receiver pairs so that activity spreads over all wallets.
 * <p>
 * Wallets are drawn with weight 1 / (1 + uses), sends and receives counted separately.
 * The last few wallets touched are skipped while enough other wallets remain.
 */
public class WalletPairSelector {

    private final List<String> wallets;
    private final int recentWindow;
    private final RandomGenerator rng;

    private final Map<String, Integer> sent = new HashMap<>();
    private final Map<String, Integer> received = new HashMap<>();
    private final Deque<String> recent = new ArrayDeque<>();

    public WalletPairSelector(List<String> wallets, int recentWindow, RandomGenerator rng) {
        if (wallets.size() < 2) {
            throw new IllegalArgumentException("Need at least 2 wallets to form a pair");
        }
        this.wallets = List.copyOf(wallets);
        this.recentWindow = Math.max(0, recentWindow);
        this.rng = rng;
    }

    public WalletPair next() {
        List<String> senders = withoutRecent(null);
        if (senders.size() < 2) senders = wallets;
        String from = pick(senders, sent);

        List<String> receivers = withoutRecent(from);
        if (receivers.isEmpty()) {
            receivers = new ArrayList<>(wallets);
            receivers.remove(from);
        }
        String to = pick(receivers, received);

        sent.merge(from, 1, Integer::sum);
        received.merge(to, 1, Integer::sum);
        remember(from);
        remember(to);
        return new WalletPair(from, to);
    }

    public int sentCount(String wallet) {
        return sent.getOrDefault(wallet, 0);
    }

    public int receivedCount(String wallet) {
        return received.getOrDefault(wallet, 0);
    }

    private List<String> withoutRecent(String exclude) {
        List<String> out = new ArrayList<>(wallets.size());
        for (String w : wallets) {
            if (!w.equals(exclude) && !recent.contains(w)) out.add(w);
        }
        return out;
    }

    private String pick(List<String> candidates, Map<String, Integer> uses) {
        double[] weights = new double[candidates.size()];
        double total = 0;
        for (int i = 0; i < weights.length; i++) {
            weights[i] = weight(uses.getOrDefault(candidates.get(i), 0));
            total += weights[i];
        }
        double r = rng.nextDouble() * total;
        for (int i = 0; i < weights.length; i++) {
            r -= weights[i];
            if (r < 0) return candidates.get(i);
        }
        return candidates.get(candidates.size() - 1);
    }

    static double weight(int uses) {
        return 1.0 / (1 + uses);
    }

    private void remember(String wallet) {
        if (recentWindow == 0) return;
        recent.remove(wallet);
        recent.addLast(wallet);
        while (recent.size() > recentWindow) recent.removeFirst();
    }
}
