package dao.solana.svol.chain;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Different RPC providers (and API versions) name the same field differently.
 * One table maps a canonical name to the spellings seen in the wild.
 */
public final class ResponseFieldAliases {
    private ResponseFieldAliases() {}

    public static final String FEE = "fee";
    public static final String SLOT = "slot";
    public static final String BLOCKHASH = "blockhash";

    private static final Map<String, List<String>> ALIASES = Map.of(
            FEE, List.of("prioritizationFee", "prioritization_fee", "lamportsPerSignature", "fee"),
            SLOT, List.of("slot", "contextSlot"),
            BLOCKHASH, List.of("blockhash", "recentBlockhash", "blockHash")
    );

    public static Optional<JsonNode> resolve(JsonNode node, String canonical) {
        if (node == null || node.isNull()) return Optional.empty();
        for (String alias : ALIASES.getOrDefault(canonical, List.of(canonical))) {
            JsonNode v = node.get(alias);
            if (v != null && !v.isNull()) return Optional.of(v);
        }
        return Optional.empty();
    }
}
