package dao.solana.svol.service;

public record WalletPair(String from, String to) {}
