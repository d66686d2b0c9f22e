package com.deepansh.collab.model;

public record Reaction(String userId, String symbol, String label) {

    public boolean sameAs(String otherUserId, String otherSymbol) {
        return userId.equals(otherUserId) && symbol.equals(otherSymbol);
    }
}
