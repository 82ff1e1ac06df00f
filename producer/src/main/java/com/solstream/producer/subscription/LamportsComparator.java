package com.solstream.producer.subscription;

import java.util.Locale;

public enum LamportsComparator {
    EQ, NE, LT, GT;

    public static LamportsComparator fromToken(String token) {
        switch (token) {
            case "eq": return EQ;
            case "ne": return NE;
            case "lt": return LT;
            case "gt": return GT;
            default:   return null;
        }
    }

    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }
}
