package com.vault;

import java.util.ArrayList;
import java.util.List;

public record Ledger(String owner, List<Long> entries) {

    public int countUntil(long limit) {
        int count = 0;
        long running = 0;
        while (count < entries.size()) {
            running += entries.get(count);
            if (running > limit) {
                break;
            }
            count++;
        }
        return count;
    }

    public String describe(int code) {
        switch (code) {
            case 0:
                return "empty";
            case 1:
                return "single";
            default:
                return "many";
        }
    }

    public static List<Long> parseAll(String[] raw) {
        List<Long> parsed = new ArrayList<>();
        for (int i = 0; i < raw.length; i++) {
            try {
                parsed.add(Long.parseLong(raw[i].trim()));
            } catch (NumberFormatException e) {
                continue;
            }
        }
        return parsed;
    }
}
