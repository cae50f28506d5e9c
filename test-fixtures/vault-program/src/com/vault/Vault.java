package com.vault;

/**
 * A toy account used by the pipeline tests.
 */
public class Vault {

    private long balance;

    public Vault(long opening) {
        this.balance = opening;
    }

    public long deposit(long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be positive");
        }
        balance += amount;
        return balance;
    }

    public boolean withdraw(long amount) {
        if (amount > balance) {
            return false;
        } else {
            balance -= amount;
        }
        return true;
    }

    public int drain(long[] requests) {
        int served = 0;
        for (long r : requests) {
            if (r > balance) {
                break;
            }
            balance -= r;
            served++;
        }
        return served;
    }

    public long balance() {
        return balance;
    }
}
