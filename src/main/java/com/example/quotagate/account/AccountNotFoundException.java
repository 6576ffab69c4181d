package com.example.quotagate.account;

import java.util.UUID;

public class AccountNotFoundException extends RuntimeException {

    private final String accountRef;

    public AccountNotFoundException(UUID accountId) {
        this(String.valueOf(accountId));
    }

    public AccountNotFoundException(String accountRef) {
        super("Account not found: " + accountRef);
        this.accountRef = accountRef;
    }

    public String accountRef() {
        return accountRef;
    }
}
