package com.example.quotagate.account;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Service
public class AccountSnapshotService {

    private final AccountRepository accounts;
    private final SubscriptionRepository subscriptions;

    public AccountSnapshotService(AccountRepository accounts, SubscriptionRepository subscriptions) {
        this.accounts = accounts;
        this.subscriptions = subscriptions;
    }

    @Transactional(readOnly = true)
    public AccountSnapshot load(UUID accountId) {
        Account account = accounts.findById(accountId)
                .orElseThrow(() -> new AccountNotFoundException(accountId));

        SubscriptionSnapshot subscription = subscriptions
                .findFirstByAccountIdAndStatusNotOrderByUpdatedAtDesc(accountId, SubscriptionStatus.CANCELLED)
                .map(SubscriptionSnapshot::of)
                .orElse(null);

        return new AccountSnapshot(account.getId(), account.getTier(), account.getSubscriptionStatus(), subscription);
    }
}
