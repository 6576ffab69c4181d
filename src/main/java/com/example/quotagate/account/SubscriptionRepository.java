package com.example.quotagate.account;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SubscriptionRepository extends JpaRepository<Subscription, UUID> {

    Optional<Subscription> findByExternalSubscriptionId(String externalSubscriptionId);

    Optional<Subscription> findFirstByAccountIdAndStatusNotOrderByUpdatedAtDesc(UUID accountId, SubscriptionStatus status);

    Optional<Subscription> findFirstByExternalCustomerIdAndStatusNotOrderByUpdatedAtDesc(String externalCustomerId, SubscriptionStatus status);

    List<Subscription> findByAccountIdAndStatusNot(UUID accountId, SubscriptionStatus status);
}
