package com.example.quotagate.admission;

import com.example.quotagate.billing.TierCatalog;
import com.example.quotagate.usage.UsageType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@RestController
@Validated
@RequestMapping("/v1")
public class AdmissionController {

    private final AdmissionControl admission;
    private final BillingStatusService billingStatus;
    private final UsageAnalyticsService usageAnalytics;
    private final TierCatalog catalog;

    public AdmissionController(
            AdmissionControl admission,
            BillingStatusService billingStatus,
            UsageAnalyticsService usageAnalytics,
            TierCatalog catalog
    ) {
        this.admission = admission;
        this.billingStatus = billingStatus;
        this.usageAnalytics = usageAnalytics;
        this.catalog = catalog;
    }

    /**
     * 使い方:
     *  curl -i -X POST "http://localhost:8080/v1/admission/evaluate?accountId=...&endpointClass=dashboard&usageType=api_calls"
     *
     * レスポンス:
     *  - 200 OK                → 許可 + X-RateLimit-* / X-User-Tier ヘッダ
     *  - 429 Too Many Requests → 拒否 + 理由は body、Retry-After ヘッダ
     */
    @PostMapping("/admission/evaluate")
    public ResponseEntity<AdmissionDecision> evaluate(
            @RequestParam("accountId") UUID accountId,
            @RequestParam("endpointClass") @NotBlank @Size(max = 64) String endpointClass,
            @RequestParam(value = "usageType", defaultValue = "api_calls") String usageType
    ) {
        AdmissionDecision decision = admission.evaluate(accountId, endpointClass, UsageType.fromCode(usageType));

        HttpHeaders headers = new HttpHeaders();
        decision.headers().forEach(headers::add);
        HttpStatus status = decision.permitted() ? HttpStatus.OK : HttpStatus.TOO_MANY_REQUESTS;
        return new ResponseEntity<>(decision, headers, status);
    }

    @GetMapping("/accounts/{accountId}/billing-status")
    public BillingStatus billingStatus(@PathVariable("accountId") UUID accountId) {
        return billingStatus.status(accountId);
    }

    @GetMapping("/accounts/{accountId}/usage/analytics")
    public UsageAnalytics usageAnalytics(@PathVariable("accountId") UUID accountId) {
        return usageAnalytics.analytics(accountId);
    }

    /** 現在のプラン上限テーブルと、各プランに対応する price id */
    @GetMapping("/tiers")
    public TierListing tiers() {
        Map<String, TierListing.Entry> tiers = new LinkedHashMap<>();
        catalog.all().forEach((tier, limits) ->
                tiers.put(tier.configKey(), new TierListing.Entry(limits, catalog.priceIds(tier))));
        return new TierListing(catalog.version(), tiers);
    }
}
