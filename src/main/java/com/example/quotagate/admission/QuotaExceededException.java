package com.example.quotagate.admission;

public class QuotaExceededException extends AdmissionDeniedException {

    public QuotaExceededException(AdmissionDecision decision) {
        super("Monthly " + decision.usageType().code() + " quota exceeded: "
                + decision.used() + "/" + decision.limit(), decision);
    }
}
