package com.example.quotagate.admission;

public class BurstExceededException extends AdmissionDeniedException {

    public BurstExceededException(AdmissionDecision decision) {
        super("Burst limit exceeded for " + decision.endpointClass() + ": "
                + decision.burstCurrent() + "/" + decision.burstLimit()
                + ", retry after " + decision.retryAfterSeconds() + "s", decision);
    }
}
