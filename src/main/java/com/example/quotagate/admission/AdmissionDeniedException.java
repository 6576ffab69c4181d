package com.example.quotagate.admission;

/** A request refused by admission control. Carries the decision and its headers. */
public abstract class AdmissionDeniedException extends RuntimeException {

    private final AdmissionDecision decision;

    protected AdmissionDeniedException(String message, AdmissionDecision decision) {
        super(message);
        this.decision = decision;
    }

    public AdmissionDecision decision() {
        return decision;
    }
}
