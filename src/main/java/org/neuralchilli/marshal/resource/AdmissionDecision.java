package org.neuralchilli.marshal.resource;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * APPROVE grants the requested tokens, or less for a throttled step. DENY
 * carries the ceiling and a suggested smaller budget (80% of the ceiling).
 */
public record AdmissionDecision(
        boolean approved,
        String stepName,
        long requested,
        long granted,
        long maximumAllowed,
        long reductionSuggestion,
        TokenBudget budget
) {

    public static final double REDUCTION_FACTOR = 0.8;

    static AdmissionDecision approve(AdmissionRequest request, TokenBudget budget, long granted) {
        return new AdmissionDecision(true, request.stepName(), request.requestedTokens(),
                granted, budget.limit(), budget.limit(), budget);
    }

    static AdmissionDecision deny(AdmissionRequest request, TokenBudget budget) {
        long suggestion = (long) Math.floor(budget.limit() * REDUCTION_FACTOR);
        return new AdmissionDecision(false, request.stepName(), request.requestedTokens(),
                0, budget.limit(), suggestion, budget);
    }

    public ResourceDeniedException toException() {
        return new ResourceDeniedException(stepName, requested, maximumAllowed, reductionSuggestion);
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("decision", approved ? "APPROVE" : "DENY");
        payload.put("requested", requested);
        payload.put("granted", granted);
        payload.put("maximum_allowed", maximumAllowed);
        if (!approved) {
            payload.put("reduction_suggestion", reductionSuggestion);
        }
        payload.put("budget", budget.toMap());
        return payload;
    }
}
