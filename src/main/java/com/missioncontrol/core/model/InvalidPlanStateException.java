package com.missioncontrol.core.model;

/**
 * Thrown when approve or reject is attempted on a plan that is no longer pending.
 */
public class InvalidPlanStateException extends RuntimeException {

    private final String planId;
    private final ApprovalStatus currentStatus;

    public InvalidPlanStateException(String planId, ApprovalStatus currentStatus) {
        super("Plan " + planId + " is not pending approval (current: "
                + (currentStatus != null ? currentStatus.wireValue() : "none") + ")");
        this.planId = planId;
        this.currentStatus = currentStatus;
    }

    public String getPlanId() {
        return planId;
    }

    public ApprovalStatus getCurrentStatus() {
        return currentStatus;
    }
}
