package io.github.drompincen.taskboard.engine.board;

public record TransitionDecision(
        Verdict verdict,
        String newStatus,
        RejectionReason reason
) {
    public enum Verdict {
        ACCEPTED, NO_CHANGE, REJECTED
    }

    public static TransitionDecision accept(String newStatus) {
        return new TransitionDecision(Verdict.ACCEPTED, newStatus, null);
    }

    public static TransitionDecision noChange(String status) {
        return new TransitionDecision(Verdict.NO_CHANGE, status, null);
    }

    public static TransitionDecision reject(RejectionReason reason) {
        return new TransitionDecision(Verdict.REJECTED, null, reason);
    }

    public boolean isRejected() {
        return verdict == Verdict.REJECTED;
    }

    public boolean isNoChange() {
        return verdict == Verdict.NO_CHANGE;
    }
}
