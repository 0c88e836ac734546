package app.mstudio.render.domain.type;

public enum LedgerStatus {
    submitted,
    completed,
    failed,
    blocked
}
