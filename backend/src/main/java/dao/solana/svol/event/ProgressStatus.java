package dao.solana.svol.event;

public enum ProgressStatus {
    STARTED,
    WAITING,
    EXECUTING,
    INSTRUCTION_COMPLETE,
    INSTRUCTION_FAILED,
    STOPPED,
    COMPLETED
}
