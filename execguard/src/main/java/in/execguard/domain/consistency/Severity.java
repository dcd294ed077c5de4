package in.execguard.domain.consistency;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH
}
