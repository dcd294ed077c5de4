package in.execguard.config;

/**
 * When the post-recovery health check runs relative to declaring success.
 */
public enum ValidationPolicy {
    ADVISORY,  // Declare success, then report the check result
    STRICT     // Check first; a failed check is a failed attempt
}
