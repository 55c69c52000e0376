package autoflow.compiler;

/**
 * Thresholds for synthetic wait insertion.
 *
 * @param minGapSeconds  smallest gap between two steps that earns a wait
 * @param bufferSeconds  added to the observed gap
 * @param maxWaitSeconds upper bound on any inserted wait
 */
public record WaitSettings(double minGapSeconds, double bufferSeconds, double maxWaitSeconds) {

    public static final WaitSettings DEFAULTS = new WaitSettings(2.0, 1.0, 10.0);

    public WaitSettings {
        if (minGapSeconds < 0 || bufferSeconds < 0 || maxWaitSeconds < 0) {
            throw new IllegalArgumentException("Wait settings must not be negative: min=" + minGapSeconds
                    + ", buffer=" + bufferSeconds + ", max=" + maxWaitSeconds);
        }
    }
}
