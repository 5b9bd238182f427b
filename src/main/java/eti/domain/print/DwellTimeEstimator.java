package eti.domain.print;

import eti.common.EPrintLanguage;

/**
 * Estimates how long the printer needs to physically finish a job after the data was sent
 * @since 16/10/2026
 */
public final class DwellTimeEstimator {
    private DwellTimeEstimator() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    public static final double ZPL_MS_PER_CHAR = 0.1;
    public static final double CPCL_MS_PER_CHAR = 0.2;
    public static final double DEFAULT_MS_PER_CHAR = 0.15;
    public static final long JOB_OVERHEAD_MS = 1000;
    public static final long MECHANICAL_MS = 2000;
    public static final long MIN_DWELL_MS = 3000;

    /**
     * @param maxWaitMs upper bound; 0 or less means no bound
     */
    public static long estimate(int dataLength, EPrintLanguage language, long maxWaitMs) {
        double perChar = switch (language) {
            case ZPL -> ZPL_MS_PER_CHAR;
            case CPCL -> CPCL_MS_PER_CHAR;
            case UNDETERMINED -> DEFAULT_MS_PER_CHAR;
        };
        long estimate = Math.round(dataLength * perChar) + JOB_OVERHEAD_MS + MECHANICAL_MS;
        estimate = Math.max(estimate, MIN_DWELL_MS);
        return maxWaitMs > 0 ? Math.min(estimate, maxWaitMs) : estimate;
    }

    /**
     * Time still to wait given what has already elapsed since sending; 0 when the estimate is met
     */
    public static long remaining(long estimateMs, long elapsedSinceSendMs) {
        return Math.max(0, estimateMs - elapsedSinceSendMs);
    }
}
