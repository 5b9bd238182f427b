package eti.domain.print;

import com.google.common.base.Preconditions;

/**
 * Options for a sequence of print jobs. Each job uses {@code printOptions}.
 * @since 16/10/2026
 */
public record BatchPrintOptions(PrintOptions printOptions, long delayBetweenJobsMs, boolean stopOnError) {

    public BatchPrintOptions {
        Preconditions.checkNotNull(printOptions, "printOptions");
        Preconditions.checkArgument(delayBetweenJobsMs >= 0, "delayBetweenJobsMs must not be negative");
    }

    public static BatchPrintOptions defaults() {
        return new BatchPrintOptions(PrintOptions.defaults(), 500, true);
    }
}
