package eti.domain.print;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * @since 16/10/2026
 */
public record StatusUpdateInfo(String message, List<String> issues, boolean ready) {

    public StatusUpdateInfo {
        issues = issues != null ? ImmutableList.copyOf(issues) : ImmutableList.of();
    }
}
