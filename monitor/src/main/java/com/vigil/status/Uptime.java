package com.vigil.status;

import java.util.Locale;

public final class Uptime {

    public static final String NOT_AVAILABLE = "N/A";

    private Uptime() {
    }

    public static String format(long successCount, long failureCount) {
        long total = successCount + failureCount;
        if (total == 0) {
            return NOT_AVAILABLE;
        }
        double percentage = successCount * 100.0 / total;
        return String.format(Locale.ROOT, "%.1f%%", percentage);
    }
}
