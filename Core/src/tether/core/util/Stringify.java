package tether.core.util;

import java.util.Locale;

public final class Stringify {

    public static String millisToString(double millis) {
        return String.format(Locale.ROOT, "%.2fms", millis);
    }

    public static String nanosToMillisString(long nanos) {
        return millisToString(nanos / 1_000_000.0);
    }
}
