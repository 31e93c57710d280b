package com.gigpulse.core.util;

import java.util.Locale;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class HourFormat {
    private static final Pattern TWELVE_HOUR = Pattern.compile("^(\\d{1,2})(?::(\\d{2}))?\\s*([AaPp])\\.?[Mm]\\.?$");
    private static final Pattern TWENTY_FOUR_HOUR = Pattern.compile("^(\\d{1,2})(?::(\\d{2}))?(?::\\d{2})?$");

    private HourFormat() {
    }

    public static OptionalInt parseHour(String raw) {
        if (raw == null || raw.isBlank()) {
            return OptionalInt.empty();
        }
        String value = raw.trim();
        Matcher twelve = TWELVE_HOUR.matcher(value);
        if (twelve.matches()) {
            int hour = Integer.parseInt(twelve.group(1));
            if (hour < 1 || hour > 12 || !validMinutes(twelve.group(2))) {
                return OptionalInt.empty();
            }
            boolean pm = twelve.group(3).toUpperCase(Locale.ROOT).equals("P");
            return OptionalInt.of((hour % 12) + (pm ? 12 : 0));
        }
        Matcher twentyFour = TWENTY_FOUR_HOUR.matcher(value);
        if (twentyFour.matches()) {
            int hour = Integer.parseInt(twentyFour.group(1));
            if (hour > 23 || !validMinutes(twentyFour.group(2))) {
                return OptionalInt.empty();
            }
            return OptionalInt.of(hour);
        }
        return OptionalInt.empty();
    }

    public static String label(int hour) {
        int normalized = Math.floorMod(hour, 24);
        int display = normalized % 12 == 0 ? 12 : normalized % 12;
        return display + ":00 " + (normalized < 12 ? "AM" : "PM");
    }

    public static String slotLabel(int hour) {
        return label(hour) + " - " + label(hour + 1);
    }

    private static boolean validMinutes(String minutes) {
        return minutes == null || Integer.parseInt(minutes) < 60;
    }
}
