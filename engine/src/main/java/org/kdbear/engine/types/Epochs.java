package org.kdbear.engine.types;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conversions between epoch offsets and text. The engine epoch is 2000-01-01.
 */
final class Epochs {

    static final LocalDate EPOCH = LocalDate.of(2000, 1, 1);
    static final LocalDateTime EPOCH_TIME = EPOCH.atStartOfDay();
    static final long MILLIS_PER_DAY = 86_400_000L;

    static final DateTimeFormatter HOST_SECONDS = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss");
    static final DateTimeFormatter Q_DATETIME = DateTimeFormatter.ofPattern("uuuu.MM.dd'T'HH:mm:ss.SSS");
    static final DateTimeFormatter Q_DATE = DateTimeFormatter.ofPattern("uuuu.MM.dd");
    static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("uuuu.MM.dd'D'HH:mm:ss.SSSSSSSSS");

    private static final Pattern CLOCK = Pattern.compile("(-)?(\\d{2,}):(\\d{2})(?::(\\d{2})(?:\\.(\\d+))?)?");
    private static final Pattern MONTH = Pattern.compile("(\\d{4})\\.(\\d{2})m");
    private static final Pattern DATETIME = Pattern.compile(
            "(\\d{4}-\\d{2}-\\d{2})[T ](\\d{2}:\\d{2}:\\d{2})(?:\\.(\\d+))?");
    private static final Pattern TIMESPAN = Pattern.compile("(-)?(\\d+)D(\\d{2}):(\\d{2}):(\\d{2})\\.(\\d{9})");

    private static final BigDecimal SECONDS_PER_DAY = BigDecimal.valueOf(86_400);
    private static final int MIN_FRACTION_DIGITS = 3;
    private static final int MAX_FRACTION_DIGITS = 40;

    private Epochs() {
    }

    // ==================== Date / Month ====================

    static String hostDate(int days) {
        return EPOCH.plusDays(days).toString();
    }

    static String qDate(int days) {
        return EPOCH.plusDays(days).format(Q_DATE);
    }

    static int parseDate(String text) {
        return Math.toIntExact(ChronoUnit.DAYS.between(EPOCH, LocalDate.parse(text)));
    }

    static String month(int months) {
        YearMonth ym = YearMonth.of(2000, 1).plusMonths(months);
        return String.format("%04d.%02dm", ym.getYear(), ym.getMonthValue());
    }

    static int parseMonth(String text) {
        Matcher m = MONTH.matcher(text);
        if (!m.matches()) {
            throw new IllegalArgumentException("Not a month: " + text);
        }
        int month = Integer.parseInt(m.group(2));
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("Month out of range: " + text);
        }
        return (Integer.parseInt(m.group(1)) - 2000) * 12 + month - 1;
    }

    // ==================== Date-time / Timestamp ====================

    /**
     * Host text with the fewest fractional second digits, at least three, that
     * {@link #parseDateTime} reads back as the same double.
     */
    static String hostDateTime(double days) {
        BigDecimal seconds = new BigDecimal(days).multiply(SECONDS_PER_DAY);
        String text = null;
        for (int digits = MIN_FRACTION_DIGITS; digits <= MAX_FRACTION_DIGITS; digits++) {
            text = hostDateTime(seconds.setScale(digits, RoundingMode.HALF_EVEN));
            if (parseDateTime(text) == days) {
                return text;
            }
        }
        return text;
    }

    private static String hostDateTime(BigDecimal seconds) {
        BigDecimal whole = seconds.setScale(0, RoundingMode.FLOOR);
        String fraction = seconds.subtract(whole).toPlainString();
        return EPOCH_TIME.plusSeconds(whole.longValueExact()).format(HOST_SECONDS) + fraction.substring(1);
    }

    static String qDateTime(double days) {
        return dateTimeOf(days).format(Q_DATETIME);
    }

    private static LocalDateTime dateTimeOf(double days) {
        long millis = Math.round(days * MILLIS_PER_DAY);
        return EPOCH_TIME.plus(millis, ChronoUnit.MILLIS);
    }

    static double parseDateTime(String text) {
        Matcher m = DATETIME.matcher(text);
        if (!m.matches()) {
            throw new IllegalArgumentException("Not a datetime: " + text);
        }
        long seconds = parseDate(m.group(1)) * 86_400L + parseClockMillis(m.group(2)) / 1000;
        BigDecimal total = BigDecimal.valueOf(seconds);
        if (m.group(3) != null) {
            total = total.add(new BigDecimal("0." + m.group(3)));
        }
        return total.divide(SECONDS_PER_DAY, MathContext.DECIMAL128).doubleValue();
    }

    static String timestamp(long nanos) {
        return EPOCH_TIME.plusNanos(nanos).format(TIMESTAMP);
    }

    static long parseTimestamp(String text) {
        return ChronoUnit.NANOS.between(EPOCH_TIME, LocalDateTime.parse(text, TIMESTAMP));
    }

    // ==================== Clock types ====================

    static String minute(int minutes) {
        int abs = Math.abs(minutes);
        return sign(minutes) + String.format("%02d:%02d", abs / 60, abs % 60);
    }

    static String second(int seconds) {
        int abs = Math.abs(seconds);
        return sign(seconds) + String.format("%02d:%02d:%02d", abs / 3600, (abs % 3600) / 60, abs % 60);
    }

    static String time(int millis) {
        int abs = Math.abs(millis);
        int totalSeconds = abs / 1000;
        return sign(millis) + String.format("%02d:%02d:%02d.%03d",
                totalSeconds / 3600, (totalSeconds % 3600) / 60, totalSeconds % 60, abs % 1000);
    }

    static String timespan(long nanos) {
        long abs = Math.abs(nanos);
        long totalSeconds = abs / 1_000_000_000L;
        return sign(nanos) + String.format("%dD%02d:%02d:%02d.%09d",
                totalSeconds / 86_400, (totalSeconds % 86_400) / 3600, (totalSeconds % 3600) / 60,
                totalSeconds % 60, abs % 1_000_000_000L);
    }

    static long parseTimespan(String text) {
        Matcher m = TIMESPAN.matcher(text);
        if (!m.matches()) {
            throw new IllegalArgumentException("Not a timespan: " + text);
        }
        long seconds = Long.parseLong(m.group(2)) * 86_400 + Long.parseLong(m.group(3)) * 3600
                + checkSixty(Long.parseLong(m.group(4))) * 60 + checkSixty(Long.parseLong(m.group(5)));
        long nanos = seconds * 1_000_000_000L + Long.parseLong(m.group(6));
        return m.group(1) != null ? -nanos : nanos;
    }

    /**
     * Parses {@code [-]HH:mm[:ss[.fff]]} to milliseconds; digits past the third
     * fractional digit are dropped.
     */
    static long parseClockMillis(String text) {
        Matcher m = CLOCK.matcher(text);
        if (!m.matches()) {
            throw new IllegalArgumentException("Not a clock time: " + text);
        }
        long millis = Long.parseLong(m.group(2)) * 3_600_000L
                + checkSixty(Long.parseLong(m.group(3))) * 60_000L;
        if (m.group(4) != null) {
            millis += checkSixty(Long.parseLong(m.group(4))) * 1000L;
        }
        if (m.group(5) != null) {
            String fraction = (m.group(5) + "00").substring(0, 3);
            millis += Long.parseLong(fraction);
        }
        return m.group(1) != null ? -millis : millis;
    }

    private static long checkSixty(long value) {
        if (value >= 60) {
            throw new IllegalArgumentException("Minutes and seconds must be below 60: " + value);
        }
        return value;
    }

    private static String sign(long value) {
        return value < 0 ? "-" : "";
    }
}
