package dev.presscrawl.extract;

import java.text.ParsePosition;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Converts the date strings news sites publish into ISO {@code yyyy-MM-dd}.
 *
 * <p>Understands ISO dates and timestamps (the local date is kept, not converted to UTC) and common
 * English forms such as "November 30, 2025 8:30 pm", "30 Nov 2025" or
 * "Sun, 30 Nov 2025 07:25 PM (IST)". Anything else is returned trimmed but otherwise verbatim.
 */
public final class PublishDateNormalizer {

    private static final Pattern ISO_PREFIX = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2})");
    private static final Pattern LABEL = Pattern.compile(
            "^(?i)(updated|published|posted|last updated)(\\s+on)?\\s*:?\\s*");

    private static final List<DateTimeFormatter> FORMATS = List.of(
            formatter("MMMM d, uuuu"),
            formatter("MMM d, uuuu"),
            formatter("MMMM d uuuu"),
            formatter("MMM d uuuu"),
            formatter("EEE, d MMM uuuu"),
            formatter("EEEE, d MMMM uuuu"),
            formatter("EEEE, MMMM d, uuuu"),
            formatter("d MMMM uuuu"),
            formatter("d MMM uuuu"),
            formatter("d MMM, uuuu"),
            formatter("dd/MM/uuuu"),
            formatter("uuuu/MM/dd"),
            formatter("dd.MM.uuuu"),
            formatter("dd-MM-uuuu"));

    private PublishDateNormalizer() {
    }

    public static @Nullable String normalize(@Nullable String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String text = raw.strip();

        Matcher iso = ISO_PREFIX.matcher(text);
        if (iso.find() && isValidDate(iso.group(1))) {
            return iso.group(1);
        }

        String cleaned = LABEL.matcher(text).replaceFirst("").strip();
        for (DateTimeFormatter format : FORMATS) {
            LocalDate date = tryParse(format, cleaned);
            if (date != null) {
                return date.toString();
            }
        }
        return text;
    }

    private static @Nullable LocalDate tryParse(DateTimeFormatter format, String text) {
        try {
            return LocalDate.from(format.parse(text, new ParsePosition(0)));
        } catch (DateTimeException e) {
            return null;
        }
    }

    private static boolean isValidDate(String isoDate) {
        try {
            LocalDate.parse(isoDate);
            return true;
        } catch (DateTimeException e) {
            return false;
        }
    }

    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH);
    }
}
