package dev.presscrawl.extract;

import dev.presscrawl.checkpoint.UnitKey;
import dev.presscrawl.source.SourceConfig;
import java.time.LocalDate;
import java.util.Locale;

/** Renders a source's archive URL template for one unit. */
public final class ArchiveUrlBuilder {

    private ArchiveUrlBuilder() {
    }

    public static String build(SourceConfig source, UnitKey unitKey) {
        if (unitKey.granularity() != source.granularity()) {
            throw new IllegalArgumentException("Source " + source.id() + " is " + source.granularity()
                    + " but got unit " + unitKey);
        }
        return switch (unitKey.granularity()) {
            case DAILY -> forDate(source.baseUrlTemplate(), unitKey.asDate());
            case PAGINATED -> forPage(source, unitKey.asPage());
        };
    }

    private static String forDate(String template, LocalDate date) {
        return template
                .replace("{date}", date.toString())
                .replace("{yyyy}", String.valueOf(date.getYear()))
                .replace("{MM}", String.format(Locale.ROOT, "%02d", date.getMonthValue()))
                .replace("{dd}", String.format(Locale.ROOT, "%02d", date.getDayOfMonth()))
                .replace("{M}", String.valueOf(date.getMonthValue()))
                .replace("{d}", String.valueOf(date.getDayOfMonth()));
    }

    private static String forPage(SourceConfig source, int page) {
        if (page == 1 && source.firstPageUrl() != null) {
            return source.firstPageUrl();
        }
        return source.baseUrlTemplate().replace("{page}", String.valueOf(page));
    }
}
