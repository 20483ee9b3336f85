package com.inventorysense.engine.time;

import com.inventorysense.engine.errors.MonthLabelParseException;
import com.inventorysense.engine.model.RawRecord;
import com.inventorysense.engine.model.TimeKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code Mon-YY} month labels (e.g. "Feb-23") into time keys.
 * A bad label only nulls the time key of its own row.
 */
public class TimeNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(TimeNormalizer.class);

    private static final Pattern MONTH_LABEL = Pattern.compile("^([A-Za-z]{3})-(\\d{2})$");

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
        Map.entry("jan", 1), Map.entry("feb", 2), Map.entry("mar", 3),
        Map.entry("apr", 4), Map.entry("may", 5), Map.entry("jun", 6),
        Map.entry("jul", 7), Map.entry("aug", 8), Map.entry("sep", 9),
        Map.entry("oct", 10), Map.entry("nov", 11), Map.entry("dec", 12)
    );

    /**
     * Parse a label strictly.
     * Two-digit years 69-99 map to 19xx and 00-68 to 20xx.
     *
     * @throws MonthLabelParseException if the label does not match {@code Mon-YY}
     */
    public TimeKey parse(String label) {
        if (label == null) {
            throw new MonthLabelParseException(null);
        }
        Matcher matcher = MONTH_LABEL.matcher(label);
        if (!matcher.matches()) {
            throw new MonthLabelParseException(label);
        }
        Integer month = MONTHS.get(matcher.group(1).toLowerCase(Locale.ROOT));
        if (month == null) {
            throw new MonthLabelParseException(label);
        }
        int twoDigitYear = Integer.parseInt(matcher.group(2));
        int year = twoDigitYear >= 69 ? 1900 + twoDigitYear : 2000 + twoDigitYear;
        return TimeKey.of(year, month);
    }

    /**
     * Lenient variant of {@link #parse(String)}: returns {@code null} for a bad label.
     */
    public TimeKey normalize(String label) {
        try {
            return parse(label);
        } catch (MonthLabelParseException e) {
            LOG.debug(e.getMessage());
            return null;
        }
    }

    /**
     * Annotate every record with its time key.
     */
    public List<RawRecord> normalize(List<RawRecord> records) {
        List<RawRecord> normalized = new ArrayList<>(records.size());
        int unparsed = 0;
        for (RawRecord record : records) {
            TimeKey key = normalize(record.monthLabel());
            if (key == null) {
                unparsed++;
            }
            normalized.add(record.withTimeKey(key));
        }
        if (unparsed > 0) {
            LOG.warn("{} of {} rows have an unparseable month label and are excluded from quarter aggregation",
                unparsed, records.size());
        }
        return normalized;
    }
}
