package com.webdoc.core.parser;

import com.webdoc.core.model.ProgressEvent;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts one line of tool stdout into a {@link ProgressEvent}.
 *
 * <p>Recognised markers:
 * <pre>
 *   10% parsing             percent prefix, optionally bracketed: [10%] parsing
 *   Progress: 45 analyzing  keyword form, percent sign optional
 *   [3/10] topic three      step form, converted to a percent
 * </pre>
 * Anything else is not a progress line. Parsing never throws: a marker whose number does not
 * parse is treated as not a progress line, and the caller forwards the text as a message.
 * Percentages are clamped to [0,100].
 */
@Component
public class ProgressParser {

    static final Pattern PERCENT_PREFIX = Pattern.compile(
            "^\\s*\\[?\\s*(?<value>[^\\s%\\[\\]]+)\\s*%\\s*]?\\s*[:\\-]?\\s*(?<message>.*)$");

    static final Pattern PROGRESS_KEYWORD = Pattern.compile(
            "(?i)^\\s*progress\\s*[:=]\\s*(?<value>[^\\s%]+)\\s*%?\\s*[:\\-]?\\s*(?<message>.*)$");

    static final Pattern DECIMAL = Pattern.compile("^-?\\d+(\\.\\d+)?$");

    static final Pattern STEP = Pattern.compile(
            "^\\s*\\[(?<current>\\d{1,9})\\s*/\\s*(?<total>\\d{1,9})]\\s*(?<message>.*)$");

    /**
     * @param stageName stage the line belongs to
     * @param line      raw stdout line (nullable)
     * @return a {@link com.webdoc.core.model.ProgressKind#PROGRESS} event, or empty if the line
     *         carries no well-formed percentage
     */
    public Optional<ProgressEvent> parse(String stageName, String line) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }

        Matcher step = STEP.matcher(line);
        if (step.matches()) {
            long current = Long.parseLong(step.group("current"));
            long total = Long.parseLong(step.group("total"));
            if (total == 0) {
                return Optional.empty();
            }
            int percent = (int) Math.min(100, current * 100 / total);
            return Optional.of(ProgressEvent.progress(stageName, percent, step.group("message").strip()));
        }

        for (Pattern pattern : new Pattern[]{PROGRESS_KEYWORD, PERCENT_PREFIX}) {
            Matcher m = pattern.matcher(line);
            if (m.matches()) {
                return parsePercent(m.group("value"))
                        .map(percent -> ProgressEvent.progress(stageName, percent, m.group("message").strip()));
            }
        }
        return Optional.empty();
    }

    private static Optional<Integer> parsePercent(String raw) {
        // Plain decimals only: Double.parseDouble also takes 10d, 5f and hex literals
        if (!DECIMAL.matcher(raw).matches()) {
            return Optional.empty();
        }
        double value = Double.parseDouble(raw);
        return Optional.of(ProgressEvent.clamp((int) Math.floor(Math.max(-1, Math.min(101, value)))));
    }
}
