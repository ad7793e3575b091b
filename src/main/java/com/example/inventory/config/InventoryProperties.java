package com.example.inventory.config;

import com.example.inventory.batch.RunMode;
import com.example.inventory.service.GroupingKeyPolicy;
import com.example.inventory.service.table.OutputFormat;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.Locale;

/**
 * Settings under {@code inventory.*}. The batch section replaces interactive path prompts:
 * when {@code inventory.batch.mode} is set the batch runner executes once at startup.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "inventory")
public class InventoryProperties {

    public static final String DEFAULT_TIMESTAMP_PATTERN = "M/d/yyyy H:mm";

    private String timestampPattern = DEFAULT_TIMESTAMP_PATTERN;

    /** Classpath location of the column alias file. */
    private String columnConfig = "column-config.json";

    private final Selection selection = new Selection();

    private final Batch batch = new Batch();

    /**
     * Strict formatter for {@link #timestampPattern}: impossible dates such as 2/30 are rejected,
     * not rolled back to the last day of the month.
     */
    public DateTimeFormatter timestampFormatter() {
        return DateTimeFormatter.ofPattern(strictYears(timestampPattern), Locale.ROOT)
                .withResolverStyle(ResolverStyle.STRICT);
    }

    // STRICT cannot resolve year-of-era without an era field, so 'y' is read as proleptic year 'u'
    static String strictYears(String pattern) {
        StringBuilder out = new StringBuilder(pattern.length());
        boolean quoted = false;
        for (char c : pattern.toCharArray()) {
            if (c == '\'') {
                quoted = !quoted;
            }
            out.append(!quoted && c == 'y' ? 'u' : c);
        }
        return out.toString();
    }

    @Getter
    @Setter
    public static class Selection {
        private GroupingKeyPolicy groupingKey = GroupingKeyPolicy.RAW;
    }

    @Getter
    @Setter
    public static class Batch {
        private RunMode mode;
        private String inventoryFile;
        private String rosterFile;
        private String outputDir = "output";
        private OutputFormat outputFormat = OutputFormat.CSV;
    }
}
