package work.labinv.sp.report;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * Writes the rows of a {@link ResultView} as CSV with a header line.
 */
public final class ResultCsvExporter {
    static final String[] HEADER = {"key", "name", "unit", "value", "group"};

    private final CSVFormat format = CSVFormat.DEFAULT.builder()
        .setHeader(HEADER)
        .setRecordSeparator("\n")
        .build();

    public String export(ResultView view) {
        var out = new StringWriter();
        write(view, out);
        return out.toString();
    }

    public void write(ResultView view, Appendable out) {
        try {
            // left open, the caller owns out
            var printer = new CSVPrinter(out, format);
            for (DisplayRow row : view.rows()) {
                printer.printRecord(row.key(), row.displayName(), row.unit(), row.value(), row.group().wireName());
            }
            printer.flush();
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to write CSV export", ex);
        }
    }
}
