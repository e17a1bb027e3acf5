package com.hedgedata.data.compare;

import com.hedgedata.core.model.DataProvider;

import java.util.List;
import java.util.Locale;

/**
 * Side-by-side view of one ticker from two providers.
 *
 * @param notes problems that kept a section from being compared, such as a failed provider call
 */
public record ComparisonReport(
    String ticker,
    DataProvider left,
    DataProvider right,
    List<FieldDiff> fields,
    List<String> notes
) {

    public ComparisonReport {
        fields = List.copyOf(fields);
        notes = List.copyOf(notes);
    }

    public List<FieldDiff> significantDifferences() {
        return fields.stream().filter(FieldDiff::isSignificant).toList();
    }

    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "%s: %s vs %s%n", ticker, left.getDisplayName(), right.getDisplayName()));
        for (FieldDiff diff : fields) {
            sb.append(String.format(Locale.ROOT, "  %-36s %18s %18s %s%n",
                diff.field(), value(diff.left()), value(diff.right()), marker(diff)));
        }
        for (String note : notes) {
            sb.append("  ! ").append(note).append(System.lineSeparator());
        }
        return sb.toString();
    }

    private static String value(Double v) {
        return v == null ? "-" : String.format(Locale.ROOT, "%.4f", v);
    }

    private static String marker(FieldDiff diff) {
        if (!diff.isComparable()) return "";
        return diff.isSignificant()
            ? String.format(Locale.ROOT, "DIFF %.4f%%", diff.relativeDifference() * 100)
            : "ok";
    }
}
