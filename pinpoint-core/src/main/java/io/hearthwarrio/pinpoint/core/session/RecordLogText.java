package io.hearthwarrio.pinpoint.core.session;

import io.hearthwarrio.pinpoint.core.Candidate;
import io.hearthwarrio.pinpoint.core.SelectionRecord;

import java.util.Map;

/**
 * Plain-text rendering of a record shared by the record loggers.
 */
public final class RecordLogText {

    private RecordLogText() {
        // utility class
    }

    public static String render(SelectionRecord record, RecordLogDetail detail) {
        RecordLogDetail d = detail == null ? RecordLogDetail.NONE : detail;
        StringBuilder sb = new StringBuilder(512);

        sb.append("name: ").append(record.getDisplayName()).append('\n')
                .append("selector: ").append(record.getStructuralSelector());
        if (!record.isSelectorUnique()) {
            sb.append(" (degraded)");
        }
        sb.append('\n')
                .append("dynamic: ").append(record.isDynamic()).append('\n');

        if (d == RecordLogDetail.NONE) {
            return sb.toString();
        }

        sb.append("xpath: ").append(record.getPathLocator()).append('\n')
                .append("playwright:\n").append(indent(record.getPlaywrightLocator())).append('\n')
                .append("selenium:\n").append(indent(record.getSeleniumLocator())).append('\n');

        if (d == RecordLogDetail.FULL) {
            sb.append("attributes:\n");
            for (Map.Entry<String, String> e : record.getAttributes().entrySet()) {
                sb.append("  ").append(e.getKey()).append('=').append(e.getValue()).append('\n');
            }
            sb.append("candidates:\n");
            for (Candidate c : record.getCandidates()) {
                sb.append("  ").append(c.getScore()).append(' ').append(c.getKind()).append(' ')
                        .append(c.getText()).append('\n');
            }
            sb.append("html:\n").append(indent(record.getHtmlSnapshot())).append('\n');
        }
        return sb.toString();
    }

    private static String indent(String text) {
        return "  " + text.replace("\n", "\n  ");
    }
}
