package com.example.flowmutator.diff;

import lombok.RequiredArgsConstructor;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a {@link WorkflowDiff} as a one-line summary, a plain-text report, a
 * self-contained HTML page (inline styles, no external assets) or JSON.
 */
@Component
@RequiredArgsConstructor
public class DiffReportRenderer {

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private static final String STYLE = """
            body { font-family: Arial, sans-serif; margin: 20px; }
            .summary { background-color: #f0f0f0; padding: 15px; border-radius: 5px; margin-bottom: 20px; }
            .severity-minor { color: #28a745; }
            .severity-moderate { color: #ffc107; }
            .severity-major { color: #fd7e14; }
            .severity-critical { color: #dc3545; }
            .change-section { margin-bottom: 20px; }
            .change-item { margin-bottom: 10px; padding: 10px; border-left: 3px solid #007bff; background-color: #f8f9fa; }
            .node-added, .connection-added { border-left-color: #28a745; }
            .node-removed, .connection-removed { border-left-color: #dc3545; }
            .node-modified { border-left-color: #ffc107; }
            .parameter-change { margin-left: 20px; font-size: 0.9em; color: #6c757d; }
            """;

    private final JsonMapper jsonMapper;

    public String render(WorkflowDiff diff, ReportFormat format) {
        return switch (format) {
            case TEXT -> text(diff);
            case HTML -> html(diff);
            case JSON -> json(diff);
        };
    }

    public String summary(WorkflowDiff diff) {
        return diff.changeSummary();
    }

    public String text(WorkflowDiff diff) {
        StringBuilder out = new StringBuilder();
        heading(out, "Workflow Diff Report", '=');
        out.append("Overall severity: ").append(diff.overallSeverity().name()).append('\n');
        out.append("Changes detected: ").append(diff.hasChanges() ? "yes" : "no").append('\n');
        out.append("Summary: ").append(diff.changeSummary()).append('\n');
        out.append("Hashes: ").append(diff.originalHash()).append(" -> ").append(diff.modifiedHash()).append('\n');
        out.append("Analysis duration: ").append(duration(diff)).append('\n');
        out.append("Analyzed at: ").append(TIMESTAMP.format(diff.analyzedAt())).append(" UTC\n");

        if (!diff.nodeDiffs().isEmpty()) {
            out.append('\n');
            heading(out, "Node changes", '-');
            for (NodeDiff node : diff.nodeDiffs()) {
                out.append('[').append(node.severity().name()).append("] ")
                        .append(node.changeType().label()).append(": ")
                        .append(node.nodeName()).append(" (").append(node.nodeId()).append(")\n");
                out.append("    ").append(node.description()).append('\n');
                node.parameterChanges().forEach((name, change) -> out.append("    - ").append(name).append(": ")
                        .append(parameterLine(change)).append('\n'));
            }
        }
        if (!diff.connectionDiffs().isEmpty()) {
            out.append('\n');
            heading(out, "Connection changes", '-');
            for (ConnectionDiff connection : diff.connectionDiffs()) {
                out.append('[').append(connection.severity().name()).append("] ")
                        .append(connection.changeType().label()).append(": ")
                        .append(connection.source()).append(" -> ").append(connection.target())
                        .append(" (").append(connection.connectionType()).append(")\n");
                out.append("    ").append(connection.description()).append('\n');
            }
        }
        if (!diff.workflowChanges().isEmpty()) {
            out.append('\n');
            heading(out, "Workflow changes", '-');
            diff.workflowChanges().forEach((property, change) -> out.append(property).append(": ")
                    .append(change.oldValue()).append(" -> ").append(change.newValue()).append('\n'));
        }
        out.append('\n');
        heading(out, "Statistics", '-');
        statistics(diff.statistics()).forEach((label, count) ->
                out.append(label).append(": ").append(count).append('\n'));
        return out.toString();
    }

    public String html(WorkflowDiff diff) {
        StringBuilder out = new StringBuilder();
        out.append("<!DOCTYPE html>\n<html>\n<head>\n<meta charset=\"utf-8\">\n<title>Workflow Diff Report</title>\n");
        out.append("<style>\n").append(STYLE).append("</style>\n</head>\n<body>\n");
        out.append("<h1>Workflow Diff Report</h1>\n");

        out.append("<div class=\"summary\">\n<h2>Summary</h2>\n");
        out.append("<p><strong>Overall Severity:</strong> ").append(severitySpan(diff.overallSeverity())).append("</p>\n");
        out.append("<p><strong>Changes Detected:</strong> ").append(diff.hasChanges() ? "Yes" : "No").append("</p>\n");
        out.append("<p><strong>Description:</strong> ").append(escape(diff.changeSummary())).append("</p>\n");
        out.append("<p><strong>Analysis Duration:</strong> ").append(duration(diff)).append("</p>\n");
        out.append("<p><strong>Timestamp:</strong> ").append(TIMESTAMP.format(diff.analyzedAt())).append(" UTC</p>\n");
        out.append("</div>\n");

        if (!diff.nodeDiffs().isEmpty()) {
            out.append("<div class=\"change-section\">\n<h2>Node Changes</h2>\n");
            for (NodeDiff node : diff.nodeDiffs()) {
                out.append("<div class=\"change-item ").append(cssClass(node.changeType())).append("\">\n");
                out.append("<h3>").append(escape(node.nodeName())).append(" (").append(escape(node.nodeId())).append(")</h3>\n");
                out.append("<p><strong>Change Type:</strong> ").append(node.changeType().label()).append("</p>\n");
                out.append("<p><strong>Severity:</strong> ").append(severitySpan(node.severity())).append("</p>\n");
                out.append("<p><strong>Description:</strong> ").append(escape(node.description())).append("</p>\n");
                if (!node.parameterChanges().isEmpty()) {
                    out.append("<h4>Parameter Changes:</h4>\n");
                    node.parameterChanges().forEach((name, change) -> out.append("<div class=\"parameter-change\"><strong>")
                            .append(escape(name)).append(":</strong> ").append(escape(parameterLine(change))).append("</div>\n"));
                }
                out.append("</div>\n");
            }
            out.append("</div>\n");
        }
        if (!diff.connectionDiffs().isEmpty()) {
            out.append("<div class=\"change-section\">\n<h2>Connection Changes</h2>\n");
            for (ConnectionDiff connection : diff.connectionDiffs()) {
                out.append("<div class=\"change-item ").append(cssClass(connection.changeType())).append("\">\n");
                out.append("<h3>Connection: ").append(escape(connection.source())).append(" &rarr; ")
                        .append(escape(connection.target())).append("</h3>\n");
                out.append("<p><strong>Change Type:</strong> ").append(connection.changeType().label()).append("</p>\n");
                out.append("<p><strong>Connection Type:</strong> ").append(escape(connection.connectionType())).append("</p>\n");
                out.append("<p><strong>Severity:</strong> ").append(severitySpan(connection.severity())).append("</p>\n");
                out.append("<p><strong>Description:</strong> ").append(escape(connection.description())).append("</p>\n");
                out.append("</div>\n");
            }
            out.append("</div>\n");
        }
        if (!diff.workflowChanges().isEmpty()) {
            out.append("<div class=\"change-section\">\n<h2>Workflow Changes</h2>\n<ul>\n");
            diff.workflowChanges().forEach((property, change) -> out.append("<li><strong>").append(escape(property))
                    .append(":</strong> ").append(escape(String.valueOf(change.oldValue()))).append(" &rarr; ")
                    .append(escape(String.valueOf(change.newValue()))).append("</li>\n"));
            out.append("</ul>\n</div>\n");
        }
        out.append("<div class=\"change-section\">\n<h2>Statistics</h2>\n<ul>\n");
        statistics(diff.statistics()).forEach((label, count) ->
                out.append("<li>").append(label).append(": ").append(count).append("</li>\n"));
        out.append("</ul>\n</div>\n</body>\n</html>\n");
        return out.toString();
    }

    public String json(WorkflowDiff diff) {
        try {
            return jsonMapper.writeValueAsString(diff);
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to serialize workflow diff", e);
        }
    }

    private static Map<String, Integer> statistics(DiffStatistics stats) {
        Map<String, Integer> rows = new LinkedHashMap<>();
        rows.put("Nodes Added", stats.nodesAdded());
        rows.put("Nodes Removed", stats.nodesRemoved());
        rows.put("Nodes Modified", stats.nodesModified());
        rows.put("Connections Added", stats.connectionsAdded());
        rows.put("Connections Removed", stats.connectionsRemoved());
        rows.put("Parameters Changed", stats.parametersChanged());
        rows.put("Workflow Settings Changed", stats.workflowSettingsChanged());
        return rows;
    }

    private static String parameterLine(ParameterChange change) {
        StringBuilder line = new StringBuilder(change.kind().value().replace("parameter_", ""));
        if (change.oldValue() != null) {
            line.append(" | Old: ").append(change.oldValue());
        }
        if (change.newValue() != null) {
            line.append(" | New: ").append(change.newValue());
        }
        return line.toString();
    }

    private static String severitySpan(DiffSeverity severity) {
        return "<span class=\"severity-" + severity.value() + "\">" + severity.name() + "</span>";
    }

    private static String cssClass(ChangeType type) {
        return type.value().replace('_', '-');
    }

    private static String duration(WorkflowDiff diff) {
        return String.format(Locale.ROOT, "%.2fms", diff.analysisDurationMs());
    }

    private static void heading(StringBuilder out, String title, char underline) {
        out.append(title).append('\n').append(String.valueOf(underline).repeat(title.length())).append('\n');
    }

    private static String escape(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value);
    }
}
