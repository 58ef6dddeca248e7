package io.gamevault.state.observability;

import io.gamevault.state.engine.GameStateEngine;

import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(GameStateEngine.StatsOutcome stats) {
        return format(stats, null);
    }

    public static String format(GameStateEngine.StatsOutcome stats, String namespace) {
        StringBuilder sb = new StringBuilder();
        appendMapGauge(sb, "gamevault_tracked_rows", "Rows per tracking set", "set", stats.trackedRows());
        appendGauge(sb, "gamevault_conflicting_keys", "Keys tracked by more than one active record", null, null, stats.conflictingKeys());
        appendGauge(sb, "gamevault_enforcement_enabled", "Whether write-time exclusivity is enforced (1=yes,0=no)", null, null, stats.enforcementEnabled());
        appendGauge(sb, "gamevault_tracking_writes_total", "Tracking writes seen by this process", "result", "accepted", stats.writesAccepted());
        appendGauge(sb, "gamevault_tracking_writes_total", "Tracking writes seen by this process", "result", "rejected", stats.writesRejected());
        appendGauge(sb, "gamevault_promotions_total", "Accepted writes that demoted a lower-priority record", null, null, stats.promotions());
        appendGauge(sb, "gamevault_bypassed_writes_total", "Writes that explicitly skipped the guard", null, null, stats.bypassedWrites());
        appendGauge(sb, "gamevault_removals_total", "Explicit user removals that deleted at least one record", null, null, stats.removals());
        appendGauge(sb, "gamevault_conflict_log_entries", "Rows in the conflict resolution log", null, null, stats.conflictLogEntries());
        appendGauge(sb, "gamevault_state_history_entries", "Rows in the state history ledger", null, null, stats.historyEntries());
        appendGauge(sb, "gamevault_usable_snapshot", "Whether a verified, undiscarded snapshot exists (1=yes,0=no)", null, null, stats.usableSnapshot());
        String base = sb.toString();
        String normalizedNamespace = namespace == null ? "" : namespace.trim();
        if (normalizedNamespace.isBlank()) {
            return base;
        }
        StringBuilder withNamespace = new StringBuilder(base.length() + 128);
        withNamespace.append(base);
        withNamespace.append("# HELP gamevault_namespace_info Runtime namespace marker\n");
        withNamespace.append("# TYPE gamevault_namespace_info gauge\n");
        withNamespace.append("gamevault_namespace_info{namespace=\"").append(escapeLabel(normalizedNamespace)).append("\"} 1\n");
        return withNamespace.toString();
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, Integer> values) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<String, Integer> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        if (sb.indexOf("# HELP " + metric + " ") < 0) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
