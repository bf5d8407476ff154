package io.authkeys.cli;

import io.authkeys.model.DiscoveredBinding;
import io.authkeys.model.ExpectedBinding;
import io.authkeys.model.HostAccount;
import io.authkeys.model.PairFailure;
import io.authkeys.model.ReconciliationResult;
import io.authkeys.runtime.RemediationPlan;
import io.authkeys.security.SensitiveDataMasker;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

final class ReportTables {
    private ReportTables() {
    }

    static String results(Collection<ReconciliationResult> results) {
        List<List<String>> rows = new ArrayList<>();
        for (ReconciliationResult r : results) {
            rows.add(List.of(r.account(), r.host(), r.keyType(), SensitiveDataMasker.abbreviate(r.keyMaterial()),
                    nullToEmpty(r.comment()), r.status().name()));
        }
        return render(List.of("User", "Host", "Key Type", "Key", "Label/Comment", "Status"), rows);
    }

    static String discovered(Collection<DiscoveredBinding> bindings) {
        List<List<String>> rows = new ArrayList<>();
        for (DiscoveredBinding b : bindings) {
            rows.add(List.of(b.host(), b.account(), b.keyType(), SensitiveDataMasker.abbreviate(b.keyMaterial()),
                    nullToEmpty(b.comment())));
        }
        return render(List.of("Host", "User", "Key Type", "Key", "Comment"), rows);
    }

    static String expected(Collection<ExpectedBinding> bindings) {
        List<List<String>> rows = new ArrayList<>();
        for (ExpectedBinding b : bindings) {
            rows.add(List.of(b.host(), b.account(), b.keyType(), SensitiveDataMasker.abbreviate(b.keyMaterial()),
                    nullToEmpty(b.identityLabel()), nullToEmpty(b.email())));
        }
        return render(List.of("Host", "User", "Key Type", "Key", "Label", "Email"), rows);
    }

    static String failures(Collection<PairFailure> failures) {
        List<List<String>> rows = new ArrayList<>();
        for (PairFailure f : failures) {
            rows.add(List.of(f.host(), f.account(), f.phase(), f.errorType(), nullToEmpty(f.message())));
        }
        return render(List.of("Host", "User", "Phase", "Error", "Message"), rows);
    }

    static String plans(Collection<RemediationPlan> plans) {
        List<List<String>> rows = new ArrayList<>();
        for (RemediationPlan p : plans) {
            rows.add(List.of(p.target().host(), p.target().account(), String.valueOf(p.entries().size()),
                    String.valueOf(p.added()), String.valueOf(p.revoked())));
        }
        return render(List.of("Host", "User", "Keys", "Added", "Revoked"), rows);
    }

    static String pairs(Collection<HostAccount> pairs) {
        List<List<String>> rows = new ArrayList<>();
        for (HostAccount pair : pairs) {
            rows.add(List.of(pair.host(), pair.account()));
        }
        return render(List.of("Host", "User"), rows);
    }

    static String render(List<String> headers, List<List<String>> rows) {
        int[] widths = new int[headers.size()];
        for (int i = 0; i < headers.size(); i++) {
            widths[i] = headers.get(i).length();
        }
        for (List<String> row : rows) {
            for (int i = 0; i < widths.length && i < row.size(); i++) {
                widths[i] = Math.max(widths[i], row.get(i).length());
            }
        }
        StringBuilder sb = new StringBuilder();
        String border = border(widths);
        sb.append(border);
        appendRow(sb, headers, widths);
        sb.append(border);
        for (List<String> row : rows) {
            appendRow(sb, row, widths);
        }
        sb.append(border);
        return sb.toString();
    }

    private static String border(int[] widths) {
        StringBuilder sb = new StringBuilder("+");
        for (int width : widths) {
            sb.append("-".repeat(width + 2)).append('+');
        }
        return sb.append('\n').toString();
    }

    private static void appendRow(StringBuilder sb, List<String> cells, int[] widths) {
        sb.append('|');
        for (int i = 0; i < widths.length; i++) {
            String cell = i < cells.size() ? cells.get(i) : "";
            sb.append(' ').append(cell).append(" ".repeat(widths[i] - cell.length())).append(" |");
        }
        sb.append('\n');
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
