package com.knowledge.curation.review;

import com.knowledge.curation.core.model.Item;
import com.knowledge.curation.core.model.ReviewQueueEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders the items of a review entry as text.
 * The first item is the baseline; every other item is shown as a line diff against it.
 */
public class ItemDiffRenderer {

    public String render(ReviewQueueEntry entry, List<Item> items) {
        StringBuilder out = new StringBuilder();
        out.append(String.format(Locale.ROOT, "[%s] %s  score=%.3f%n", entry.kind(), entry.id(), entry.score()));
        if (entry.note() != null) {
            out.append("note: ").append(entry.note()).append('\n');
        }
        for (int i = 0; i < items.size(); i++) {
            Item item = items.get(i);
            out.append(String.format(Locale.ROOT, "%d) %s [%s] %s%n", i + 1, item.getId(), item.getStatus(), item.getTitle()));
        }
        for (int i = 0; i < items.size(); i++) {
            for (int j = i + 1; j < items.size(); j++) {
                String a = items.get(i).getId();
                String b = items.get(j).getId();
                double score = entry.scoreBetween(a, b);
                if (score > 0) {
                    out.append(String.format(Locale.ROOT, "   %s ~ %s: %.3f%n", a, b, score));
                }
            }
        }
        return out.toString();
    }

    public String diff(List<Item> items) {
        if (items.isEmpty()) {
            return "";
        }
        Item base = items.get(0);
        StringBuilder out = new StringBuilder();
        for (int i = 1; i < items.size(); i++) {
            Item other = items.get(i);
            out.append("--- ").append(base.getId()).append('\n');
            out.append("+++ ").append(other.getId()).append('\n');
            for (String line : diffLines(text(base), text(other))) {
                out.append(line).append('\n');
            }
        }
        return out.toString();
    }

    private static List<String> text(Item item) {
        List<String> lines = new ArrayList<>();
        lines.add("title: " + item.getTitle());
        if (!item.getBody().isEmpty()) {
            lines.addAll(List.of(item.getBody().split("\\R")));
        }
        return lines;
    }

    /**
     * Line diff from the longest common subsequence; lines are prefixed with
     * {@code "  "}, {@code "- "} or {@code "+ "}.
     */
    static List<String> diffLines(List<String> left, List<String> right) {
        int n = left.size();
        int m = right.size();
        int[][] lcs = new int[n + 1][m + 1];
        for (int i = n - 1; i >= 0; i--) {
            for (int j = m - 1; j >= 0; j--) {
                lcs[i][j] = left.get(i).equals(right.get(j))
                        ? lcs[i + 1][j + 1] + 1
                        : Math.max(lcs[i + 1][j], lcs[i][j + 1]);
            }
        }
        List<String> out = new ArrayList<>();
        int i = 0;
        int j = 0;
        while (i < n && j < m) {
            if (left.get(i).equals(right.get(j))) {
                out.add("  " + left.get(i));
                i++;
                j++;
            } else if (lcs[i + 1][j] >= lcs[i][j + 1]) {
                out.add("- " + left.get(i++));
            } else {
                out.add("+ " + right.get(j++));
            }
        }
        while (i < n) {
            out.add("- " + left.get(i++));
        }
        while (j < m) {
            out.add("+ " + right.get(j++));
        }
        return out;
    }
}
