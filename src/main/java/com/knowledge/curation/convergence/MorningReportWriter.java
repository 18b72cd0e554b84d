package com.knowledge.curation.convergence;

import com.knowledge.curation.core.model.ManualReviewEntry;
import com.knowledge.curation.core.model.RoundSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Renders a {@link ConvergenceReport} as the Markdown summary read after an overnight run.
 *
 * <pre>
 * # Morning Report
 * ## Summary
 * ## Round Details     (one table row per round)
 * ## Manual Review Queue
 * ## Warnings          (only when there are any)
 * </pre>
 */
public class MorningReportWriter {
    private static final Logger log = LoggerFactory.getLogger(MorningReportWriter.class);

    public String render(ConvergenceReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Morning Report\n\n");
        if (report.dryRun()) {
            sb.append("_Dry run: nothing was changed._\n\n");
        }

        sb.append("## Summary\n");
        sb.append("- Session: ").append(report.sessionId()).append('\n');
        sb.append("- Initial active: ").append(report.initialActive()).append('\n');
        sb.append("- Final active: ").append(report.finalActive()).append('\n');
        sb.append("- Reduction: ").append(report.reduction())
                .append(" (").append(percent(report.reductionRate())).append(")\n");
        sb.append("- Rounds run: ").append(report.roundsRun()).append('\n');
        sb.append("- Stop reason: ").append(report.stopReason()).append('\n');
        sb.append('\n');

        sb.append("## Round Details\n");
        sb.append("| Round | Communities | Items | Auto merges | Merges | Kept | Splits | Manual Reviews | Conflicts | Improvement |\n");
        sb.append("| --- | --- | --- | --- | --- | --- | --- | --- | --- | --- |\n");
        for (RoundSummary round : report.rounds()) {
            sb.append("| ").append(round.round())
                    .append(" | ").append(round.communities())
                    .append(" | ").append(round.activeBefore()).append(" -> ").append(round.activeAfter())
                    .append(" | ").append(round.autoDedupMerges())
                    .append(" | ").append(round.merges())
                    .append(" | ").append(round.keptSeparate())
                    .append(" | ").append(round.splits())
                    .append(" | ").append(round.manualReviews())
                    .append(" | ").append(round.deferredConflicts())
                    .append(" | ").append(percent(round.improvementRate()))
                    .append(" |\n");
        }
        sb.append('\n');

        sb.append("## Manual Review Queue\n");
        if (report.manualReviewQueue().isEmpty()) {
            sb.append("- (none)\n");
        }
        for (ManualReviewEntry entry : report.manualReviewQueue()) {
            sb.append("- round ").append(entry.round()).append(": ").append(entry.communityId())
                    .append(" [").append(String.join(", ", entry.members())).append("]")
                    .append(String.format(Locale.ROOT, " avg=%.3f", entry.avgSimilarity()));
            if (entry.reason() != null) {
                sb.append(" (").append(entry.reason()).append(')');
            }
            sb.append('\n');
        }

        if (!report.warnings().isEmpty()) {
            sb.append("\n## Warnings\n");
            for (String warning : report.warnings()) {
                sb.append("- ").append(warning).append('\n');
            }
        }
        return sb.toString();
    }

    /**
     * Writes the report; a dry-run report gets a {@code .dryrun} suffix.
     *
     * @return the path actually written
     */
    public Path write(ConvergenceReport report, Path target) {
        Path path = report.dryRun()
                ? target.resolveSibling(target.getFileName() + ".dryrun")
                : target;
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            Files.writeString(path, render(report), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write morning report to " + path, e);
        }
        log.info("report.written path={} rounds={} stopReason={}", path, report.roundsRun(), report.stopReason());
        return path;
    }

    private static String percent(double ratio) {
        return String.format(Locale.ROOT, "%.2f%%", ratio * 100.0);
    }
}
