package com.knowledge.curation.review;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Parses reviewer input lines into {@link ReviewCommand}s.
 *
 * <pre>
 * merge [X] [-- note]
 * merge_ab [X]            merge_bc [X]
 * update &lt;id&gt; title=... | body=...
 * keep [note]
 * reject &lt;id&gt; &lt;reason&gt;
 * split a,b | c,d
 * diff    help    quit
 * </pre>
 */
public class ReviewCommandParser {

    public static final String HELP_TEXT = String.join("\n",
            "merge [X] [-- note]        merge all shown items into X (default: first shown)",
            "merge_ab [X] / merge_bc [X] merge one side of a drift triad",
            "update <id> title=...|body=...  edit an item",
            "keep [note]                keep the items separate",
            "reject <id> <reason>       reject an item",
            "split a,b | c,d            split into groups reviewed separately",
            "diff                       show differences",
            "help                       show this help",
            "quit                       save and exit");

    public ReviewCommand parse(String line) {
        if (line == null || line.isBlank()) {
            throw new InvalidCommandException("Empty command; type 'help' for the command list");
        }
        String trimmed = line.trim();
        int space = trimmed.indexOf(' ');
        String verb = (space < 0 ? trimmed : trimmed.substring(0, space)).toLowerCase(Locale.ROOT);
        String rest = space < 0 ? "" : trimmed.substring(space + 1).trim();

        return switch (verb) {
            case "merge" -> parseMerge(rest);
            case "merge_ab" -> ReviewCommand.mergeAB(optionalId(rest, verb));
            case "merge_bc" -> ReviewCommand.mergeBC(optionalId(rest, verb));
            case "update" -> parseUpdate(rest);
            case "keep" -> ReviewCommand.keep(rest.isEmpty() ? null : rest);
            case "reject" -> parseReject(rest);
            case "split" -> ReviewCommand.split(parseGroups(rest));
            case "diff" -> noArgs(ReviewCommand.Type.DIFF, rest);
            case "help", "?" -> ReviewCommand.of(ReviewCommand.Type.HELP);
            case "quit", "q", "exit" -> noArgs(ReviewCommand.Type.QUIT, rest);
            default -> throw new InvalidCommandException("Unknown command '" + verb + "'; type 'help'");
        };
    }

    private ReviewCommand parseMerge(String rest) {
        String target = rest;
        String note = null;
        int sep = rest.indexOf("--");
        if (sep >= 0) {
            target = rest.substring(0, sep).trim();
            note = rest.substring(sep + 2).trim();
            if (note.isEmpty()) {
                note = null;
            }
        }
        return ReviewCommand.merge(optionalId(target, "merge"), note);
    }

    private ReviewCommand parseUpdate(String rest) {
        int space = rest.indexOf(' ');
        if (rest.isEmpty() || space < 0) {
            throw new InvalidCommandException("Usage: update <id> title=...|body=...");
        }
        String id = rest.substring(0, space).trim();
        String title = null;
        String body = null;
        for (String part : rest.substring(space + 1).split("\\|")) {
            String assignment = part.trim();
            if (assignment.startsWith("title=")) {
                title = assignment.substring("title=".length()).trim();
            } else if (assignment.startsWith("body=")) {
                body = assignment.substring("body=".length()).trim();
            } else {
                throw new InvalidCommandException("Expected title=... or body=..., got '" + assignment + "'");
            }
        }
        if ((title != null && title.isEmpty()) || (body != null && body.isEmpty())) {
            throw new InvalidCommandException("Updated fields must not be empty");
        }
        return ReviewCommand.update(id, title, body);
    }

    private ReviewCommand parseReject(String rest) {
        int space = rest.indexOf(' ');
        if (rest.isEmpty() || space < 0) {
            throw new InvalidCommandException("Usage: reject <id> <reason>");
        }
        return ReviewCommand.reject(rest.substring(0, space).trim(), rest.substring(space + 1).trim());
    }

    private List<List<String>> parseGroups(String rest) {
        if (rest.isEmpty()) {
            throw new InvalidCommandException("Usage: split a,b | c,d");
        }
        List<List<String>> groups = new ArrayList<>();
        for (String part : rest.split("\\|")) {
            List<String> ids = Arrays.stream(part.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList();
            if (ids.isEmpty()) {
                throw new InvalidCommandException("Empty group in split");
            }
            groups.add(ids);
        }
        if (groups.size() < 2) {
            throw new InvalidCommandException("A split needs at least two groups");
        }
        return groups;
    }

    private String optionalId(String rest, String verb) {
        if (rest.isEmpty()) {
            return null;
        }
        if (rest.contains(" ")) {
            throw new InvalidCommandException("Usage: " + verb + " [id]");
        }
        return rest;
    }

    private ReviewCommand noArgs(ReviewCommand.Type type, String rest) {
        if (!rest.isEmpty()) {
            throw new InvalidCommandException(type.name().toLowerCase(Locale.ROOT) + " takes no arguments");
        }
        return ReviewCommand.of(type);
    }
}
