package io.tablegen.generators.java.merge;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Carries hand-written code across regeneration.
 *
 * <p>A preserved block is delimited by a pair of line comments sharing an id:
 * <pre>
 *   // &lt;generator-preserve custom-methods&gt;
 *   ...developer code...
 *   // &lt;/generator-preserve custom-methods&gt;
 * </pre>
 * The body is everything between the end of the begin-marker line and the start of the
 * end-marker line. The file on disk owns the body; the new template owns where the block sits.
 *
 * <p>Merge rules:
 * <ul>
 *   <li>no existing text: the generated text is returned unchanged</li>
 *   <li>id in both: the existing body replaces the generated one (one leading blank line and
 *       trailing whitespace trimmed)</li>
 *   <li>id only in the new text: the generated default body stays</li>
 *   <li>id only in the existing text: the block is dropped and reported as orphaned</li>
 * </ul>
 * Unclosed blocks are ignored; for duplicate ids the first block wins.
 */
public final class PreservationMerger {

    static final String TAG = "generator-preserve";

    private static final Pattern BEGIN = Pattern.compile("//[ \\t]*<" + TAG + "[ \\t]+([^>\\s]+)>");
    private static final Pattern ANY_MARKER = Pattern.compile("//[ \\t]*<(/?)" + TAG + "[ \\t]+([^>\\s]+)>");
    private static final Pattern LEADING_BLANK_LINE = Pattern.compile("^[ \\t]*\\r?\\n");

    private record Block(String id, int bodyStart, int bodyEnd) {}

    private PreservationMerger() {}

    /** {@code <generator-preserve id>}, the text a begin comment carries. */
    public static String beginTag(String id) {
        return "<" + TAG + " " + id + ">";
    }

    public static String endTag(String id) {
        return "</" + TAG + " " + id + ">";
    }

    public static String beginMarker(String id) {
        return "// " + beginTag(id);
    }

    public static String endMarker(String id) {
        return "// " + endTag(id);
    }

    public static String merge(String generated, String existing) {
        return mergeDetailed(generated, existing).content();
    }

    public static MergeResult mergeDetailed(String generated, String existing) {
        if (existing == null) {
            return new MergeResult(generated, List.of(), List.of());
        }

        Map<String, String> oldBodies = new LinkedHashMap<>();
        for (Block b : findBlocks(existing)) {
            oldBodies.putIfAbsent(b.id(), existing.substring(b.bodyStart(), b.bodyEnd()));
        }

        StringBuilder out = new StringBuilder(generated.length());
        List<String> preserved = new ArrayList<>();
        Set<String> templateIds = new HashSet<>();
        int pos = 0;
        for (Block b : findBlocks(generated)) {
            templateIds.add(b.id());
            String old = oldBodies.get(b.id());
            if (old == null) continue;
            preserved.add(b.id());

            String kept = cleanBody(old);
            if (kept.equals(cleanBody(generated.substring(b.bodyStart(), b.bodyEnd())))) continue;
            out.append(generated, pos, b.bodyStart()).append(kept);
            pos = b.bodyEnd();
        }
        out.append(generated, pos, generated.length());

        List<String> orphaned = new ArrayList<>();
        for (String id : oldBodies.keySet()) {
            if (!templateIds.contains(id)) orphaned.add(id);
        }
        return new MergeResult(out.toString(), preserved, orphaned);
    }

    /**
     * Whitespace normalization used to decide whether a file changed: LF line endings,
     * no trailing whitespace, exactly one final newline.
     */
    public static String normalize(String text) {
        String lf = text.replace("\r\n", "\n").replace('\r', '\n');
        return lf.stripTrailing() + "\n";
    }

    /**
     * Structural problems with the markers of {@code text}: end markers without a begin,
     * mismatched or nested pairs, unclosed blocks and duplicate ids. Empty when well formed.
     */
    public static List<String> validateMarkers(String text) {
        List<String> errors = new ArrayList<>();
        Deque<String> open = new ArrayDeque<>();
        Deque<Integer> openLines = new ArrayDeque<>();
        Set<String> seen = new HashSet<>();

        Matcher m = ANY_MARKER.matcher(text);
        int line = 1;
        int scanned = 0;
        while (m.find()) {
            line += countNewlines(text, scanned, m.start());
            scanned = m.start();
            boolean end = !m.group(1).isEmpty();
            String id = m.group(2);

            if (!end) {
                if (!open.isEmpty()) {
                    errors.add("line " + line + ": block '" + id + "' opened inside block '" + open.peek() + "'");
                }
                if (!seen.add(id)) {
                    errors.add("line " + line + ": duplicate block id '" + id + "'");
                }
                open.push(id);
                openLines.push(line);
            } else if (open.isEmpty()) {
                errors.add("line " + line + ": end marker '" + id + "' has no matching begin marker");
            } else {
                String expected = open.pop();
                openLines.pop();
                if (!expected.equals(id)) {
                    errors.add("line " + line + ": end marker '" + id + "' does not match open block '" + expected + "'");
                }
            }
        }
        while (!open.isEmpty()) {
            errors.add("line " + openLines.pop() + ": block '" + open.pop() + "' is never closed");
        }
        return errors;
    }

    private static List<Block> findBlocks(String text) {
        List<Block> blocks = new ArrayList<>();
        Matcher m = BEGIN.matcher(text);
        int from = 0;
        while (from < text.length() && m.find(from)) {
            String id = m.group(1);
            int lineEnd = text.indexOf('\n', m.end());
            if (lineEnd < 0) break;
            int bodyStart = lineEnd + 1;

            Matcher end = endPattern(id).matcher(text);
            if (!end.find(bodyStart)) {
                from = m.end();
                continue;
            }
            int bodyEnd = text.lastIndexOf('\n', end.start() - 1) + 1;
            blocks.add(new Block(id, bodyStart, Math.max(bodyStart, bodyEnd)));
            from = end.end();
        }
        return blocks;
    }

    private static Pattern endPattern(String id) {
        return Pattern.compile("//[ \\t]*</" + TAG + "[ \\t]+" + Pattern.quote(id) + ">");
    }

    private static String cleanBody(String body) {
        String s = LEADING_BLANK_LINE.matcher(body).replaceFirst("").stripTrailing();
        return s.isEmpty() ? "" : s + "\n";
    }

    private static int countNewlines(String text, int from, int to) {
        int n = 0;
        for (int i = from; i < to; i++) {
            if (text.charAt(i) == '\n') n++;
        }
        return n;
    }
}
