package ai.lineage.instructions;

import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Mines a parent task's instruction for the verbatim messages it intends to hand to its sub-tasks.
 *
 * <p>Two shapes are recognized:
 *
 * <ul>
 *   <li>numbered or bulleted steps containing a quoted literal right after a colon, e.g.
 *       {@code 1. **Message:** "Implement the parser"};
 *   <li>{@code <new_task>} delegation markup, whose {@code <message>} element is the child's instruction.
 * </ul>
 *
 * Fenced code blocks are skipped, and quoted tokens that look like file paths are not treated as instructions. The
 * scanner is best effort: malformed input yields fewer literals, never an exception.
 */
public final class SubInstructionExtractor {
    private static final Logger logger = LogManager.getLogger(SubInstructionExtractor.class);

    private static final Pattern STEP_MARKER = Pattern.compile("^\\s*(?:\\d{1,3}[.)]|[-*+])\\s+.*");
    private static final Pattern FENCE = Pattern.compile("^\\s*(?:```|~~~).*");
    private static final Pattern NEW_TASK =
            Pattern.compile("<\\s*new_task\\b[^>]*>(.*?)(?:<\\s*/\\s*new_task\\s*>|\\z)", Pattern.DOTALL);
    private static final Pattern MESSAGE =
            Pattern.compile("<\\s*message\\b[^>]*>(.*?)(?:<\\s*/\\s*message\\s*>|\\z)", Pattern.DOTALL);
    private static final Pattern MODE_ELEMENT =
            Pattern.compile("<\\s*mode\\b[^>]*>.*?<\\s*/\\s*mode\\s*>", Pattern.DOTALL);
    private static final Pattern ANY_TAG = Pattern.compile("<[^>]+>");
    private static final Pattern BARE_FILE_NAME = Pattern.compile("[\\w.-]+\\.[A-Za-z0-9]{1,5}");

    private SubInstructionExtractor() {
        // utility
    }

    private record Literal(int offset, String text) {}

    private record Span(int start, int end) {
        boolean contains(int offset) {
            return offset >= start && offset < end;
        }
    }

    /** Extracted sub-instructions in document order. Blank input yields an empty list. */
    public static List<String> extractSubInstructions(@Nullable String parentText) {
        if (parentText == null || parentText.isBlank()) {
            return List.of();
        }
        var text = InstructionKeys.normalizeLineBreaks(parentText);
        var lines = Splitter.on('\n').splitToList(text);

        var fenced = new ArrayList<Span>();
        var steps = new ArrayList<Span>();
        scanLines(lines, fenced, steps);

        var literals = new ArrayList<Literal>();
        for (var step : steps) {
            extractQuotedLiterals(text, step, literals);
        }
        extractDelegations(text, fenced, literals);

        literals.sort(Comparator.comparingInt(Literal::offset));
        var result = literals.stream().map(Literal::text).toList();
        logger.debug("Extracted {} sub-instruction(s) from {} step block(s)", result.size(), steps.size());
        return result;
    }

    /**
     * Splits the text into fenced regions and step blocks. A step ends at the next marker, a fence, or the end. Marker
     * and fence lines met while a quoted literal is open belong to that literal, unless the line itself opens a new
     * quoted label.
     */
    private static void scanLines(List<String> lines, List<Span> fenced, List<Span> steps) {
        int offset = 0;
        boolean inFence = false;
        int fenceStart = -1;
        int stepStart = -1;
        var quote = new QuoteTracker();

        for (var line : lines) {
            int lineEnd = offset + line.length();
            if (stepStart >= 0 && quote.isOpen() && !QuoteTracker.opensLiteral(line)) {
                quote.advance(line);
            } else if (FENCE.matcher(line).matches()) {
                if (stepStart >= 0) {
                    steps.add(new Span(stepStart, offset));
                    stepStart = -1;
                }
                if (inFence) {
                    fenced.add(new Span(fenceStart, lineEnd));
                } else {
                    fenceStart = offset;
                }
                inFence = !inFence;
                quote.reset();
            } else if (!inFence && STEP_MARKER.matcher(line).matches()) {
                if (stepStart >= 0) {
                    steps.add(new Span(stepStart, offset));
                }
                stepStart = offset;
                quote.reset();
                quote.advance(line);
            } else if (!inFence && stepStart >= 0) {
                quote.advance(line);
            }
            offset = lineEnd + 1;
        }

        int textEnd = Math.max(0, offset - 1);
        if (inFence) {
            fenced.add(new Span(fenceStart, textEnd));
        }
        if (stepStart >= 0) {
            steps.add(new Span(stepStart, textEnd));
        }
    }

    /**
     * Line-by-line view of the literal rules used by {@link #extractQuotedLiterals}: a quote opens right after a
     * colon and its decoration, and closes at the matching quote, honoring backslash escapes in straight quotes.
     */
    private static final class QuoteTracker {
        private char closer;
        private boolean afterLabel;
        private boolean openedAny;

        boolean isOpen() {
            return closer != 0;
        }

        void reset() {
            closer = 0;
            afterLabel = false;
        }

        static boolean opensLiteral(String line) {
            var scan = new QuoteTracker();
            scan.advance(line);
            return scan.openedAny;
        }

        void advance(String line) {
            int i = 0;
            while (i < line.length()) {
                char c = line.charAt(i);
                if (closer != 0) {
                    if (closer == '"' && c == '\\' && i + 1 < line.length()) {
                        char next = line.charAt(i + 1);
                        if (next == '"' || next == '\\') {
                            i += 2;
                            continue;
                        }
                    }
                    if (c == closer) {
                        closer = 0;
                    }
                    i++;
                    continue;
                }
                if (afterLabel) {
                    if (Character.isWhitespace(c) || c == '*' || c == '_') {
                        i++;
                        continue;
                    }
                    afterLabel = false;
                    char open = closingQuote(c);
                    if (open != 0) {
                        closer = open;
                        openedAny = true;
                        i++;
                        continue;
                    }
                }
                if (c == ':') {
                    afterLabel = true;
                }
                i++;
            }
        }
    }

    private static void extractQuotedLiterals(String text, Span step, List<Literal> out) {
        int i = step.start();
        while (i < step.end()) {
            if (text.charAt(i) != ':') {
                i++;
                continue;
            }
            int open = skipLabelDecoration(text, i + 1, step.end());
            if (open >= step.end()) {
                return;
            }
            char closer = closingQuote(text.charAt(open));
            if (closer == 0) {
                i++;
                continue;
            }

            var literal = new StringBuilder();
            int j = open + 1;
            boolean terminated = false;
            while (j < step.end()) {
                char c = text.charAt(j);
                if (closer == '"' && c == '\\' && j + 1 < step.end()) {
                    char next = text.charAt(j + 1);
                    if (next == '"' || next == '\\') {
                        literal.append(next);
                        j += 2;
                        continue;
                    }
                }
                if (c == closer) {
                    terminated = true;
                    break;
                }
                literal.append(c);
                j++;
            }

            var content = terminated ? literal.toString() : literal.toString().stripTrailing();
            if (!terminated) {
                logger.debug("Unterminated quote at offset {}; taking the rest of the step", open);
            }
            if (isInstructionLike(content)) {
                out.add(new Literal(open, content));
            }
            i = terminated ? j + 1 : step.end();
        }
    }

    /** Skips whitespace and closing bold/italic markers between a label's colon and its quote. */
    private static int skipLabelDecoration(String text, int from, int end) {
        int i = from;
        while (i < end) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c) || c == '*' || c == '_') {
                i++;
            } else {
                break;
            }
        }
        return i;
    }

    private static char closingQuote(char open) {
        return switch (open) {
            case '"' -> '"';
            case '“' -> '”';
            case '«' -> '»';
            default -> 0;
        };
    }

    private static void extractDelegations(String text, List<Span> fenced, List<Literal> out) {
        var matcher = NEW_TASK.matcher(text);
        while (matcher.find()) {
            int start = matcher.start();
            if (fenced.stream().anyMatch(span -> span.contains(start))) {
                continue;
            }
            var body = matcher.group(1);
            var message = MESSAGE.matcher(body);
            String content;
            if (message.find()) {
                content = message.group(1);
            } else {
                content = ANY_TAG.matcher(MODE_ELEMENT.matcher(body).replaceAll(" "))
                        .replaceAll(" ");
            }
            content = decodeXmlEntities(content.strip());
            if (!content.isBlank()) {
                out.add(new Literal(start, content));
            }
        }
    }

    static boolean isInstructionLike(String literal) {
        if (literal.isBlank()) {
            return false;
        }
        return !looksLikePath(literal);
    }

    static boolean looksLikePath(String literal) {
        var candidate = literal.strip();
        for (int i = 0; i < candidate.length(); i++) {
            if (Character.isWhitespace(candidate.charAt(i))) {
                return false;
            }
        }
        return candidate.indexOf('/') >= 0
                || candidate.indexOf('\\') >= 0
                || BARE_FILE_NAME.matcher(candidate).matches();
    }

    private static String decodeXmlEntities(String s) {
        if (s.indexOf('&') < 0) {
            return s;
        }
        return s.replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&apos;", "'")
                .replace("&#39;", "'")
                .replace("&amp;", "&");
    }
}
