package com.codeact.core.turn;

import com.codeact.core.model.Action;
import com.codeact.core.model.RuntimeKind;
import com.codeact.core.model.StructuredResponse;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses raw model output into a {@link StructuredResponse}.
 *
 * <p>Recognised blocks:
 * <pre>
 *   &lt;think&gt; ... &lt;/think&gt;                          optional reasoning
 *   &lt;execute runtime="general-purpose"&gt; ... &lt;/execute&gt;  an action
 *   &lt;solution&gt; ... &lt;/solution&gt;                    the final answer
 * </pre>
 * A response must contain an action or a solution, never both. When several action
 * blocks are present the first one wins and the rest are counted as ignored. Text outside
 * any block is used as reasoning when there is no think block.
 */
@Component
public class ResponseParser {

    static final String THINK = "think";
    static final String EXECUTE = "execute";
    static final String SOLUTION = "solution";

    private static final Pattern OPENING_TAG = Pattern.compile(
            "<(think|execute|solution)(\\s[^>]*)?>", Pattern.CASE_INSENSITIVE);
    private static final Pattern STRAY_CLOSING_TAG = Pattern.compile(
            "</(think|execute|solution)\\s*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern RUNTIME_ATTRIBUTE = Pattern.compile(
            "runtime\\s*=\\s*(?:\"([^\"]*)\"|'([^']*)')", Pattern.CASE_INSENSITIVE);

    /**
     * @throws ResponseParseException when the text does not follow the block grammar
     */
    public StructuredResponse parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ResponseParseException("the response was empty");
        }
        List<Block> blocks = scan(raw);

        var reasoning = new StringBuilder();
        var outside = new StringBuilder();
        Block firstAction = null;
        int actionCount = 0;
        String solution = null;
        int cursor = 0;
        for (Block block : blocks) {
            outside.append(raw, cursor, block.start());
            cursor = block.end();
            switch (block.name()) {
                case THINK -> appendParagraph(reasoning, block.body().strip());
                case EXECUTE -> {
                    actionCount++;
                    if (firstAction == null) {
                        firstAction = block;
                    }
                }
                case SOLUTION -> {
                    if (solution == null) {
                        solution = block.body().strip();
                    }
                }
                default -> throw new IllegalStateException("Unexpected block " + block.name());
            }
        }
        outside.append(raw.substring(cursor));

        String leftover = outside.toString().strip();
        if (STRAY_CLOSING_TAG.matcher(leftover).find()) {
            throw new ResponseParseException("found a closing tag without a matching opening tag");
        }
        String finalReasoning = reasoning.length() > 0 ? reasoning.toString() : leftover;

        if (firstAction != null && solution != null) {
            throw new ResponseParseException("the response contains both an <execute> block and a <solution> block");
        }
        if (firstAction != null) {
            return StructuredResponse.action(finalReasoning, toAction(firstAction), actionCount - 1);
        }
        if (solution != null) {
            if (solution.isEmpty()) {
                throw new ResponseParseException("the <solution> block is empty");
            }
            return StructuredResponse.finalAnswer(finalReasoning, solution);
        }
        throw new ResponseParseException("the response contains neither an <execute> block nor a <solution> block");
    }

    private static Action toAction(Block block) {
        Matcher attribute = RUNTIME_ATTRIBUTE.matcher(block.attributes());
        if (!attribute.find()) {
            throw new ResponseParseException("the <execute> block has no runtime attribute; use one of "
                    + RuntimeKind.knownTags());
        }
        String tag = attribute.group(1) != null ? attribute.group(1) : attribute.group(2);
        Optional<RuntimeKind> runtime = RuntimeKind.fromTag(tag);
        if (runtime.isEmpty()) {
            throw new ResponseParseException("unknown runtime \"" + tag + "\"; use one of " + RuntimeKind.knownTags());
        }
        String source = stripCodeFence(block.body());
        if (source.isBlank()) {
            throw new ResponseParseException("the <execute> block is empty");
        }
        return new Action(runtime.get(), source);
    }

    private static List<Block> scan(String raw) {
        var blocks = new ArrayList<Block>();
        Matcher opening = OPENING_TAG.matcher(raw);
        int from = 0;
        while (from < raw.length() && opening.find(from)) {
            String name = opening.group(1).toLowerCase(Locale.ROOT);
            String attributes = opening.group(2) == null ? "" : opening.group(2);
            int bodyStart = opening.end();
            int close = indexOfIgnoreCase(raw, "</" + name + ">", bodyStart);
            if (close < 0) {
                throw new ResponseParseException("the <" + name + "> block is not terminated");
            }
            int end = close + name.length() + 3;
            blocks.add(new Block(name, attributes, raw.substring(bodyStart, close), opening.start(), end));
            from = end;
        }
        return blocks;
    }

    private static int indexOfIgnoreCase(String haystack, String needle, int from) {
        int limit = haystack.length() - needle.length();
        for (int i = from; i <= limit; i++) {
            if (haystack.regionMatches(true, i, needle, 0, needle.length())) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Models often wrap the snippet in a markdown fence inside the block.
     */
    static String stripCodeFence(String body) {
        String trimmed = body.strip();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        int firstNewline = trimmed.indexOf('\n');
        if (firstNewline < 0 || !trimmed.endsWith("```") || trimmed.length() < 6) {
            return trimmed;
        }
        return trimmed.substring(firstNewline + 1, trimmed.length() - 3).strip();
    }

    private static void appendParagraph(StringBuilder sb, String text) {
        if (text.isEmpty()) {
            return;
        }
        if (sb.length() > 0) {
            sb.append("\n\n");
        }
        sb.append(text);
    }

    private record Block(String name, String attributes, String body, int start, int end) {}
}
