package com.loadspec.service.impl;

import com.loadspec.config.ParserProperties;
import com.loadspec.model.parse.JsonBlock;
import com.loadspec.model.parse.SourceSpan;
import com.loadspec.model.parse.StructuredData;
import com.loadspec.service.api.InputPreprocessor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Default {@link InputPreprocessor}.
 * <p>
 * Extraction works on a "prose view" of the input in which URLs and JSON blocks are blanked out,
 * so a body key such as {@code "options"} or a path segment such as {@code /delete-user} is not
 * mistaken for an HTTP verb or a header.
 */
@Service
@Slf4j
public class InputPreprocessorImpl implements InputPreprocessor {

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t]+");
    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\\n{3,}");

    private static final Pattern ABSOLUTE_URL = Pattern.compile("https?://[^\\s'\"<>`]+");
    private static final Pattern RELATIVE_URL = Pattern.compile("(?<![^\\s'\"(=])/[\\w\\-./{}?=&%~:]+");
    private static final Pattern METHOD = Pattern.compile("\\b(GET|POST|PUT|DELETE|PATCH|HEAD|OPTIONS)\\b");

    private static final Pattern LINE_HEADER = Pattern.compile(
            "^[ \\t]*([A-Za-z][A-Za-z0-9-]*):[ \\t]*(?!//)([^\\r\\n\\\\]+)$", Pattern.MULTILINE);
    private static final Pattern QUOTED_HEADER = Pattern.compile(
            "['\"]([A-Za-z][A-Za-z0-9-]*)['\"]\\s*:\\s*['\"]([^'\"\\\\]+)['\"]");
    private static final Pattern CURL_HEADER = Pattern.compile(
            "(?:-H|--header)\\s+['\"]([A-Za-z][A-Za-z0-9-]*):\\s*([^'\"\\\\]+)['\"]");

    private static final Set<String> SINGLE_WORD_HEADERS = Set.of(
            "authorization", "accept", "host", "cookie", "origin", "referer", "connection",
            "pragma", "expect", "from", "range", "te", "upgrade", "via", "warning", "forwarded");

    private static final List<Pattern> REQUEST_SEPARATORS = List.of(
            Pattern.compile("\\n\\s*-{3,}\\s*(?:\\n|$)"),
            Pattern.compile("\\n\\s*={3,}\\s*(?:\\n|$)"),
            Pattern.compile("(?i)(?:^|\\n)\\s*request\\s*\\d*\\s*:\\s*"),
            Pattern.compile("\\n\\s*\\d+\\.\\s+(?=(?:GET|POST|PUT|DELETE|PATCH|HEAD|OPTIONS|curl)\\b)"));

    private final int maxInputLength;

    public InputPreprocessorImpl(ParserProperties properties) {
        this.maxInputLength = properties.getPreprocessing().getMaxInputLength();
    }

    /**
     * {@inheritDoc}
     * <p>
     * Control characters become spaces, line endings are unified to {@code \n}, blank runs collapse
     * to one space, lines are trimmed and three or more consecutive newlines become a blank line.
     */
    @Override
    public String sanitize(String rawInput) {
        if (rawInput == null || rawInput.isEmpty()) {
            return "";
        }
        String text = CONTROL_CHARS.matcher(rawInput).replaceAll(" ");
        text = text.replace("\r\n", "\n").replace('\r', '\n');
        text = HORIZONTAL_SPACE.matcher(text).replaceAll(" ");
        text = Arrays.stream(text.split("\n", -1))
                .map(String::trim)
                .collect(Collectors.joining("\n"));
        text = EXCESS_NEWLINES.matcher(text).replaceAll("\n\n").trim();

        if (text.length() > maxInputLength) {
            log.warn("Input of {} characters exceeds the {} character limit and was truncated", text.length(), maxInputLength);
            text = text.substring(0, maxInputLength);
        }
        return text;
    }

    @Override
    public StructuredData extractStructuredData(String input) {
        if (input == null || input.isBlank()) {
            return StructuredData.empty();
        }
        List<JsonBlock> jsonBlocks = extractJsonBlocks(input);
        String withoutJson = blank(input, jsonBlocks.stream().map(JsonBlock::span).collect(Collectors.toList()));

        List<String> urls = extractUrls(withoutJson);
        List<SourceSpan> urlSpans = new ArrayList<>();
        collectSpans(ABSOLUTE_URL, withoutJson, urlSpans);
        collectSpans(RELATIVE_URL, withoutJson, urlSpans);
        String prose = blank(withoutJson, urlSpans);

        List<String> methods = extractMethods(prose);
        Map<String, String> headers = extractHeaders(prose);

        log.debug("Extracted {} methods, {} urls, {} headers, {} json blocks",
                methods.size(), urls.size(), headers.size(), jsonBlocks.size());
        return new StructuredData(methods, urls, headers, jsonBlocks);
    }

    @Override
    public List<String> separateRequests(String input) {
        if (input == null || input.isBlank()) {
            return List.of();
        }
        List<String> chunks = List.of(input);
        for (Pattern separator : REQUEST_SEPARATORS) {
            List<String> next = new ArrayList<>();
            for (String chunk : chunks) {
                next.addAll(Arrays.asList(separator.split(chunk)));
            }
            chunks = next;
        }
        List<String> requests = chunks.stream()
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
        return requests.isEmpty() ? List.of(input.trim()) : requests;
    }

    /**
     * Scans for top-level JSON objects (and arrays of objects) using string-aware brace matching,
     * so nested structures are kept whole.
     */
    List<JsonBlock> extractJsonBlocks(String input) {
        List<JsonBlock> blocks = new ArrayList<>();
        int i = 0;
        while (i < input.length()) {
            char c = input.charAt(i);
            if (c == '{' || (c == '[' && nextNonSpaceIs(input, i + 1, '{'))) {
                int end = findMatchingBracket(input, i);
                boolean closed = end > i;
                String raw = closed ? input.substring(i, end + 1) : input.substring(i);
                JsonBlock block = toBlock(raw, i, closed ? end + 1 : input.length());
                if (block != null) {
                    blocks.add(block);
                    if (!closed) {
                        break;
                    }
                    i = end + 1;
                    continue;
                }
            }
            i++;
        }
        return blocks;
    }

    private JsonBlock toBlock(String raw, int start, int end) {
        SourceSpan span = new SourceSpan(start, end);
        if (JsonRepair.parseStrict(raw).isPresent()) {
            return new JsonBlock(raw, true, span);
        }
        var repaired = JsonRepair.parseRepaired(raw);
        if (repaired.isPresent()) {
            log.debug("Repaired malformed JSON block at offset {}", start);
            return new JsonBlock(JsonRepair.toJson(repaired.get()), true, span);
        }
        if (JsonRepair.looksLikeJson(raw)) {
            log.debug("Keeping unparseable JSON-like block at offset {}", start);
            return new JsonBlock(raw, false, span);
        }
        return null;
    }

    private static boolean nextNonSpaceIs(String input, int from, char expected) {
        for (int i = from; i < input.length(); i++) {
            char c = input.charAt(i);
            if (!Character.isWhitespace(c)) {
                return c == expected;
            }
        }
        return false;
    }

    /**
     * Returns the index of the bracket closing the one at {@code start}, or -1 when unbalanced.
     * Brackets inside string literals are ignored.
     */
    static int findMatchingBracket(String input, int start) {
        char open = input.charAt(start);
        char close = open == '{' ? '}' : ']';
        int depth = 1;
        boolean inString = false;
        boolean escape = false;
        for (int i = start + 1; i < input.length(); i++) {
            char c = input.charAt(i);
            if (escape) {
                escape = false;
                continue;
            }
            if (c == '\\' && inString) {
                escape = true;
                continue;
            }
            if (c == '"') {
                inString = !inString;
                continue;
            }
            if (!inString) {
                if (c == open) {
                    depth++;
                } else if (c == close && --depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private List<String> extractUrls(String text) {
        Set<String> urls = new LinkedHashSet<>();
        Matcher absolute = ABSOLUTE_URL.matcher(text);
        while (absolute.find()) {
            urls.add(trimUrl(absolute.group()));
        }
        Matcher relative = RELATIVE_URL.matcher(text);
        while (relative.find()) {
            String url = trimUrl(relative.group());
            if (url.length() > 1) {
                urls.add(url);
            }
        }
        return new ArrayList<>(urls);
    }

    static String trimUrl(String url) {
        String trimmed = url;
        while (!trimmed.isEmpty()) {
            char last = trimmed.charAt(trimmed.length() - 1);
            boolean strayBrace = last == '}' && trimmed.indexOf('{') < 0;
            if (".,;:)]'\"".indexOf(last) >= 0 || strayBrace) {
                trimmed = trimmed.substring(0, trimmed.length() - 1);
            } else {
                break;
            }
        }
        return trimmed;
    }

    private List<String> extractMethods(String prose) {
        Set<String> methods = new LinkedHashSet<>();
        Matcher matcher = METHOD.matcher(prose.toUpperCase(Locale.ROOT));
        while (matcher.find()) {
            methods.add(matcher.group(1));
        }
        return new ArrayList<>(methods);
    }

    private Map<String, String> extractHeaders(String prose) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (Pattern pattern : List.of(CURL_HEADER, LINE_HEADER, QUOTED_HEADER)) {
            Matcher matcher = pattern.matcher(prose);
            while (matcher.find()) {
                String key = matcher.group(1);
                if (!isHeaderName(key)) {
                    continue;
                }
                String value = cleanHeaderValue(matcher.group(2));
                if (!value.isEmpty()) {
                    headers.putIfAbsent(normalizeHeaderName(key), value);
                }
            }
        }
        return headers;
    }

    private static boolean isHeaderName(String key) {
        String lower = key.toLowerCase(Locale.ROOT);
        if (lower.equals("http") || lower.equals("https")) {
            return false;
        }
        return key.contains("-") || SINGLE_WORD_HEADERS.contains(lower);
    }

    private static String cleanHeaderValue(String value) {
        String cleaned = value.trim();
        while (cleaned.endsWith("'") || cleaned.endsWith("\"") || cleaned.endsWith("\\")) {
            cleaned = cleaned.substring(0, cleaned.length() - 1).trim();
        }
        while (cleaned.startsWith("'") || cleaned.startsWith("\"")) {
            cleaned = cleaned.substring(1).trim();
        }
        return cleaned;
    }

    /**
     * Title-cases each dash-separated segment: {@code content-type} becomes {@code Content-Type}.
     */
    static String normalizeHeaderName(String name) {
        return Arrays.stream(name.split("-"))
                .filter(part -> !part.isEmpty())
                .map(part -> Character.toUpperCase(part.charAt(0)) + part.substring(1).toLowerCase(Locale.ROOT))
                .collect(Collectors.joining("-"));
    }

    private static void collectSpans(Pattern pattern, String text, List<SourceSpan> spans) {
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            spans.add(new SourceSpan(matcher.start(), matcher.end()));
        }
    }

    /**
     * Replaces the given spans with spaces, keeping every other offset stable.
     */
    private static String blank(String text, List<SourceSpan> spans) {
        if (spans.isEmpty()) {
            return text;
        }
        char[] chars = text.toCharArray();
        for (SourceSpan span : spans) {
            for (int i = span.start(); i < Math.min(span.end(), chars.length); i++) {
                if (chars[i] != '\n') {
                    chars[i] = ' ';
                }
            }
        }
        return new String(chars);
    }
}
