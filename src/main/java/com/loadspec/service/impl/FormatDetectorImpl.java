package com.loadspec.service.impl;

import com.loadspec.model.parse.FormatDetectionResult;
import com.loadspec.model.parse.HintKind;
import com.loadspec.model.parse.InputFormat;
import com.loadspec.model.parse.JsonBlock;
import com.loadspec.model.parse.ParsingHint;
import com.loadspec.model.parse.SourceSpan;
import com.loadspec.model.parse.StructuredData;
import com.loadspec.service.api.FormatDetector;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Scores input against the known {@link InputFormat}s.
 * <p>
 * Shell invocations and raw HTTP messages are unambiguous and short-circuit. Every other format
 * gets a heuristic score, scaled by a complexity factor derived from hint density and length.
 * The highest score wins; natural language wins ties.
 */
@Service
@Slf4j
public class FormatDetectorImpl implements FormatDetector {

    private static final Pattern METHOD = Pattern.compile("\\b(GET|POST|PUT|DELETE|PATCH|HEAD|OPTIONS)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern URL = Pattern.compile("https?://[^\\s<>\"{}|\\\\^`\\[\\]]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern HEADER_LINE = Pattern.compile("^\\s*[\\w-]+:(?!//)\\s*[^\\r\\n]+$", Pattern.MULTILINE);
    private static final Pattern USER_COUNT = Pattern.compile("\\b(\\d+)\\s*(users?|concurrent|parallel|threads?)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern CURL = Pattern.compile("\\bcurl\\s+(?:.*?\\s)?['\"]?https?://", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final List<Pattern> HTTP_RAW_INDICATORS = List.of(
            Pattern.compile("^(GET|POST|PUT|DELETE|PATCH|HEAD|OPTIONS)\\s+\\S+\\s+HTTP/\\d(\\.\\d)?", Pattern.MULTILINE),
            Pattern.compile("^Host:\\s*\\S+", Pattern.MULTILINE | Pattern.CASE_INSENSITIVE),
            Pattern.compile("^User-Agent:\\s*\\S+", Pattern.MULTILINE | Pattern.CASE_INSENSITIVE));
    private static final Pattern NATURAL_LANGUAGE_MARKERS = Pattern.compile(
            "\\b(test|load|performance|users?|requests?|endpoint|please|create|need|want)\\b", Pattern.CASE_INSENSITIVE);
    private static final List<String> NATURAL_LANGUAGE_PHRASES = List.of(
            "please", "can you", "i want", "i need", "create a test", "load test", "performance test", "test with", "simulate");

    private static final double VALID_BODY_CONFIDENCE = 0.9;
    private static final double SUSPECT_BODY_CONFIDENCE = 0.5;

    /**
     * {@inheritDoc}
     * <p>
     * Body hints are taken from the brace-matched JSON blocks in {@code data}: a parseable block
     * yields a 0.9 hint, a block that only looks like JSON a 0.5 hint.
     */
    @Override
    public FormatDetectionResult detectFormat(String input, StructuredData data) {
        String text = input == null ? "" : input;
        List<ParsingHint> hints = new ArrayList<>(extractHints(text));
        for (JsonBlock block : data.jsonBlocks()) {
            hints.add(new ParsingHint(HintKind.BODY, block.text(),
                    block.valid() ? VALID_BODY_CONFIDENCE : SUSPECT_BODY_CONFIDENCE, block.span()));
        }
        for (String url : data.urls()) {
            boolean known = hints.stream().anyMatch(h -> h.kind() == HintKind.URL && h.value().equals(url));
            if (!known && url.startsWith("/")) {
                int start = Math.max(text.indexOf(url), 0);
                hints.add(new ParsingHint(HintKind.URL, url, 0.7, new SourceSpan(start, start + url.length())));
            }
        }

        Map<InputFormat, Double> scores = new EnumMap<>(InputFormat.class);
        for (InputFormat format : InputFormat.values()) {
            scores.put(format, 0.0);
        }

        if (CURL.matcher(text).find()) {
            log.debug("Detected curl invocation");
            return new FormatDetectionResult(InputFormat.CURL_COMMAND, 0.95, hints);
        }

        long rawIndicators = HTTP_RAW_INDICATORS.stream().filter(p -> p.matcher(text).find()).count();
        if (rawIndicators >= 2) {
            log.debug("Detected raw HTTP message");
            return new FormatDetectionResult(InputFormat.HTTP_RAW, 0.9, hints);
        } else if (rawIndicators == 1) {
            scores.put(InputFormat.HTTP_RAW, 0.6);
        }

        long distinctMethods = hints.stream()
                .filter(h -> h.kind() == HintKind.METHOD)
                .map(ParsingHint::value)
                .distinct()
                .count();
        long distinctUrls = hints.stream()
                .filter(h -> h.kind() == HintKind.URL)
                .map(ParsingHint::value)
                .distinct()
                .count();
        if (distinctMethods > 1 || distinctUrls > 1) {
            scores.put(InputFormat.CONCATENATED_REQUESTS, 0.8);
        }

        boolean hasBody = hints.stream().anyMatch(h -> h.kind() == HintKind.BODY);
        if (hasBody && textOutside(text, data.jsonBlocks()).length() > 20) {
            scores.put(InputFormat.JSON_WITH_TEXT, 0.7);
        }

        boolean structural = hints.stream().anyMatch(h ->
                h.kind() == HintKind.URL || h.kind() == HintKind.HEADERS || h.kind() == HintKind.METHOD);
        if (structural && NATURAL_LANGUAGE_MARKERS.matcher(text).find()) {
            scores.put(InputFormat.MIXED_STRUCTURED, 0.6);
        }

        String lower = text.toLowerCase(Locale.ROOT);
        double natural = 0.1;
        for (String phrase : NATURAL_LANGUAGE_PHRASES) {
            if (lower.contains(phrase)) {
                natural += 0.15;
            }
        }
        if (hints.isEmpty()) {
            natural += 0.4;
        }
        scores.put(InputFormat.NATURAL_LANGUAGE, Math.min(natural, 0.9));

        double complexity = complexity(text, hints);
        scores.replaceAll((format, score) -> score > 0 ? Math.min(score * complexity, 1.0) : score);

        InputFormat best = InputFormat.NATURAL_LANGUAGE;
        double bestScore = scores.get(best);
        for (Map.Entry<InputFormat, Double> entry : scores.entrySet()) {
            if (entry.getValue() > bestScore) {
                best = entry.getKey();
                bestScore = entry.getValue();
            }
        }
        log.debug("Format scores {} -> {}", scores, best.label());
        return new FormatDetectionResult(best, Math.min(bestScore, 1.0), hints);
    }

    @Override
    public List<ParsingHint> extractHints(String input) {
        List<ParsingHint> hints = new ArrayList<>();
        if (input == null || input.isEmpty()) {
            return hints;
        }
        Matcher method = METHOD.matcher(input);
        while (method.find()) {
            hints.add(hint(HintKind.METHOD, method.group().toUpperCase(Locale.ROOT), 0.9, method));
        }
        Matcher url = URL.matcher(input);
        while (url.find()) {
            hints.add(hint(HintKind.URL, InputPreprocessorImpl.trimUrl(url.group()), 0.95, url));
        }
        Matcher header = HEADER_LINE.matcher(input);
        while (header.find()) {
            hints.add(hint(HintKind.HEADERS, header.group().trim(), 0.8, header));
        }
        Matcher count = USER_COUNT.matcher(input);
        while (count.find()) {
            hints.add(new ParsingHint(HintKind.COUNT, count.group(1), 0.8, new SourceSpan(count.start(), count.end())));
        }
        return hints;
    }

    /**
     * Factor in {@code [0.7, 1.0]}: 0.05 per hint up to 0.2, plus up to 0.1 for long inputs.
     */
    static double complexity(String input, List<ParsingHint> hints) {
        double hintBonus = Math.min(hints.size() * 0.05, 0.2);
        double lengthBonus = Math.min(input.length() / 2000.0, 0.1);
        return Math.min(0.7 + hintBonus + lengthBonus, 1.0);
    }

    private static ParsingHint hint(HintKind kind, String value, double confidence, Matcher matcher) {
        return new ParsingHint(kind, value, confidence, new SourceSpan(matcher.start(), matcher.end()));
    }

    private static String textOutside(String text, List<JsonBlock> blocks) {
        StringBuilder sb = new StringBuilder();
        int cursor = 0;
        for (JsonBlock block : blocks) {
            int start = Math.min(Math.max(block.span().start(), cursor), text.length());
            sb.append(text, cursor, start);
            cursor = Math.min(Math.max(block.span().end(), cursor), text.length());
        }
        sb.append(text.substring(Math.min(cursor, text.length())));
        return sb.toString().trim();
    }
}
