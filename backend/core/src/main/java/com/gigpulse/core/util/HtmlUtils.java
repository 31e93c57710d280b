package com.gigpulse.core.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class HtmlUtils {
    private static final Pattern LINK_PATTERN = Pattern.compile(
            "<a\\s+[^>]*href\\s*=\\s*(['\"])(.*?)\\1",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL
    );
    private static final Pattern JSON_LD_PATTERN = Pattern.compile(
            "<script[^>]*type\\s*=\\s*['\"]application/ld\\+json['\"][^>]*>(.*?)</script>",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL
    );
    private static final Pattern TIME_DATETIME_PATTERN = Pattern.compile(
            "<time[^>]*datetime\\s*=\\s*['\"]([^'\"]+)['\"]",
            Pattern.CASE_INSENSITIVE
    );

    private HtmlUtils() {
    }

    public static List<String> extractLinks(String html) {
        Matcher matcher = LINK_PATTERN.matcher(html);
        List<String> links = new ArrayList<>();
        while (matcher.find()) {
            String link = matcher.group(2).trim();
            if (!link.isEmpty() && isAllowedLink(link)) {
                links.add(link);
            }
        }
        return links;
    }

    public static List<String> extractJsonLdBlocks(String html) {
        Matcher matcher = JSON_LD_PATTERN.matcher(html);
        List<String> blocks = new ArrayList<>();
        while (matcher.find()) {
            String block = matcher.group(1).trim();
            if (!block.isEmpty()) {
                blocks.add(block);
            }
        }
        return blocks;
    }

    public static Optional<String> extractFirstTimeDatetime(String html) {
        Matcher matcher = TIME_DATETIME_PATTERN.matcher(html);
        return matcher.find() ? Optional.of(matcher.group(1).trim()) : Optional.empty();
    }

    public static List<Double> extractDollarAmounts(String html, int fractionDigits) {
        Pattern pattern = Pattern.compile("\\$\\s?(\\d{1,3}\\.\\d{" + fractionDigits + "})(?!\\d)");
        Matcher matcher = pattern.matcher(html);
        List<Double> amounts = new ArrayList<>();
        while (matcher.find()) {
            amounts.add(Double.parseDouble(matcher.group(1)));
        }
        return amounts;
    }

    private static boolean isAllowedLink(String link) {
        String lowered = link.toLowerCase(Locale.ROOT);
        return !lowered.startsWith("mailto:") && !lowered.startsWith("javascript:") && !lowered.startsWith("#");
    }
}
