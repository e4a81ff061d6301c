package com.spiderhub.core.engine.rule;

import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates {@code selector@attr} rules against a jsoup element.
 */
final class RuleExtractor {

    private RuleExtractor() {
    }

    static String extract(Element root, String rule) {
        if (root == null || rule == null || rule.isBlank()) return "";

        String selector = rule;
        String attr = "text";
        int at = rule.lastIndexOf('@');
        if (at >= 0) {
            selector = rule.substring(0, at).trim();
            attr = rule.substring(at + 1).trim();
        }

        Element el = selector.isEmpty() ? root : root.selectFirst(selector);
        if (el == null) return "";

        switch (attr) {
            case "text":
                return el.text().trim();
            case "ownText":
                return el.ownText().trim();
            case "html":
                return el.html();
            default:
                String value = el.attr(attr);
                if (value.isEmpty() && attr.startsWith("data-")) {
                    // lazy-loaded images fall back to src
                    value = el.attr("src");
                }
                return value.trim();
        }
    }

    static String extractAbs(Element root, String rule, String baseUrl) {
        String value = extract(root, rule);
        if (value.isEmpty() || value.startsWith("http")) return value;
        if (value.startsWith("//")) return "https:" + value;
        if (value.startsWith("/")) return baseUrl + value;
        return value;
    }

    static Elements select(Element root, String selector) {
        if (root == null || selector == null || selector.isBlank()) return new Elements();
        return root.select(selector);
    }

    /**
     * First capture group of {@code pattern} in {@code value}, or {@code value} when there is no pattern or match.
     */
    static String capture(String value, String pattern) {
        if (value == null || pattern == null || pattern.isBlank()) return value;
        Matcher m = Pattern.compile(pattern).matcher(value);
        if (m.find()) return m.groupCount() >= 1 ? m.group(1) : m.group();
        return value;
    }
}
