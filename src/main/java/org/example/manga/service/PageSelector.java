package org.example.manga.service;

import org.example.manga.model.PageRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Narrows a run to selected pages. Targets are separated by commas, {@code &} or "and"; a
 * numeric target matches any number in the page header, anything else matches header text.
 */
@Component
public class PageSelector {

    private static final Pattern SEPARATOR = Pattern.compile("\\s*(?:,|&|\\band\\b)\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMBER = Pattern.compile("\\d+");

    /**
     * Pages matching any target, in document order.
     */
    public List<PageRecord> select(List<PageRecord> pages, String selector) {
        List<String> targets = targets(selector);
        List<PageRecord> selected = new ArrayList<>();
        for (PageRecord page : pages) {
            if (targets.stream().anyMatch(target -> matches(page, target))) {
                selected.add(page);
            }
        }
        return selected;
    }

    /**
     * The first page matching the target and everything after it; empty when nothing matches.
     */
    public List<PageRecord> startingFrom(List<PageRecord> pages, String startPage) {
        String target = startPage.trim();
        for (int i = 0; i < pages.size(); i++) {
            if (matches(pages.get(i), target)) {
                return List.copyOf(pages.subList(i, pages.size()));
            }
        }
        return List.of();
    }

    boolean matches(PageRecord page, String target) {
        if (target.isEmpty()) {
            return false;
        }
        if (target.chars().allMatch(Character::isDigit)) {
            String wanted = stripLeadingZeros(target);
            Matcher numbers = NUMBER.matcher(page.header());
            while (numbers.find()) {
                if (stripLeadingZeros(numbers.group()).equals(wanted)) {
                    return true;
                }
            }
            return false;
        }
        return page.header().toLowerCase().contains(target.toLowerCase());
    }

    private static String stripLeadingZeros(String number) {
        return number.replaceFirst("^0+(?=\\d)", "");
    }

    private List<String> targets(String selector) {
        List<String> targets = new ArrayList<>();
        for (String part : SEPARATOR.split(selector.trim())) {
            if (!part.isBlank()) {
                targets.add(part.trim());
            }
        }
        return targets;
    }
}
