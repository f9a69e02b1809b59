package org.example.manga.story;

import org.example.manga.model.EntityDefinition;
import org.example.manga.model.EntityKind;
import org.example.manga.model.PageRecord;
import org.example.manga.story.StoryOutline.Block;
import org.example.manga.story.StoryOutline.BlockType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a story document into global context and pages, and extracts the characters and
 * environments defined in the global context.
 */
@Service
public class StoryParser {

    private static final Logger log = LoggerFactory.getLogger(StoryParser.class);

    private static final Pattern PAGE_MARKER = Pattern.compile(
            "^[ \\t]*((?:#{1,3}[ \\t]*Page[ \\t]*\\d+|Page[ \\t]*\\d+:)[^\\n]*)$",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

    private static final Pattern IMAGE_PATH = Pattern.compile(
            "[\\w\\-./\\\\:]+\\.(?:png|jpg|jpeg|webp)", Pattern.CASE_INSENSITIVE);

    private static final Pattern DIALOGUE = Pattern.compile(
            "(?:^|\\n)\\s*(?:[-*]\\s*)?(?:\\*\\*)?([a-zA-Z0-9 '\\-]+?)(?:\\*\\*)?\\s*:\\s*[\"“](.*?)[\"”]");

    private static final Pattern BOLD_NAME = Pattern.compile("^\\*\\*(.+?)\\*\\*\\s*:?\\s*(.*)$");

    private static final Pattern PROPERTY_KEY = Pattern.compile(
            "^\\*\\*(?:Role|Vibe|Personality|Visuals|Appearance|Traits|Outfit|Features|Description|Look)\\s*:?\\*\\*\\s*:?\\s*",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern CHARACTER_VOCABULARY = Pattern.compile(
            "\\b(characters?|cast|persons?|personas?|roles?|protagonists?|antagonists?)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern ENVIRONMENT_VOCABULARY = Pattern.compile(
            "\\b(environments?|settings?|locations?)\\b", Pattern.CASE_INSENSITIVE);

    private static final int MIN_INLINE_DESCRIPTION = 5;
    private static final int MAX_DESCRIPTION_LINES = 20;
    private static final int MAX_NAME_LENGTH = 60;

    public record ParsedStory(String globalContext, List<PageRecord> pages) {}

    public record DialogueLine(String speaker, String line) {}

    public ParsedStory parse(String document) {
        String text = document == null ? "" : document;
        Matcher matcher = PAGE_MARKER.matcher(text);

        List<int[]> markers = new ArrayList<>();
        List<String> headers = new ArrayList<>();
        while (matcher.find()) {
            markers.add(new int[]{matcher.start(), matcher.end()});
            headers.add(matcher.group(1).replaceFirst("^#+\\s*", "").trim());
        }

        if (markers.isEmpty()) {
            log.debug("No page markers found, treating document as a single page");
            return new ParsedStory("", List.of(PageRecord.singlePage(text.trim())));
        }

        String globalContext = text.substring(0, markers.get(0)[0]).trim();
        List<PageRecord> pages = new ArrayList<>();
        Set<String> seenHeaders = new HashSet<>();
        for (int i = 0; i < markers.size(); i++) {
            int contentStart = markers.get(i)[1];
            int contentEnd = i + 1 < markers.size() ? markers.get(i + 1)[0] : text.length();
            String header = uniqueHeader(headers.get(i), seenHeaders);
            pages.add(new PageRecord(header, text.substring(contentStart, contentEnd).trim(), i));
        }

        log.debug("Parsed {} pages with {} chars of global context", pages.size(), globalContext.length());
        return new ParsedStory(globalContext, pages);
    }

    /**
     * Extracts character and environment definitions. Only blocks nested under a heading,
     * label or bold bullet whose title names a character or environment section are used.
     */
    public List<EntityDefinition> extractEntities(String globalContext) {
        if (globalContext == null || globalContext.isBlank()) {
            return List.of();
        }
        List<EntityDefinition> entities = new ArrayList<>();
        Set<String> seenNames = new HashSet<>();
        visit(StoryOutline.parse(globalContext).root(), null, entities, seenNames);
        log.debug("Extracted {} entity definitions", entities.size());
        return entities;
    }

    public List<String> extractImagePaths(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Set<String> paths = new LinkedHashSet<>();
        Matcher matcher = IMAGE_PATH.matcher(text);
        while (matcher.find()) {
            paths.add(matcher.group());
        }
        return new ArrayList<>(paths);
    }

    public List<DialogueLine> extractDialogue(String script) {
        if (script == null || script.isBlank()) {
            return List.of();
        }
        List<DialogueLine> lines = new ArrayList<>();
        Matcher matcher = DIALOGUE.matcher(script);
        while (matcher.find()) {
            lines.add(new DialogueLine(matcher.group(1).trim(), matcher.group(2).trim()));
        }
        return lines;
    }

    private void visit(Block block, EntityKind sectionKind, List<EntityDefinition> into, Set<String> seenNames) {
        for (Block child : block.children()) {
            if (child.type() == BlockType.TEXT) {
                continue;
            }
            if (child.type() == BlockType.BULLET) {
                visitBullet(child, sectionKind, into, seenNames);
                continue;
            }

            String title = stripEmphasis(child.text());
            EntityKind titleKind = vocabularyKind(title);
            if (titleKind != null) {
                visit(child, titleKind, into, seenNames);
            } else if (sectionKind != null && isValidName(title)) {
                String description = joinDescription(child.descendantText());
                add(into, seenNames, new EntityDefinition(title, description, sectionKind, child.line(), true));
            } else {
                if (sectionKind == null) {
                    log.debug("Skipping unvalidated section: {}", title);
                }
                visit(child, null, into, seenNames);
            }
        }
    }

    private void visitBullet(Block bullet, EntityKind sectionKind, List<EntityDefinition> into, Set<String> seenNames) {
        Matcher bold = BOLD_NAME.matcher(bullet.text());
        if (!bold.matches()) {
            visit(bullet, sectionKind, into, seenNames);
            return;
        }
        String name = trimColon(bold.group(1));
        String inline = trimColon(bold.group(2));

        EntityKind nameKind = vocabularyKind(name);
        if (nameKind != null) {
            visit(bullet, nameKind, into, seenNames);
            return;
        }
        if (sectionKind == null || !isValidName(name)) {
            return;
        }
        String description = inline.length() >= MIN_INLINE_DESCRIPTION
                ? inline
                : joinDescription(bullet.descendantText());
        add(into, seenNames, new EntityDefinition(name, description, sectionKind, bullet.line(), false));
    }

    private void add(List<EntityDefinition> into, Set<String> seenNames, EntityDefinition entity) {
        String key = entity.kind() + ":" + entity.name().toLowerCase();
        if (seenNames.add(key)) {
            into.add(entity);
        }
    }

    private static EntityKind vocabularyKind(String title) {
        if (CHARACTER_VOCABULARY.matcher(title).find()) {
            return EntityKind.CHARACTER;
        }
        if (ENVIRONMENT_VOCABULARY.matcher(title).find()) {
            return EntityKind.ENVIRONMENT;
        }
        return null;
    }

    private static boolean isValidName(String name) {
        if (name.isBlank() || name.length() > MAX_NAME_LENGTH) {
            return false;
        }
        if (name.toLowerCase().startsWith("page ")) {
            return false;
        }
        // All-caps phrases are usually section banners, not names
        return !(name.equals(name.toUpperCase()) && name.split("\\s+").length > 2);
    }

    private static String joinDescription(List<String> lines) {
        List<String> cleaned = new ArrayList<>();
        for (String line : lines) {
            if (cleaned.size() >= MAX_DESCRIPTION_LINES) {
                break;
            }
            String value = PROPERTY_KEY.matcher(line).replaceFirst("").trim();
            if (!value.isEmpty()) {
                cleaned.add(value);
            }
        }
        return String.join(" ", cleaned);
    }

    private static String uniqueHeader(String header, Set<String> seen) {
        String candidate = header;
        int suffix = 2;
        while (!seen.add(candidate.toLowerCase())) {
            candidate = header + " (" + suffix++ + ")";
        }
        if (!candidate.equals(header)) {
            log.warn("Duplicate page header '{}' renamed to '{}'", header, candidate);
        }
        return candidate;
    }

    private static String stripEmphasis(String text) {
        return trimColon(text.replace("*", "").replace("__", "").trim());
    }

    private static String trimColon(String text) {
        String value = text.trim();
        while (value.startsWith(":")) {
            value = value.substring(1).trim();
        }
        while (value.endsWith(":")) {
            value = value.substring(0, value.length() - 1).trim();
        }
        return value;
    }
}
