package org.example.manga.story;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Block tree of a Markdown fragment. Headings nest by level, label lines
 * ({@code **Characters:**}) nest under the current heading, bullets nest by indentation
 * and plain text attaches to whatever block is open.
 */
final class StoryOutline {

    enum BlockType { ROOT, HEADING, LABEL, BULLET, TEXT }

    private static final Pattern HEADING = Pattern.compile("^\\s{0,3}(#{1,6})\\s+(.*?)\\s*#*\\s*$");
    private static final Pattern BULLET = Pattern.compile("^([ \\t]*)[-*+]\\s+(.*)$");
    private static final Pattern LABEL = Pattern.compile("^[A-Za-z][\\w '&/()-]{0,60}:$");

    private static final int LABEL_DEPTH = 10;
    private static final int BULLET_DEPTH = 20;
    private static final int TAB_WIDTH = 4;

    static final class Block {
        private final BlockType type;
        private final int depth;
        private final String text;
        private final String line;
        private final List<Block> children = new ArrayList<>();

        private Block(BlockType type, int depth, String text, String line) {
            this.type = type;
            this.depth = depth;
            this.text = text;
            this.line = line;
        }

        BlockType type() {
            return type;
        }

        /** Block text with Markdown markers stripped from the line start. */
        String text() {
            return text;
        }

        /** The unmodified source line. */
        String line() {
            return line;
        }

        List<Block> children() {
            return Collections.unmodifiableList(children);
        }

        /** Text of every descendant in document order. */
        List<String> descendantText() {
            List<String> lines = new ArrayList<>();
            collect(this, lines);
            return lines;
        }

        private static void collect(Block block, List<String> into) {
            for (Block child : block.children) {
                if (!child.text.isBlank()) {
                    into.add(child.text);
                }
                collect(child, into);
            }
        }
    }

    private final Block root;

    private StoryOutline(Block root) {
        this.root = root;
    }

    Block root() {
        return root;
    }

    static StoryOutline parse(String markdown) {
        Block root = new Block(BlockType.ROOT, 0, "", "");
        Deque<Block> open = new ArrayDeque<>();
        open.push(root);

        for (String line : markdown.split("\\R")) {
            if (line.isBlank()) {
                continue;
            }
            Block block = toBlock(line);
            if (block.type == BlockType.TEXT) {
                open.peek().children.add(block);
                continue;
            }
            while (open.peek().depth >= block.depth) {
                open.pop();
            }
            open.peek().children.add(block);
            open.push(block);
        }
        return new StoryOutline(root);
    }

    private static Block toBlock(String line) {
        Matcher heading = HEADING.matcher(line);
        if (heading.matches()) {
            return new Block(BlockType.HEADING, heading.group(1).length(), heading.group(2).trim(), line);
        }
        Matcher bullet = BULLET.matcher(line);
        if (bullet.matches()) {
            return new Block(BlockType.BULLET, BULLET_DEPTH + indentWidth(bullet.group(1)), bullet.group(2).trim(), line);
        }
        String plain = line.replace("*", "").replace("__", "").trim();
        if (LABEL.matcher(plain).matches()) {
            return new Block(BlockType.LABEL, LABEL_DEPTH, plain.substring(0, plain.length() - 1).trim(), line);
        }
        return new Block(BlockType.TEXT, Integer.MAX_VALUE, line.trim(), line);
    }

    private static int indentWidth(String indent) {
        int width = 0;
        for (char c : indent.toCharArray()) {
            width += c == '\t' ? TAB_WIDTH : 1;
        }
        return width;
    }
}
