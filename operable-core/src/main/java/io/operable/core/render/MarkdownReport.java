package io.operable.core.render;

import java.util.List;
import java.util.Map;

/**
 * Builds the Markdown-like text returned by tools: headings, bullet field lists, nested bullets, fenced blocks and
 * two-column tables. Every tool renders its own record type through these primitives so reports share one layout.
 */
public final class MarkdownReport {
    private final StringBuilder out = new StringBuilder();

    public MarkdownReport heading(int level, String text) {
        separate();
        out.append("#".repeat(Math.max(1, level))).append(' ').append(text).append("\n\n");
        return this;
    }

    public MarkdownReport paragraph(String text) {
        separate();
        out.append(text).append("\n\n");
        return this;
    }

    public MarkdownReport line(String text) {
        out.append(text).append('\n');
        return this;
    }

    public MarkdownReport field(String label, Object value) {
        out.append("- **").append(label).append("**: ").append(value == null ? "" : value).append('\n');
        return this;
    }

    // Omitted entirely when the value is null or blank.
    public MarkdownReport optionalField(String label, String value) {
        if (value != null && !value.isBlank()) {
            field(label, value);
        }
        return this;
    }

    public MarkdownReport bullet(String text) {
        out.append("- ").append(text).append('\n');
        return this;
    }

    public MarkdownReport subBullet(String text) {
        out.append("  - ").append(text).append('\n');
        return this;
    }

    // "- **Label**:" followed by one nested bullet per entry; nothing when the collection is empty.
    public MarkdownReport fieldList(String label, List<String> items) {
        if (items == null || items.isEmpty()) {
            return this;
        }
        out.append("- **").append(label).append("**:\n");
        items.forEach(this::subBullet);
        return this;
    }

    public MarkdownReport fieldMap(String label, Map<String, String> entries) {
        if (entries == null || entries.isEmpty()) {
            return this;
        }
        out.append("- **").append(label).append("**:\n");
        entries.forEach((key, value) -> subBullet(key + ": " + value));
        return this;
    }

    public MarkdownReport numbered(List<String> items) {
        separate();
        for (int i = 0; i < items.size(); i++) {
            out.append(i + 1).append(". ").append(items.get(i)).append('\n');
        }
        return this;
    }

    public MarkdownReport codeBlock(String language, String text) {
        out.append("```").append(language == null ? "" : language).append('\n');
        out.append(text).append('\n');
        out.append("```\n");
        return this;
    }

    public MarkdownReport table(String firstHeader, String secondHeader, List<Map.Entry<String, String>> rows) {
        separate();
        out.append("| ").append(firstHeader).append(" | ").append(secondHeader).append(" |\n");
        out.append("| ").append("-".repeat(firstHeader.length())).append(" | ")
            .append("-".repeat(secondHeader.length())).append(" |\n");
        for (Map.Entry<String, String> row : rows) {
            out.append("| ").append(row.getKey()).append(" | ").append(row.getValue()).append(" |\n");
        }
        return this;
    }

    public MarkdownReport blankLine() {
        out.append('\n');
        return this;
    }

    public String render() {
        return out.toString().stripTrailing();
    }

    @Override
    public String toString() {
        return render();
    }

    private void separate() {
        int length = out.length();
        if (length == 0) {
            return;
        }
        if (out.charAt(length - 1) != '\n') {
            out.append("\n\n");
        } else if (length < 2 || out.charAt(length - 2) != '\n') {
            out.append('\n');
        }
    }
}
