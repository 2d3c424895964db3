package io.operable.core.tool;

public record ContentBlock(String type, String text) {

    public static ContentBlock text(String text) {
        return new ContentBlock("text", text);
    }
}
