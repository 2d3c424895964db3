package io.operable.core.tool;

import java.util.List;
import java.util.stream.Collectors;

public record CallResult(
    List<ContentBlock> content,
    boolean isError
) {
    public CallResult {
        content = List.copyOf(content);
    }

    public static CallResult text(String text) {
        return new CallResult(List.of(ContentBlock.text(text)), false);
    }

    public static CallResult error(String message) {
        return new CallResult(List.of(ContentBlock.text(message)), true);
    }

    public String text() {
        return content.stream().map(ContentBlock::text).collect(Collectors.joining("\n"));
    }
}
