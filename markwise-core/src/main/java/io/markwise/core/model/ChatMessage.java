package io.markwise.core.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public record ChatMessage(MessageRole role, List<ContentPart> content) {

    public ChatMessage {
        Objects.requireNonNull(role, "role must not be null");
        content = content == null ? List.of() : List.copyOf(content);
    }

    public static ChatMessage system(String text) {
        return new ChatMessage(MessageRole.SYSTEM, List.of(ContentPart.text(text)));
    }

    public static ChatMessage user(String text) {
        return new ChatMessage(MessageRole.USER, List.of(ContentPart.text(text)));
    }

    public static ChatMessage user(List<ContentPart> parts) {
        return new ChatMessage(MessageRole.USER, parts);
    }

    public String text() {
        return content.stream()
            .filter(ContentPart::isText)
            .map(ContentPart::text)
            .collect(Collectors.joining());
    }

    public List<String> imageUrls() {
        return content.stream()
            .filter(ContentPart::isImage)
            .map(ContentPart::imageUrl)
            .toList();
    }
}
