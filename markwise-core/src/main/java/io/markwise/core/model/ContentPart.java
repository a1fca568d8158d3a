package io.markwise.core.model;

import java.util.Objects;

public record ContentPart(String type, String text, String imageUrl) {
    public static final String TEXT = "text";
    public static final String IMAGE_URL = "image_url";

    public ContentPart {
        Objects.requireNonNull(type, "type must not be null");
    }

    public static ContentPart text(String text) {
        return new ContentPart(TEXT, text == null ? "" : text, null);
    }

    public static ContentPart image(String url) {
        return new ContentPart(IMAGE_URL, null, Objects.requireNonNull(url, "url must not be null"));
    }

    public boolean isText() {
        return TEXT.equals(type);
    }

    public boolean isImage() {
        return IMAGE_URL.equals(type);
    }
}
