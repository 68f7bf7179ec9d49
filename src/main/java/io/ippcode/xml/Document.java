package io.ippcode.xml;

import org.jetbrains.annotations.NotNull;

public record Document(@NotNull Element root) {

    public static final String DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";

    public @NotNull String write() {
        final var out = new StringBuilder();
        out.append(DECLARATION).append('\n');
        root.write(out, 0);
        return out.toString();
    }
}
