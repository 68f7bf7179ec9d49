package io.ippcode.xml;

import org.jetbrains.annotations.NotNull;

public record Attribute(@NotNull String name, @NotNull String value) {

    public void write(final @NotNull StringBuilder out) {
        out.append(' ').append(name).append("=\"");
        Escape.attribute(value, out);
        out.append('"');
    }
}
