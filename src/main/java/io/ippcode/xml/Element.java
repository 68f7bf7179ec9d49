package io.ippcode.xml;

import org.jetbrains.annotations.NotNull;

import static io.ippcode.Constants.INDENT_WIDTH;

public record Element(
        @NotNull String name,
        @NotNull Attribute @NotNull [] attributes,
        @NotNull Element @NotNull [] children,
        @NotNull String text
) {

    public void write(final @NotNull StringBuilder out, final int depth) {
        indent(out, depth);
        out.append('<').append(name);
        for (final var attribute : attributes) {
            attribute.write(out);
        }

        if (children.length == 0 && text.isEmpty()) {
            out.append(" />\n");
            return;
        }

        out.append('>');

        if (children.length == 0) {
            Escape.text(text, out);
        } else {
            out.append('\n');
            for (final var child : children) {
                child.write(out, depth + 1);
            }
            indent(out, depth);
        }

        out.append("</").append(name).append(">\n");
    }

    private static void indent(final @NotNull StringBuilder out, final int depth) {
        out.append(" ".repeat(depth * INDENT_WIDTH));
    }
}
