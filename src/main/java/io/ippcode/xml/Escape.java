package io.ippcode.xml;

import org.jetbrains.annotations.NotNull;

/**
 * Entity escaping for element text and attribute values. Characters below
 * U+0020 are written as numeric character references, everything else that is
 * not markup passes through unchanged.
 */
public final class Escape {

    private Escape() {
    }

    public static void text(final @NotNull String value, final @NotNull StringBuilder out) {
        escape(value, false, out);
    }

    public static void attribute(final @NotNull String value, final @NotNull StringBuilder out) {
        escape(value, true, out);
    }

    private static void escape(final @NotNull String value, final boolean attribute, final @NotNull StringBuilder out) {
        for (int i = 0; i < value.length(); ++i) {
            final var c = value.charAt(i);
            switch (c) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '"' -> out.append(attribute ? "&quot;" : "\"");
                default -> {
                    if (c < 0x20) {
                        out.append("&#").append((int) c).append(';');
                    } else {
                        out.append(c);
                    }
                }
            }
        }
    }
}
