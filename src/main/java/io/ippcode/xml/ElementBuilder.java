package io.ippcode.xml;

import com.carrotsearch.hppc.ObjectArrayList;
import com.carrotsearch.hppc.ObjectIndexedContainer;
import io.ippcode.util.Buildable;
import org.jetbrains.annotations.NotNull;

import java.util.function.Consumer;

/**
 * Builds an element. Attributes and children keep insertion order. An element
 * has either children or text, never both.
 */
public final class ElementBuilder implements Buildable<Element> {

    public static @NotNull ElementBuilder create() {
        return new ElementBuilder();
    }

    private String name;
    private String text = "";
    private final ObjectIndexedContainer<Attribute> attributes = new ObjectArrayList<>();
    private final ObjectIndexedContainer<Element> children = new ObjectArrayList<>();

    private ElementBuilder() {
    }

    public @NotNull ElementBuilder name(final @NotNull String name) {
        this.name = name;
        return this;
    }

    public @NotNull ElementBuilder attribute(final @NotNull String name, final @NotNull String value) {
        this.attributes.add(new Attribute(name, value));
        return this;
    }

    public @NotNull ElementBuilder attribute(final @NotNull String name, final int value) {
        return attribute(name, Integer.toString(value));
    }

    public @NotNull ElementBuilder text(final @NotNull String text) {
        this.text = text;
        return this;
    }

    public @NotNull ElementBuilder child(final @NotNull Consumer<ElementBuilder> consumer) {
        final var builder = ElementBuilder.create();
        consumer.accept(builder);
        this.children.add(builder.build());
        return this;
    }

    @Override
    public @NotNull Element build() {
        if (name == null) {
            throw new IllegalStateException("missing element name");
        }
        if (!text.isEmpty() && !children.isEmpty()) {
            throw new IllegalStateException("element '%s' has both text and children".formatted(name));
        }

        return new Element(name, attributes.toArray(Attribute.class), children.toArray(Element.class), text);
    }
}
