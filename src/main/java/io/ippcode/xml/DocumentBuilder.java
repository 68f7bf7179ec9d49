package io.ippcode.xml;

import io.ippcode.util.Buildable;
import org.jetbrains.annotations.NotNull;

import java.util.function.Consumer;

public final class DocumentBuilder implements Buildable<Document> {

    public static @NotNull DocumentBuilder create() {
        return new DocumentBuilder();
    }

    private Element root;

    private DocumentBuilder() {
    }

    public @NotNull DocumentBuilder root(final @NotNull Consumer<ElementBuilder> consumer) {
        final var builder = ElementBuilder.create();
        consumer.accept(builder);
        this.root = builder.build();
        return this;
    }

    @Override
    public @NotNull Document build() {
        if (root == null) {
            throw new IllegalStateException("missing document root");
        }

        return new Document(root);
    }
}
