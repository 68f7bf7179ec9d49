package io.ippcode.util;

import io.ippcode.error.InternalException;
import org.jetbrains.annotations.NotNull;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;

public final class Resource {

    @FunctionalInterface
    public interface IOConsumer<T> {

        void accept(final @NotNull T t) throws IOException;
    }

    /**
     * read a classpath resource as stream.
     *
     * @param name     resource name
     * @param consumer stream consumer
     */
    public static void read(final @NotNull String name, final @NotNull IOConsumer<InputStream> consumer) {
        try (final var stream = Resource.class.getClassLoader().getResourceAsStream(name)) {
            if (stream == null)
                throw new FileNotFoundException("resource name '%s'".formatted(name));

            consumer.accept(stream);
        } catch (final IOException e) {
            Log.error("failed to read resource name '%s': %s", name, e);
            throw new InternalException("failed to read resource '%s'".formatted(name), e);
        }
    }

    private Resource() {
    }
}
