package io.ippcode.util;

public interface Buildable<T> {

    T build();
}
