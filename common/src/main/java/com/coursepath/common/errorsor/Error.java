package com.coursepath.common.errorsor;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/** The failed side; never holds an empty list. */
record Error<T>(List<String> messages) implements ErrorsOr<T> {
    Error {
        messages = List.copyOf(messages);
        if (messages.isEmpty()) throw new IllegalArgumentException("Errors must not be empty");
    }

    @Override
    public boolean isError() {
        return true;
    }

    @Override
    public Optional<T> getValue() {
        return Optional.empty();
    }

    @Override
    public List<String> getErrors() {
        return messages;
    }

    @Override
    public ErrorsOr<T> addPrefixIfError(String prefix) {
        return new Error<>(messages.stream().map(m -> prefix + m).toList());
    }

    @Override
    public <T1> T1 fold(Function<T, T1> onValue, Function<List<String>, T1> onError) {
        return onError.apply(messages);
    }
}
