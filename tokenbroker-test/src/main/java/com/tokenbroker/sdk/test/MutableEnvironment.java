package com.tokenbroker.sdk.test;

import com.tokenbroker.sdk.util.Environment;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory environment variables that a test can change between calls.
 */
public class MutableEnvironment implements Environment {

    private final Map<String, String> variables = new ConcurrentHashMap<>();

    public MutableEnvironment() {
    }

    public MutableEnvironment(Map<String, String> initial) {
        variables.putAll(initial);
    }

    @Override
    public Optional<String> get(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    public MutableEnvironment set(String name, String value) {
        variables.put(name, value);
        return this;
    }

    public MutableEnvironment unset(String name) {
        variables.remove(name);
        return this;
    }

    public void clear() {
        variables.clear();
    }
}
