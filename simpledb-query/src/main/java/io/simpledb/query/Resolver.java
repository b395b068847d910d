package io.simpledb.query;

@FunctionalInterface
public interface Resolver {
    boolean resolve(String first, String second);

    Resolver caseInsensitiveResolution = String::equalsIgnoreCase;
    Resolver caseSensitiveResolution = String::equals;
}
