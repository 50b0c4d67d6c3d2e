package com.isobolt.generator.naming;

/**
 * Thrown when a name does not follow the expected naming convention.
 */
public class NameDecodeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String name;

    public NameDecodeException(String name, String problem) {
        super("Cannot decode \"" + name + "\": " + problem);
        this.name = name;
    }

    public NameDecodeException(String name, String problem, Throwable cause) {
        super("Cannot decode \"" + name + "\": " + problem, cause);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
