package com.vigil.valueflow.library;

/**
 * 库定义无法加载
 */
public class LibraryLoadException extends RuntimeException {

    public LibraryLoadException(String message) {
        super(message);
    }

    public LibraryLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
