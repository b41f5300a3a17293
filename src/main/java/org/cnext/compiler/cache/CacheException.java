package org.cnext.compiler.cache;

/**
 * Thrown when the symbol cache cannot be written or removed.
 */
public class CacheException extends RuntimeException {

    public CacheException(String message) {
        super(message);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
