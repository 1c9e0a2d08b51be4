package com.automaker.core.persistence;

/**
 * Outcome of {@link AtomicJsonFiles#readWithRecovery}.
 *
 * @param data      the parsed value, or the supplied default
 * @param recovered true when the value came from anywhere but the main file
 * @param source    where the value came from
 * @param error     the main file's read error, when one occurred
 */
public record RecoveredJson<T>(
    T data,
    boolean recovered,
    Source source,
    String error
) {

    public enum Source {
        MAIN,
        TEMP,
        BACKUP,
        DEFAULT
    }
}
