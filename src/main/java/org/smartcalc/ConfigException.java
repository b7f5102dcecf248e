package org.smartcalc;

/**
 * Problems reading or writing the configuration and variables files.
 */
public final class ConfigException extends RuntimeException {
    public ConfigException(String msg) { super(msg); }
    public ConfigException(String msg, Throwable cause) { super(msg, cause); }
}
