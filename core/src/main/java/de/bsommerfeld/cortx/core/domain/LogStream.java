package de.bsommerfeld.cortx.core.domain;

/**
 * Output stream a log line was read from.
 */
public enum LogStream {
    STDOUT,
    STDERR
}
