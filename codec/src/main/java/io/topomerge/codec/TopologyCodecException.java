package io.topomerge.codec;

/**
 * Raised when a report cannot be decoded into a topology
 * (malformed JSON, counters outside the unsigned 64-bit range, null entries).
 */
public final class TopologyCodecException extends RuntimeException {
    public TopologyCodecException(String msg) {
        super(msg);
    }

    public TopologyCodecException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
