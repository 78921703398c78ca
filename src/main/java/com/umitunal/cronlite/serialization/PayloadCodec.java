package com.umitunal.cronlite.serialization;

/**
 * Interface for encoding and decoding stored scheduler records.
 *
 * @param <T> the type of record
 */
public interface PayloadCodec<T> {

    /**
     * Encode a record to bytes.
     */
    byte[] encode(T value);

    /**
     * Decode bytes to a record.
     */
    T decode(byte[] bytes);
}
