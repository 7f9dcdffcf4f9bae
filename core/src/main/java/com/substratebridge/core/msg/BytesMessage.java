package com.substratebridge.core.msg;

import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * Caller-side message holding a payload.
 * <p>
 * Deliberately keeps reference equality: see {@link Message}.
 * </p>
 */
@Getter
public class BytesMessage implements Message {

    private final byte[] data;

    public BytesMessage(byte[] data) {
        if (data == null) {
            throw new IllegalArgumentException("Message data cannot be null");
        }
        this.data = data;
    }

    public static BytesMessage of(String text) {
        return new BytesMessage(text.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return "BytesMessage@" + Integer.toHexString(System.identityHashCode(this)) + "[" + data.length + " bytes]";
    }
}
