package com.example.roomhub.common;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Length-prefixed framing: a 4-byte big-endian length followed by that many bytes of UTF-8 JSON.
 * <p>
 * This is the only framing the protocol accepts. Payloads may contain newlines.
 */
public final class Frames {
    private Frames() {}

    public static final int HEADER_BYTES = 4;
    public static final int MAX_FRAME_BYTES = 1024 * 1024;

    public static byte[] encode(byte[] payload) {
        byte[] out = new byte[HEADER_BYTES + payload.length];
        int n = payload.length;
        out[0] = (byte) (n >>> 24);
        out[1] = (byte) (n >>> 16);
        out[2] = (byte) (n >>> 8);
        out[3] = (byte) n;
        System.arraycopy(payload, 0, out, HEADER_BYTES, n);
        return out;
    }

    /** Writes one frame. Does not flush. */
    public static void write(OutputStream out, byte[] payload) throws IOException {
        out.write(encode(payload));
    }

    public static byte[] read(InputStream in) throws IOException {
        return read(in, MAX_FRAME_BYTES);
    }

    /**
     * Reads one frame body.
     *
     * @return the body (possibly empty), or {@code null} on a clean EOF before the first header byte
     * @throws EOFException if the stream ends inside a frame
     * @throws FrameTooLargeException if the declared length is above {@code maxBytes}
     */
    public static byte[] read(InputStream in, int maxBytes) throws IOException {
        int b0 = in.read();
        if (b0 < 0) return null;
        byte[] rest = new byte[HEADER_BYTES - 1];
        readFully(in, rest);
        long len = ((long) b0 << 24) | ((rest[0] & 0xffL) << 16) | ((rest[1] & 0xffL) << 8) | (rest[2] & 0xffL);
        if (len > maxBytes) throw new FrameTooLargeException(len, maxBytes);

        byte[] body = new byte[(int) len];
        readFully(in, body);
        return body;
    }

    private static void readFully(InputStream in, byte[] buf) throws IOException {
        int off = 0;
        while (off < buf.length) {
            int r = in.read(buf, off, buf.length - off);
            if (r < 0) throw new EOFException("stream ended after " + off + " of " + buf.length + " bytes");
            off += r;
        }
    }
}
