package br.edu.ifba.journal.utils;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.UUID;

public final class UuidUtils {

    private static final SecureRandom random = new SecureRandom();

    // fixed namespace for chunk ids
    private static final UUID CHUNK_NAMESPACE = UUID.fromString("3f1c7d52-8a0e-5b6f-9c41-2d7e0a9b4c18");

    private UuidUtils() {
    }

    /**
     * Time-ordered random UUID (version 7 layout). Newer ids sort after older ones.
     */
    public static UUID randomV7() {
        final byte[] value = new byte[16];
        random.nextBytes(value);
        final ByteBuffer timestamp = ByteBuffer.allocate(Long.BYTES);
        timestamp.putLong(System.currentTimeMillis());
        System.arraycopy(timestamp.array(), 2, value, 0, 6);
        value[6] = (byte) ((value[6] & 0x0F) | 0x70);
        value[8] = (byte) ((value[8] & 0x3F) | 0x80);
        final ByteBuffer buf = ByteBuffer.wrap(value);
        return new UUID(buf.getLong(), buf.getLong());
    }

    /**
     * Name-based UUID (version 5). The same input always yields the same id, which keeps
     * re-run writes idempotent.
     */
    public static UUID deterministicV5(final String input) {
        try {
            final MessageDigest md = MessageDigest.getInstance("SHA-1");
            md.update(asBytes(CHUNK_NAMESPACE));
            md.update(input.getBytes(StandardCharsets.UTF_8));
            final ByteBuffer buf = ByteBuffer.wrap(md.digest());
            long msb = buf.getLong();
            long lsb = buf.getLong();

            msb = (msb & 0xFFFFFFFFFFFF0FFFL) | 0x0000000000005000L;
            lsb = (lsb & 0x3FFFFFFFFFFFFFFFL) | 0x8000000000000000L;
            return new UUID(msb, lsb);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 algorithm not available", e);
        }
    }

    private static byte[] asBytes(final UUID uuid) {
        final ByteBuffer bb = ByteBuffer.wrap(new byte[16]);
        bb.putLong(uuid.getMostSignificantBits());
        bb.putLong(uuid.getLeastSignificantBits());
        return bb.array();
    }
}
