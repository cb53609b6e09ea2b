package com.ryuqq.repoup.core.descriptor;

import com.ryuqq.repoup.core.error.MalformedPackageException;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Minimal reader for the RPM lead, signature header and main header.
 *
 * <p>Only the tags needed for routing are decoded; the payload is never touched.</p>
 *
 * <pre>
 * lead (96 bytes, magic ED AB EE DB)
 * signature header (magic 8E AD E8 01, padded to 8 bytes)
 * main header      (magic 8E AD E8 01)
 *   header = magic(4) reserved(4) nindex(4) hsize(4) entries(16 * nindex) store(hsize)
 *   entry  = tag(4) type(4) offset(4) count(4)
 * </pre>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
final class RpmHeaderReader {

    static final int LEAD_SIZE = 96;

    static final int TAG_NAME = 1000;
    static final int TAG_VERSION = 1001;
    static final int TAG_RELEASE = 1002;
    static final int TAG_EPOCH = 1003;
    static final int TAG_ARCH = 1022;
    static final int TAG_SOURCERPM = 1044;

    static final int TYPE_INT32 = 4;
    static final int TYPE_STRING = 6;
    static final int TYPE_STRING_ARRAY = 8;
    static final int TYPE_I18NSTRING = 9;

    private static final byte[] LEAD_MAGIC = {(byte) 0xED, (byte) 0xAB, (byte) 0xEE, (byte) 0xDB};
    private static final byte[] HEADER_MAGIC = {(byte) 0x8E, (byte) 0xAD, (byte) 0xE8, 0x01};
    private static final int MAX_INDEX_ENTRIES = 0x10000;

    private RpmHeaderReader() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Whether the bytes start with the RPM lead magic.
     *
     * @param content artifact bytes
     * @return true if an RPM lead is present
     */
    static boolean hasLead(byte[] content) {
        return startsWith(content, 0, LEAD_MAGIC);
    }

    /**
     * Reads the routing-relevant header tags.
     *
     * @param content artifact bytes, starting with an RPM lead
     * @return decoded header values
     * @throws MalformedPackageException if the header structure is invalid or a required tag is missing
     */
    static RpmHeader read(byte[] content) {
        if (content.length < LEAD_SIZE || !hasLead(content)) {
            throw new MalformedPackageException("Missing RPM lead");
        }
        ByteBuffer buffer = ByteBuffer.wrap(content);

        Section signature = Section.parse(buffer, LEAD_SIZE, "signature");
        int mainOffset = align8(signature.end());
        Section main = Section.parse(buffer, mainOffset, "main");

        String name = main.string(TAG_NAME);
        String version = main.string(TAG_VERSION);
        String release = main.string(TAG_RELEASE);
        if (name == null || version == null || release == null) {
            throw new MalformedPackageException("RPM header lacks NAME, VERSION or RELEASE");
        }
        Integer epoch = main.int32(TAG_EPOCH);
        boolean source = !main.has(TAG_SOURCERPM);
        String arch = source ? "src" : main.string(TAG_ARCH);
        if (arch == null) {
            throw new MalformedPackageException("RPM header lacks ARCH");
        }
        return new RpmHeader(name, epoch, version, release, arch);
    }

    private static int align8(int offset) {
        return (offset + 7) & ~7;
    }

    private static boolean startsWith(byte[] content, int offset, byte[] magic) {
        if (content == null || content.length < offset + magic.length) {
            return false;
        }
        for (int i = 0; i < magic.length; i++) {
            if (content[offset + i] != magic[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Decoded main header values.
     */
    record RpmHeader(String name, Integer epoch, String version, String release, String arch) {
    }

    private record Entry(int type, int offset, int count) {
    }

    private record Section(ByteBuffer buffer, int storeStart, int end, Map<Integer, Entry> entries) {

        static Section parse(ByteBuffer buffer, int offset, String label) {
            byte[] array = buffer.array();
            if (!startsWith(array, offset, HEADER_MAGIC)) {
                throw new MalformedPackageException("Invalid RPM " + label + " header magic at offset " + offset);
            }
            if (array.length < offset + 16) {
                throw new MalformedPackageException("Truncated RPM " + label + " header");
            }
            int nindex = buffer.getInt(offset + 8);
            int hsize = buffer.getInt(offset + 12);
            if (nindex < 0 || nindex > MAX_INDEX_ENTRIES || hsize < 0) {
                throw new MalformedPackageException("Invalid RPM " + label + " header sizes");
            }
            int storeStart = offset + 16 + 16 * nindex;
            long end = (long) storeStart + hsize;
            if (end > array.length) {
                throw new MalformedPackageException("Truncated RPM " + label + " header store");
            }

            Map<Integer, Entry> entries = new HashMap<>();
            for (int i = 0; i < nindex; i++) {
                int entryOffset = offset + 16 + 16 * i;
                int tag = buffer.getInt(entryOffset);
                int type = buffer.getInt(entryOffset + 4);
                int dataOffset = buffer.getInt(entryOffset + 8);
                int count = buffer.getInt(entryOffset + 12);
                if (dataOffset < 0 || dataOffset >= hsize) {
                    continue;
                }
                entries.putIfAbsent(tag, new Entry(type, dataOffset, count));
            }
            return new Section(buffer, storeStart, (int) end, entries);
        }

        boolean has(int tag) {
            return entries.containsKey(tag);
        }

        String string(int tag) {
            Entry entry = entries.get(tag);
            if (entry == null) {
                return null;
            }
            if (entry.type() != TYPE_STRING && entry.type() != TYPE_I18NSTRING && entry.type() != TYPE_STRING_ARRAY) {
                throw new MalformedPackageException("RPM tag " + tag + " is not a string (type " + entry.type() + ")");
            }
            int start = storeStart + entry.offset();
            int stop = start;
            byte[] array = buffer.array();
            while (stop < end && array[stop] != 0) {
                stop++;
            }
            if (stop >= end) {
                throw new MalformedPackageException("Unterminated string for RPM tag " + tag);
            }
            return new String(array, start, stop - start, StandardCharsets.UTF_8);
        }

        Integer int32(int tag) {
            Entry entry = entries.get(tag);
            if (entry == null) {
                return null;
            }
            if (entry.type() != TYPE_INT32 || storeStart + entry.offset() + 4 > end) {
                throw new MalformedPackageException("RPM tag " + tag + " is not a valid INT32");
            }
            return buffer.getInt(storeStart + entry.offset());
        }
    }
}
