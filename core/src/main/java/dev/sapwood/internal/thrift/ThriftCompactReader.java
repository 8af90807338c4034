/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.internal.thrift;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Reader for the Thrift Compact Protocol over a ByteBuffer.
 * Reference: https://github.com/apache/thrift/blob/master/doc/specs/thrift-compact-protocol.md
 */
public class ThriftCompactReader {

    static final byte TYPE_BOOLEAN_TRUE = 0x01;
    static final byte TYPE_BOOLEAN_FALSE = 0x02;
    static final byte TYPE_BYTE = 0x03;
    static final byte TYPE_I16 = 0x04;
    static final byte TYPE_I32 = 0x05;
    static final byte TYPE_I64 = 0x06;
    static final byte TYPE_DOUBLE = 0x07;
    static final byte TYPE_BINARY = 0x08;
    static final byte TYPE_LIST = 0x09;
    static final byte TYPE_SET = 0x0A;
    static final byte TYPE_MAP = 0x0B;
    static final byte TYPE_STRUCT = 0x0C;

    private final ByteBuffer buffer;
    private short lastFieldId = 0;

    /**
     * Creates a reader starting at the buffer's current position.
     */
    public ThriftCompactReader(ByteBuffer buffer) {
        this.buffer = buffer.slice().order(ByteOrder.LITTLE_ENDIAN);
    }

    /**
     * Creates a reader starting at the given absolute offset of the buffer.
     */
    public ThriftCompactReader(ByteBuffer buffer, int offset) {
        this.buffer = buffer.slice(offset, buffer.limit() - offset).order(ByteOrder.LITTLE_ENDIAN);
    }

    /**
     * Number of bytes consumed so far.
     */
    public int getBytesRead() {
        return buffer.position();
    }

    public long readVarint() throws EOFException {
        long result = 0;
        int shift = 0;
        while (buffer.hasRemaining()) {
            int b = buffer.get() & 0xFF;
            result |= (long) (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return result;
            }
            shift += 7;
        }
        throw new EOFException("Unexpected EOF while reading varint");
    }

    public long readZigzag() throws IOException {
        long n = readVarint();
        return (n >>> 1) ^ -(n & 1);
    }

    public byte readByte() throws EOFException {
        if (!buffer.hasRemaining()) {
            throw new EOFException("Unexpected EOF while reading byte");
        }
        return buffer.get();
    }

    public int readI32() throws IOException {
        return (int) readZigzag();
    }

    public long readI64() throws IOException {
        return readZigzag();
    }

    public String readString() throws IOException {
        return new String(readBinary(), StandardCharsets.UTF_8);
    }

    private byte[] readBinary() throws IOException {
        int length = (int) readVarint();
        if (length < 0 || buffer.remaining() < length) {
            throw new EOFException("Unexpected EOF while reading " + length + " bytes");
        }
        byte[] data = new byte[length];
        buffer.get(data);
        return data;
    }

    /**
     * Reads a field header, or returns null on the STOP marker.
     */
    public FieldHeader readFieldHeader() throws IOException {
        byte b = readByte();
        if (b == 0) {
            return null;
        }

        byte type = (byte) (b & 0x0F);
        int fieldIdDelta = (b & 0xF0) >> 4;
        short fieldId = fieldIdDelta == 0 ? (short) readZigzag() : (short) (lastFieldId + fieldIdDelta);

        lastFieldId = fieldId;
        return new FieldHeader(fieldId, type);
    }

    public CollectionHeader readListHeader() throws IOException {
        byte sizeAndType = readByte();
        int size = (sizeAndType >> 4) & 0x0F;
        byte elementType = (byte) (sizeAndType & 0x0F);
        if (size == 15) {
            size = (int) readVarint();
        }
        return new CollectionHeader(elementType, size);
    }

    /**
     * Reads a struct field by field until STOP. Fields the handler does not consume are skipped.
     * The field id context of the enclosing struct is restored afterwards.
     */
    public void readStruct(FieldHandler handler) throws IOException {
        short saved = lastFieldId;
        lastFieldId = 0;
        try {
            FieldHeader header;
            while ((header = readFieldHeader()) != null) {
                if (!handler.handle(header)) {
                    skipField(header.type());
                }
            }
        }
        finally {
            lastFieldId = saved;
        }
    }

    /**
     * Reads a list of structs, handing each element to the given reader.
     */
    public <T> void readStructList(ElementReader<T> elementReader, List<T> target) throws IOException {
        CollectionHeader listHeader = readListHeader();
        for (int i = 0; i < listHeader.size(); i++) {
            target.add(elementReader.read(this));
        }
    }

    public void skipField(byte type) throws IOException {
        switch (type) {
            case TYPE_BOOLEAN_TRUE, TYPE_BOOLEAN_FALSE -> {
                // value is carried by the type nibble
            }
            case TYPE_BYTE -> readByte();
            case TYPE_I16, TYPE_I32, TYPE_I64 -> readZigzag();
            case TYPE_DOUBLE -> {
                if (buffer.remaining() < Double.BYTES) {
                    throw new EOFException("Unexpected EOF while reading double");
                }
                buffer.position(buffer.position() + Double.BYTES);
            }
            case TYPE_BINARY -> readBinary();
            case TYPE_LIST, TYPE_SET -> {
                CollectionHeader listHeader = readListHeader();
                for (int i = 0; i < listHeader.size(); i++) {
                    skipElement(listHeader.elementType());
                }
            }
            case TYPE_MAP -> {
                int mapSize = (int) readVarint();
                if (mapSize > 0) {
                    byte keyAndValueTypes = readByte();
                    byte keyType = (byte) ((keyAndValueTypes >> 4) & 0x0F);
                    byte valueType = (byte) (keyAndValueTypes & 0x0F);
                    for (int i = 0; i < mapSize; i++) {
                        skipElement(keyType);
                        skipElement(valueType);
                    }
                }
            }
            case TYPE_STRUCT -> readStruct(header -> false);
            default -> throw new IOException("Unknown field type: " + type);
        }
    }

    // Booleans inside collections take a full byte, unlike boolean fields
    private void skipElement(byte type) throws IOException {
        if (type == TYPE_BOOLEAN_TRUE || type == TYPE_BOOLEAN_FALSE) {
            readByte();
        }
        else {
            skipField(type);
        }
    }

    @FunctionalInterface
    public interface FieldHandler {

        /**
         * @return true if the field value was consumed, false to have it skipped
         */
        boolean handle(FieldHeader header) throws IOException;
    }

    @FunctionalInterface
    public interface ElementReader<T> {

        T read(ThriftCompactReader reader) throws IOException;
    }

    public record FieldHeader(short fieldId, byte type) {

        public boolean is(byte expectedType) {
            return type == expectedType;
        }

        /**
         * For boolean fields the value is encoded in the type itself.
         */
        public boolean booleanValue() {
            return type == TYPE_BOOLEAN_TRUE;
        }
    }

    public record CollectionHeader(byte elementType, int size) {
    }
}
