package com.jindex.persistence;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Binary form of one record.
 *
 * <p>Layout: {@code [count][key1 length][key1][type1][value1]...[keyN length][keyN][typeN][valueN]}.
 * Entries keep the record's iteration order so that re-serializing a restored
 * record yields identical bytes. Values of other types are stored as their
 * string form.
 */
public final class RecordCodec {
    static final byte TYPE_NULL = 0;
    static final byte TYPE_INT = 1;
    static final byte TYPE_LONG = 2;
    static final byte TYPE_FLOAT = 3;
    static final byte TYPE_DOUBLE = 4;
    static final byte TYPE_BOOLEAN = 5;
    static final byte TYPE_STRING = 6;

    private RecordCodec() {
    }

    public static void write(DataOutput out, Map<String, Object> record) throws IOException {
        out.writeInt(record.size());
        for (Map.Entry<String, Object> entry : record.entrySet()) {
            if (entry.getKey() == null) {
                throw new IllegalArgumentException("Record has a null field name: " + record);
            }
            writeString(out, entry.getKey());
            writeValue(out, entry.getValue());
        }
    }

    public static Map<String, Object> read(DataInput in) throws IOException {
        int count = in.readInt();
        if (count < 0) {
            throw new PersistenceCorruptException("Negative field count in record: " + count);
        }
        Map<String, Object> record = new LinkedHashMap<>();
        for (int i = 0; i < count; i++) {
            String key = readString(in);
            record.put(key, readValue(in));
        }
        return record;
    }

    private static void writeValue(DataOutput out, Object val) throws IOException {
        if (val == null) {
            out.writeByte(TYPE_NULL);
        } else if (val instanceof String) {
            out.writeByte(TYPE_STRING);
            writeString(out, (String) val);
        } else if (val instanceof Integer) {
            out.writeByte(TYPE_INT);
            out.writeInt((Integer) val);
        } else if (val instanceof Long) {
            out.writeByte(TYPE_LONG);
            out.writeLong((Long) val);
        } else if (val instanceof Float) {
            out.writeByte(TYPE_FLOAT);
            out.writeFloat((Float) val);
        } else if (val instanceof Double) {
            out.writeByte(TYPE_DOUBLE);
            out.writeDouble((Double) val);
        } else if (val instanceof Boolean) {
            out.writeByte(TYPE_BOOLEAN);
            out.writeBoolean((Boolean) val);
        } else {
            out.writeByte(TYPE_STRING);
            writeString(out, val.toString());
        }
    }

    private static Object readValue(DataInput in) throws IOException {
        byte type = in.readByte();
        switch (type) {
            case TYPE_NULL:
                return null;
            case TYPE_INT:
                return in.readInt();
            case TYPE_LONG:
                return in.readLong();
            case TYPE_FLOAT:
                return in.readFloat();
            case TYPE_DOUBLE:
                return in.readDouble();
            case TYPE_BOOLEAN:
                return in.readBoolean();
            case TYPE_STRING:
                return readString(in);
            default:
                throw new PersistenceCorruptException("Unknown value type code: " + type);
        }
    }

    static void writeString(DataOutput out, String value) throws IOException {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        out.writeInt(bytes.length);
        out.write(bytes);
    }

    static String readString(DataInput in) throws IOException {
        int length = in.readInt();
        if (length < 0) {
            throw new PersistenceCorruptException("Negative string length: " + length);
        }
        byte[] bytes = new byte[length];
        in.readFully(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
