/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.internal.thrift;

import java.io.IOException;

import dev.sapwood.metadata.LogicalType;
import dev.sapwood.metadata.LogicalType.TimeUnit;

import static dev.sapwood.internal.thrift.ThriftCompactReader.TYPE_BOOLEAN_FALSE;
import static dev.sapwood.internal.thrift.ThriftCompactReader.TYPE_BOOLEAN_TRUE;
import static dev.sapwood.internal.thrift.ThriftCompactReader.TYPE_BYTE;
import static dev.sapwood.internal.thrift.ThriftCompactReader.TYPE_I32;
import static dev.sapwood.internal.thrift.ThriftCompactReader.TYPE_STRUCT;

/**
 * Reader for the LogicalType union from Thrift Compact Protocol.
 */
public final class LogicalTypeReader {

    private LogicalTypeReader() {
    }

    /**
     * @return the logical type, or null for union members this reader does not know
     */
    public static LogicalType read(ThriftCompactReader reader) throws IOException {
        LogicalType[] result = new LogicalType[1];

        reader.readStruct(header -> {
            // Only one member is set; anything after it is skipped
            if (result[0] != null || !header.is(TYPE_STRUCT)) {
                return false;
            }
            switch (header.fieldId()) {
                case 1 -> result[0] = emptyMember(reader, new LogicalType.StringType());
                case 2 -> result[0] = emptyMember(reader, new LogicalType.MapType());
                case 3 -> result[0] = emptyMember(reader, new LogicalType.ListType());
                case 4 -> result[0] = emptyMember(reader, new LogicalType.EnumType());
                case 5 -> result[0] = readDecimalType(reader);
                case 6 -> result[0] = emptyMember(reader, new LogicalType.DateType());
                case 7 -> {
                    TimeFields time = readTimeFields(reader);
                    result[0] = new LogicalType.TimeType(time.adjustedToUtc, time.unit);
                }
                case 8 -> {
                    TimeFields time = readTimeFields(reader);
                    result[0] = new LogicalType.TimestampType(time.adjustedToUtc, time.unit);
                }
                case 10 -> result[0] = readIntType(reader);
                case 12 -> result[0] = emptyMember(reader, new LogicalType.JsonType());
                case 13 -> result[0] = emptyMember(reader, new LogicalType.BsonType());
                case 14 -> result[0] = emptyMember(reader, new LogicalType.UuidType());
                default -> {
                    return false;
                }
            }
            return true;
        });

        return result[0];
    }

    private static LogicalType emptyMember(ThriftCompactReader reader, LogicalType type) throws IOException {
        reader.readStruct(header -> false);
        return type;
    }

    private static LogicalType.DecimalType readDecimalType(ThriftCompactReader reader) throws IOException {
        int[] scaleAndPrecision = { -1, -1 };

        reader.readStruct(header -> {
            if ((header.fieldId() == 1 || header.fieldId() == 2) && header.is(TYPE_I32)) {
                scaleAndPrecision[header.fieldId() - 1] = reader.readI32();
                return true;
            }
            return false;
        });

        if (scaleAndPrecision[0] < 0 || scaleAndPrecision[1] <= 0) {
            throw new IOException("Invalid DecimalType: scale=" + scaleAndPrecision[0]
                    + ", precision=" + scaleAndPrecision[1]);
        }
        return new LogicalType.DecimalType(scaleAndPrecision[0], scaleAndPrecision[1]);
    }

    private static LogicalType.IntType readIntType(ThriftCompactReader reader) throws IOException {
        int[] bitWidth = { 8 };
        boolean[] signed = { true };

        reader.readStruct(header -> {
            if (header.fieldId() == 1 && header.is(TYPE_BYTE)) {
                bitWidth[0] = reader.readByte();
                return true;
            }
            if (header.fieldId() == 2 && isBoolean(header)) {
                signed[0] = header.booleanValue();
                return true;
            }
            return false;
        });

        return new LogicalType.IntType(bitWidth[0], signed[0]);
    }

    private static TimeFields readTimeFields(ThriftCompactReader reader) throws IOException {
        TimeFields fields = new TimeFields();

        reader.readStruct(header -> {
            if (header.fieldId() == 1 && isBoolean(header)) {
                fields.adjustedToUtc = header.booleanValue();
                return true;
            }
            if (header.fieldId() == 2 && header.is(TYPE_STRUCT)) {
                fields.unit = readTimeUnit(reader);
                return true;
            }
            return false;
        });

        return fields;
    }

    private static TimeUnit readTimeUnit(ThriftCompactReader reader) throws IOException {
        TimeUnit[] unit = { TimeUnit.MILLIS };

        reader.readStruct(header -> {
            switch (header.fieldId()) {
                case 1 -> unit[0] = TimeUnit.MILLIS;
                case 2 -> unit[0] = TimeUnit.MICROS;
                case 3 -> unit[0] = TimeUnit.NANOS;
                default -> throw new IOException("Unexpected time unit: " + header.fieldId());
            }
            // each member is an empty struct
            return false;
        });

        return unit[0];
    }

    private static boolean isBoolean(ThriftCompactReader.FieldHeader header) {
        return header.is(TYPE_BOOLEAN_TRUE) || header.is(TYPE_BOOLEAN_FALSE);
    }

    private static final class TimeFields {
        boolean adjustedToUtc = true;
        TimeUnit unit = TimeUnit.MILLIS;
    }
}
