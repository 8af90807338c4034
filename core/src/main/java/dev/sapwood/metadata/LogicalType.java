/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.metadata;

import java.util.Locale;

/**
 * Logical type annotation of a schema element. {@link #typeName()} yields the name the
 * inspector reports for fields carrying the annotation.
 */
public sealed interface LogicalType
        permits LogicalType.StringType, LogicalType.EnumType, LogicalType.UuidType, LogicalType.IntType,
        LogicalType.DecimalType, LogicalType.DateType, LogicalType.TimeType, LogicalType.TimestampType,
        LogicalType.JsonType, LogicalType.BsonType, LogicalType.ListType,
        LogicalType.MapType {

    String typeName();

    record StringType() implements LogicalType {
        @Override
        public String typeName() {
            return "string";
        }
    }

    record EnumType() implements LogicalType {
        @Override
        public String typeName() {
            return "enum";
        }
    }

    record UuidType() implements LogicalType {
        @Override
        public String typeName() {
            return "uuid";
        }
    }

    record DateType() implements LogicalType {
        @Override
        public String typeName() {
            return "date";
        }
    }

    record JsonType() implements LogicalType {
        @Override
        public String typeName() {
            return "json";
        }
    }

    record BsonType() implements LogicalType {
        @Override
        public String typeName() {
            return "bson";
        }
    }

    record ListType() implements LogicalType {
        @Override
        public String typeName() {
            return "list";
        }
    }

    record MapType() implements LogicalType {
        @Override
        public String typeName() {
            return "map";
        }
    }

    record IntType(int bitWidth, boolean isSigned) implements LogicalType {
        public IntType {
            if (bitWidth != 8 && bitWidth != 16 && bitWidth != 32 && bitWidth != 64) {
                throw new IllegalArgumentException("Invalid bit width: " + bitWidth);
            }
        }

        @Override
        public String typeName() {
            return (isSigned ? "int" : "uint") + bitWidth;
        }
    }

    record DecimalType(int scale, int precision) implements LogicalType {
        public DecimalType {
            if (precision <= 0) {
                throw new IllegalArgumentException("Precision must be positive: " + precision);
            }
            if (scale < 0) {
                throw new IllegalArgumentException("Scale cannot be negative: " + scale);
            }
        }

        @Override
        public String typeName() {
            return "decimal(" + precision + "," + scale + ")";
        }
    }

    record TimeType(boolean isAdjustedToUTC, TimeUnit unit) implements LogicalType {
        @Override
        public String typeName() {
            return "time(" + unit.name().toLowerCase(Locale.ROOT) + ")";
        }
    }

    record TimestampType(boolean isAdjustedToUTC, TimeUnit unit) implements LogicalType {
        @Override
        public String typeName() {
            return "timestamp(" + unit.name().toLowerCase(Locale.ROOT) + ")";
        }
    }

    enum TimeUnit {
        MILLIS,
        MICROS,
        NANOS
    }
}
