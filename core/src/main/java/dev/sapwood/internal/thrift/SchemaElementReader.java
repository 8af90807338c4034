/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.internal.thrift;

import java.io.IOException;

import dev.sapwood.metadata.ConvertedType;
import dev.sapwood.metadata.LogicalType;
import dev.sapwood.metadata.PhysicalType;
import dev.sapwood.metadata.RepetitionType;
import dev.sapwood.metadata.SchemaElement;

import static dev.sapwood.internal.thrift.ThriftCompactReader.TYPE_BINARY;
import static dev.sapwood.internal.thrift.ThriftCompactReader.TYPE_I32;
import static dev.sapwood.internal.thrift.ThriftCompactReader.TYPE_STRUCT;

/**
 * Reader for SchemaElement from Thrift Compact Protocol.
 */
public final class SchemaElementReader {

    private SchemaElementReader() {
    }

    public static SchemaElement read(ThriftCompactReader reader) throws IOException {
        Fields fields = new Fields();

        reader.readStruct(header -> {
            if (header.fieldId() == 10) { // logicalType
                if (header.is(TYPE_STRUCT)) {
                    fields.logicalType = LogicalTypeReader.read(reader);
                    return true;
                }
                return false;
            }
            if (header.fieldId() == 4) { // name
                if (header.is(TYPE_BINARY)) {
                    fields.name = reader.readString();
                    return true;
                }
                return false;
            }
            if (!header.is(TYPE_I32)) {
                return false;
            }
            switch (header.fieldId()) {
                case 1 -> fields.type = PhysicalType.fromThriftValue(reader.readI32());
                case 2 -> fields.typeLength = reader.readI32();
                case 3 -> fields.repetitionType = RepetitionType.fromThriftValue(reader.readI32());
                case 5 -> fields.numChildren = reader.readI32();
                case 6 -> fields.convertedType = ConvertedType.fromThriftValue(reader.readI32());
                default -> {
                    // scale, precision and field_id are not needed
                    return false;
                }
            }
            return true;
        });

        if (fields.name == null) {
            throw new IOException("SchemaElement missing required field: name");
        }
        return new SchemaElement(fields.name, fields.type, fields.typeLength, fields.repetitionType,
                fields.numChildren, fields.convertedType, fields.logicalType);
    }

    private static final class Fields {
        String name;
        PhysicalType type;
        Integer typeLength;
        RepetitionType repetitionType;
        Integer numChildren;
        ConvertedType convertedType;
        LogicalType logicalType;
    }
}
