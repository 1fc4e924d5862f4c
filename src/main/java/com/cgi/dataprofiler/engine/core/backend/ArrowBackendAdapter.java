package com.cgi.dataprofiler.engine.core.backend;

import com.cgi.dataprofiler.engine.core.chunk.ArrowChunk;
import com.cgi.dataprofiler.engine.core.chunk.BackendType;
import com.cgi.dataprofiler.engine.core.chunk.ColumnType;
import org.apache.arrow.vector.BaseIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.DateDayVector;
import org.apache.arrow.vector.DecimalVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.FloatingPointVector;
import org.apache.arrow.vector.LargeVarCharVector;
import org.apache.arrow.vector.UInt8Vector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.types.Types.MinorType;
import org.apache.arrow.vector.types.pojo.Field;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Adapter for Apache Arrow record batches.
 * Only registered when the Arrow vector classes are on the classpath.
 */
@Component
@ChunkBackend(BackendType.ARROW)
@ConditionalOnClass(name = "org.apache.arrow.vector.VectorSchemaRoot")
public class ArrowBackendAdapter extends AbstractBackendAdapter<ArrowChunk> {

    public ArrowBackendAdapter() {
        super(ArrowChunk.class);
    }

    @Override
    public BackendType getBackendType() {
        return BackendType.ARROW;
    }

    @Override
    protected List<String> columnNames(ArrowChunk chunk) {
        return chunk.getRoot().getSchema().getFields().stream()
                .map(Field::getName)
                .collect(Collectors.toList());
    }

    @Override
    protected int rowCount(ArrowChunk chunk) {
        return chunk.getRoot().getRowCount();
    }

    @Override
    protected ColumnReader reader(ArrowChunk chunk, String column) {
        FieldVector vector = chunk.getRoot().getVector(column);
        if (vector == null) {
            return null;
        }
        return new ArrowColumnReader(column, vector, mapType(vector.getMinorType()), chunk.getRoot().getRowCount());
    }

    /**
     * Maps an Arrow physical type onto the engine's logical types.
     *
     * @param minorType Arrow minor type
     * @return Logical column type
     */
    static ColumnType mapType(MinorType minorType) {
        switch (minorType) {
            case TINYINT:
            case SMALLINT:
            case INT:
            case BIGINT:
            case UINT1:
            case UINT2:
            case UINT4:
            case UINT8:
                return ColumnType.INTEGER;
            case FLOAT4:
            case FLOAT8:
            case DECIMAL:
                return ColumnType.FLOAT;
            case VARCHAR:
            case LARGEVARCHAR:
                return ColumnType.STRING;
            case BIT:
                return ColumnType.BOOLEAN;
            case DATEDAY:
            case DATEMILLI:
            case TIMESTAMPSEC:
            case TIMESTAMPMILLI:
            case TIMESTAMPMICRO:
            case TIMESTAMPNANO:
            case TIMESTAMPSECTZ:
            case TIMESTAMPMILLITZ:
            case TIMESTAMPMICROTZ:
            case TIMESTAMPNANOTZ:
                return ColumnType.DATE;
            default:
                return ColumnType.OTHER;
        }
    }

    private static final class ArrowColumnReader implements ColumnReader {
        private final String name;
        private final FieldVector vector;
        private final ColumnType type;
        private final int size;

        ArrowColumnReader(String name, FieldVector vector, ColumnType type, int size) {
            this.name = name;
            this.vector = vector;
            this.type = type;
            this.size = size;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public ColumnType type() {
            return type;
        }

        @Override
        public int size() {
            return size;
        }

        @Override
        public boolean isNull(int index) {
            if (vector.isNull(index)) {
                return true;
            }
            // NaN is a missing float
            return vector instanceof FloatingPointVector
                    && Double.isNaN(((FloatingPointVector) vector).getValueAsDouble(index));
        }

        @Override
        public Object get(int index) {
            if (isNull(index)) {
                return null;
            }
            switch (type) {
                case INTEGER:
                    return getInteger(index);
                case FLOAT:
                    return getDouble(index);
                case STRING:
                    return getString(index);
                case BOOLEAN:
                    return ((BitVector) vector).get(index) == 1;
                case DATE:
                    if (vector instanceof DateDayVector) {
                        return LocalDate.ofEpochDay(((DateDayVector) vector).get(index));
                    }
                    return vector.getObject(index);
                default:
                    return vector.getObject(index);
            }
        }

        @Override
        public double getDouble(int index) {
            if (vector instanceof FloatingPointVector) {
                return ((FloatingPointVector) vector).getValueAsDouble(index);
            }
            if (vector instanceof DecimalVector) {
                return ((DecimalVector) vector).getObject(index).doubleValue();
            }
            if (vector instanceof UInt8Vector) {
                return ((UInt8Vector) vector).getObjectNoOverflow(index).doubleValue();
            }
            return ((BaseIntVector) vector).getValueAsLong(index);
        }

        /**
         * Integer value as a Long, or a BigInteger for unsigned 64-bit values above Long.MAX_VALUE.
         */
        private Object getInteger(int index) {
            if (vector instanceof UInt8Vector) {
                BigInteger value = ((UInt8Vector) vector).getObjectNoOverflow(index);
                return value.bitLength() < Long.SIZE ? (Object) value.longValue() : value;
            }
            return ((BaseIntVector) vector).getValueAsLong(index);
        }

        @Override
        public String getString(int index) {
            if (vector instanceof VarCharVector) {
                return new String(((VarCharVector) vector).get(index), StandardCharsets.UTF_8);
            }
            return new String(((LargeVarCharVector) vector).get(index), StandardCharsets.UTF_8);
        }
    }
}
