package com.tessera.join;

import com.tessera.domain.ColumnType;
import com.tessera.domain.PredictorDescriptor;
import com.tessera.domain.ResultTable;
import com.tessera.domain.Values;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Storage types for persisted output.
 *
 * Prediction columns take the type of their declared dtype; a few well-known
 * prediction columns have fixed types; every other column is typed from its values.
 */
public final class OutputTypeMapper {

    private static final Map<String, ColumnType> FIXED = Map.of(
        "original_index", ColumnType.INTEGER,
        "confidence", ColumnType.FLOAT,
        "lower", ColumnType.FLOAT,
        "upper", ColumnType.FLOAT);

    private OutputTypeMapper() {
    }

    /**
     * @param predictor descriptor of the predictor, or null for plain queries
     */
    public static Map<String, ColumnType> columnTypes(ResultTable table, Map<String, String> predictorColumns,
                                                      PredictorDescriptor predictor) {
        Map<String, ColumnType> types = new LinkedHashMap<>();
        for (String column : table.getColumns()) {
            String source = predictorColumns.get(column);
            ColumnType type = null;
            if (source != null) {
                type = FIXED.get(source.toLowerCase(Locale.ROOT));
                if (type == null && predictor != null && predictor.getOutputTypes().containsKey(source)) {
                    type = fromDtype(predictor.getOutputTypes().get(source));
                }
            }
            types.put(column, type != null ? type : infer(table.column(column)));
        }
        return types;
    }

    /**
     * integer to INTEGER; float and quantity to FLOAT; date and datetime to DATETIME; anything else TEXT
     */
    public static ColumnType fromDtype(String dtype) {
        if (dtype == null) {
            return ColumnType.TEXT;
        }
        return switch (dtype.toLowerCase(Locale.ROOT)) {
            case "integer" -> ColumnType.INTEGER;
            case "float", "quantity" -> ColumnType.FLOAT;
            case "date", "datetime" -> ColumnType.DATETIME;
            default -> ColumnType.TEXT;
        };
    }

    /**
     * Type of the first non-null value; TEXT when every value is null
     */
    public static ColumnType infer(List<Object> values) {
        for (Object value : values) {
            if (value == null) {
                continue;
            }
            if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
                return ColumnType.INTEGER;
            }
            if (value instanceof BigDecimal) {
                return ((BigDecimal) value).scale() <= 0 ? ColumnType.INTEGER : ColumnType.FLOAT;
            }
            if (value instanceof Number) {
                return ColumnType.FLOAT;
            }
            // times of day have no TIMESTAMP form
            if (Values.isTemporal(value) && !Values.isTimeOfDay(value)) {
                return ColumnType.DATETIME;
            }
            return ColumnType.TEXT;
        }
        return ColumnType.TEXT;
    }
}
