package com.smurthy.ai.insights.extract;

import com.smurthy.ai.insights.decode.RowLayout;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything position-dependent about one procedure's response.
 *
 * @param rowListPath          indexes leading from the inner payload to the row list
 * @param dimensionCodes       dimension name to its position inside a row's dimension-info slot;
 *                             also the code sent in the request
 * @param honorsDateRange      false when the server ignores the requested dates and the rows must be filtered locally
 * @param correlatedDimensions true when every row carries all dimensions at once (query and page pairs)
 * @param permissionLevels     site permission code to name; only used by site rows
 * @param fields               field name to its index inside a record row; only used by record rows
 */
public record ProcedureLayout(
        SearchConsoleProcedure procedure,
        String rpcId,
        RowLayout rowLayout,
        List<Integer> rowListPath,
        Map<String, Integer> dimensionCodes,
        boolean honorsDateRange,
        boolean correlatedDimensions,
        Map<Integer, String> permissionLevels,
        Map<String, Integer> fields
) {

    public ProcedureLayout {
        if (rpcId == null || rpcId.isBlank()) {
            throw new IllegalArgumentException("rpcId is required for " + procedure);
        }
        if (rowListPath == null || rowListPath.isEmpty()) {
            throw new IllegalArgumentException("rowListPath is required for " + procedure);
        }
        rowListPath = List.copyOf(rowListPath);
        dimensionCodes = dimensionCodes == null ? Map.of() : Map.copyOf(dimensionCodes);
        permissionLevels = permissionLevels == null ? Map.of() : Map.copyOf(permissionLevels);
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }

    public Optional<Integer> dimensionCode(String dimension) {
        return Optional.ofNullable(dimensionCodes.get(dimension));
    }

    public Optional<Integer> fieldIndex(String field) {
        return Optional.ofNullable(fields.get(field));
    }
}
