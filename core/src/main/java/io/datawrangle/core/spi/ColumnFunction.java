package io.datawrangle.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Column-wise custom function. Receives every value of the input column in row order and returns
 * the same number of output values.
 */
@FunctionalInterface
public interface ColumnFunction {

    List<JsonNode> apply(List<JsonNode> values);
}
