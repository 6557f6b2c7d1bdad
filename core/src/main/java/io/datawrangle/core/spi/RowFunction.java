package io.datawrangle.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Row-wise custom function. Receives one row (input columns only) and returns the output value, or
 * an object whose fields map to several output columns.
 */
@FunctionalInterface
public interface RowFunction {

    JsonNode apply(ObjectNode row);
}
