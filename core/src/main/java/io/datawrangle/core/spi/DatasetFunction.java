package io.datawrangle.core.spi;

import io.datawrangle.core.model.Dataset;

/** Whole-dataset custom function. */
@FunctionalInterface
public interface DatasetFunction {

    Dataset apply(Dataset dataset);
}
