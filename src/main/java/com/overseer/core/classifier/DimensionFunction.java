package com.overseer.core.classifier;

import com.overseer.core.model.Request;

/**
 * Scores one dimension of a request on a unit scale ({@code 0.0} to {@code 1.0}).
 */
@FunctionalInterface
public interface DimensionFunction {

    double score(Request request, ClassificationRules rules);
}
