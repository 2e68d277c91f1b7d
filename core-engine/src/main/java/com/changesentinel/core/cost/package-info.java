/**
 * Segment cost functions and the cached statistics they read.
 *
 * <p>
 * A {@link com.changesentinel.core.cost.PreprocessedSeries} is built once per
 * series. {@link com.changesentinel.core.cost.CostFunctions} binds it to one
 * family of the closed set in {@link com.changesentinel.core.model.CostFamily}
 * and returns a stateless {@link com.changesentinel.core.cost.CostFunction}
 * answering {@code cost} and {@code fit} queries in constant time (O(K) for the
 * nonparametric family).
 * </p>
 *
 * @since 1.0.0
 */
package com.changesentinel.core.cost;
