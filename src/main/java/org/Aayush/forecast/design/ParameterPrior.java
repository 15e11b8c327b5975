package org.Aayush.forecast.design;

/**
 * One (parameter, prior distribution, prior scale) tuple of the model.
 *
 * @param parameter parameter name (for example {@code k}, {@code delta_3}, {@code yearly_sin_1}).
 * @param kind prior family, centered at zero.
 * @param scale prior scale (standard deviation or Laplace scale).
 */
public record ParameterPrior(String parameter, PriorKind kind, double scale) {
}
