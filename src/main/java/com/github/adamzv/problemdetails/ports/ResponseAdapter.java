package com.github.adamzv.problemdetails.ports;

import com.github.adamzv.problemdetails.domain.RenderedProblem;

/**
 * Converts a rendered problem into the response type of a web framework. Implementations
 * build the response object only; writing it is left to the framework.
 *
 * @param <R> native response type
 */
@FunctionalInterface
public interface ResponseAdapter<R> {

  R adapt(RenderedProblem rendered);
}
