package com.abalone.core.ai;

import com.abalone.core.Board;
import com.abalone.core.Player;

/**
 * Static evaluation of a position. Higher values are better for {@code perspective}.
 */
@FunctionalInterface
public interface Evaluator {

    double evaluate(Board board, Player perspective);
}
