package com.regnet.layout;

/**
 * Grid cell of a node and its top-left pixel coordinate.
 */
public record GridPosition(int row, int column, int x, int y) {
}
