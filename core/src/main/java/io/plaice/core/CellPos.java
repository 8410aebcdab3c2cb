package io.plaice.core;

/** Absolute canvas coordinate; x grows right, y grows down. */
public record CellPos(int x, int y) {
}
