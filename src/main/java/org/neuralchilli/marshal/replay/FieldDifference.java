package org.neuralchilli.marshal.replay;

/**
 * One output field that differs between the original run and its replay.
 *
 * @param path dotted path into the step outputs, list elements as {@code [i]}
 */
public record FieldDifference(String path, Object original, Object replay) {
}
