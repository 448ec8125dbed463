package com.callperf.agent.record;

/**
 * Bounds applied when capturing call arguments.
 *
 * @param depthLimit     maximum object graph depth; deeper values are rendered as their type name
 * @param maxElements    maximum collection, array or map entries captured per container
 * @param maxValueLength maximum characters kept per captured value
 */
public record ArgumentLimits(int depthLimit, int maxElements, int maxValueLength) {

    public static ArgumentLimits defaults() {
        return new ArgumentLimits(2, 3, 256);
    }

    public static ArgumentLimits withMaxValueLength(int maxValueLength) {
        return new ArgumentLimits(2, 3, maxValueLength);
    }
}
