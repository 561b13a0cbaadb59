package com.prism.perspective.core.ingestion;

import com.prism.perspective.runtime.frame.Frame;

/**
 * Position and lookthrough records of one request.
 *
 * @param positions    one row per position, empty when the request holds none
 * @param lookthroughs one row per lookthrough, empty when the request holds none
 */
public record IngestedFrames(Frame positions, Frame lookthroughs) {

    public static IngestedFrames empty() {
        return new IngestedFrames(Frame.empty(), Frame.empty());
    }

    public boolean hasPositions() {
        return !positions.isEmpty();
    }

    public boolean hasLookthroughs() {
        return !lookthroughs.isEmpty();
    }
}
