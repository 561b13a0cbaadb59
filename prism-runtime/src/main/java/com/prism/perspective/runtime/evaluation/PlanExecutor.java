package com.prism.perspective.runtime.evaluation;

import com.prism.perspective.runtime.frame.Frame;
import com.prism.perspective.runtime.frame.FrameException;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Executes plan nodes for one collect run. A node reachable from several outputs is
 * evaluated once; its frame is reused by every consumer within the run.
 */
final class PlanExecutor {
    private static final Logger logger = Logger.getLogger(PlanExecutor.class.getName());

    private final Map<PlanNode, Frame> results = new IdentityHashMap<>();
    private int executedNodes;

    Frame execute(PlanNode node) {
        Frame cached = results.get(node);
        if (cached != null) {
            return cached;
        }
        Frame frame;
        try {
            frame = node.execute(this);
        } catch (FrameException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new FrameException("Failed to execute plan node: " + node.describe(), e);
        }
        executedNodes++;
        logger.finest(() -> "Executed " + node.describe() + " -> " + frame);
        results.put(node, frame);
        return frame;
    }

    int executedNodes() {
        return executedNodes;
    }
}
