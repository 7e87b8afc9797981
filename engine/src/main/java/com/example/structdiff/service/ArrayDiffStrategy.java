package com.example.structdiff.service;

import com.example.structdiff.model.ComparisonOptions;
import com.example.structdiff.model.DiffPath;
import com.fasterxml.jackson.databind.node.ArrayNode;

import java.util.List;

/**
 * Plans the comparison of two sequences as frames for the {@link StructuralDiffer} stack. A strategy
 * that needs nested results first returns a single {@link Frame.Kind#RESUME} frame.
 */
interface ArrayDiffStrategy {

    List<Frame> plan(DiffPath path, ArrayNode left, ArrayNode right, ComparisonOptions options);
}
