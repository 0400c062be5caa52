package com.questrail.designer.internal.events;

import com.questrail.designer.api.Document;
import com.questrail.designer.api.EdgeCandidate;
import com.questrail.designer.api.Node;
import com.questrail.designer.api.NodePayload;
import com.questrail.designer.api.Port;
import com.questrail.designer.api.Position;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * DiagramAction
 * -----------------------------------------------------------------------------
 * Sealed hierarchy of the mutations a diagram store accepts.
 *
 * <h2>Role in the architecture</h2>
 * Actions are the only way a document changes. The store turns each public
 * operation into one action and hands it to the reducer, which either produces
 * a complete new state or rejects the action without side effects.
 *
 * <h2>Design constraints</h2>
 * <ul>
 *   <li>Actions are immutable and carry every value the reducer needs,
 *       including generated ids</li>
 *   <li>Actions carry no behavior other than {@link UpdatePayload#patch()}, which
 *       the reducer applies to the current payload</li>
 * </ul>
 */
public sealed interface DiagramAction
        permits DiagramAction.AddNode,
                DiagramAction.UpdatePayload,
                DiagramAction.ChangeBlockType,
                DiagramAction.MoveNode,
                DiagramAction.DeleteNode,
                DiagramAction.Connect,
                DiagramAction.DeleteEdge,
                DiagramAction.Clear,
                DiagramAction.Load,
                DiagramAction.Restore,
                DiagramAction.Select
{
    /**
     * Whether a successful application of this action belongs in undo history.
     * Selection changes do not.
     */
    default boolean recordsHistory() {
        return true;
    }

    record AddNode(Node node) implements DiagramAction {
        public AddNode {
            Objects.requireNonNull(node, "node");
        }
    }

    /**
     * Replaces the payload of {@code nodeId} with {@code patch(current)}. The
     * patch must keep the payload kind.
     */
    record UpdatePayload(String nodeId, UnaryOperator<NodePayload> patch) implements DiagramAction {
        public UpdatePayload {
            Objects.requireNonNull(nodeId, "nodeId");
            Objects.requireNonNull(patch, "patch");
        }

        @Override
        public String toString() {
            return "UpdatePayload[nodeId=" + nodeId + "]";
        }
    }

    /**
     * Switches a block to {@code blockType} with a fresh port and parameter
     * template.
     */
    record ChangeBlockType(String nodeId,
                           String blockType,
                           List<Port> inputs,
                           List<Port> outputs,
                           Map<String, Double> params) implements DiagramAction {
        public ChangeBlockType {
            Objects.requireNonNull(nodeId, "nodeId");
            Objects.requireNonNull(blockType, "blockType");
            inputs = List.copyOf(inputs);
            outputs = List.copyOf(outputs);
            params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
        }
    }

    record MoveNode(String nodeId, Position position) implements DiagramAction {
        public MoveNode {
            Objects.requireNonNull(nodeId, "nodeId");
            Objects.requireNonNull(position, "position");
        }
    }

    record DeleteNode(String nodeId) implements DiagramAction {
        public DeleteNode {
            Objects.requireNonNull(nodeId, "nodeId");
        }
    }

    record Connect(EdgeCandidate candidate, String edgeId) implements DiagramAction {
        public Connect {
            Objects.requireNonNull(candidate, "candidate");
            Objects.requireNonNull(edgeId, "edgeId");
        }
    }

    record DeleteEdge(String edgeId) implements DiagramAction {
        public DeleteEdge {
            Objects.requireNonNull(edgeId, "edgeId");
        }
    }

    record Clear() implements DiagramAction {}

    record Load(Document document) implements DiagramAction {
        public Load {
            Objects.requireNonNull(document, "document");
        }
    }

    /**
     * Puts back a document taken from undo history. Not recorded itself.
     */
    record Restore(Document document) implements DiagramAction {
        public Restore {
            Objects.requireNonNull(document, "document");
        }

        @Override
        public boolean recordsHistory() {
            return false;
        }
    }

    /**
     * Selects {@code nodeId}, or clears the selection when it is {@code null}.
     */
    record Select(String nodeId) implements DiagramAction {
        @Override
        public boolean recordsHistory() {
            return false;
        }
    }
}
