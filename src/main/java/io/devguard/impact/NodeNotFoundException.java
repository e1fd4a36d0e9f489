package io.devguard.impact;

/**
 * The change target of a simulation does not exist in the snapshot.
 */
public class NodeNotFoundException extends Exception {

    private final String nodeId;
    private final long snapshotVersion;

    public NodeNotFoundException(String nodeId, long snapshotVersion) {
        super("Node not found in snapshot v" + snapshotVersion + ": " + nodeId);
        this.nodeId = nodeId;
        this.snapshotVersion = snapshotVersion;
    }

    public String nodeId() {
        return nodeId;
    }

    public long snapshotVersion() {
        return snapshotVersion;
    }
}
