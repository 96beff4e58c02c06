package com.di.fragnova.transport;

/**
 * One fragment move. Lower {@code priority} values are serviced first.
 */
public record TransferRequest(String fragmentId, String sourceNode, String destNode, long sizeBytes, int priority) {

    public boolean isNoOp() {
        return sourceNode.equals(destNode);
    }
}
